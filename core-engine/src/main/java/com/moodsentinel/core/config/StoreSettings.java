package com.moodsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * JDBC connection settings for the alert store.
 */
public class StoreSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String jdbcUrl = "jdbc:h2:mem:mood_sentinel;DB_CLOSE_DELAY=-1";
    private String username = "sa";
    private String password = "";

    void validate(List<String> errors) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            errors.add("store.jdbcUrl must be a JDBC URL, got: '" + jdbcUrl + "'");
        }
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    @Override
    public String toString() {
        // password intentionally omitted
        return "StoreSettings{jdbcUrl='" + jdbcUrl + "', username='" + username + "'}";
    }
}
