package com.moodsentinel.core.config;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Selects and parameterises the feature source.
 *
 * <p>
 * Supported types: {@code jsonl} (newline-delimited JSON file at
 * {@code path}).
 * </p>
 */
public class SourceSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String type = "jsonl";
    private String path = "";
    private int limit = 1_000;

    void validate(List<String> errors) {
        if (type == null || type.isBlank()) {
            errors.add("source.type is required");
        } else if (!"jsonl".equals(type)) {
            errors.add("Unknown source type: '" + type + "'. Supported: jsonl");
        }
        if (limit < 1) {
            errors.add("source.limit must be >= 1, got: " + limit);
        }
    }

    public String getType() {
        return type;
    }

    /**
     * Set the source type, normalised to lowercase.
     *
     * @param type source type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    @Override
    public String toString() {
        return "SourceSettings{type='" + type + "', path='" + path + "', limit=" + limit + '}';
    }
}
