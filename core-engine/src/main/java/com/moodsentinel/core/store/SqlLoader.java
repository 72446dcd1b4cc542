package com.moodsentinel.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads SQL from classpath resource files.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 *
 * <p>A trailing semicolon is stripped from each query.
 */
final class SqlLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SqlLoader.class);

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
        // utility class
    }

    /**
     * Load all named queries from a resource file.
     *
     * @param resourcePath path to the SQL file (e.g. "sql/queries.sql")
     * @return map of query names to SQL strings
     * @throws StoreException if the resource is missing or unreadable
     */
    static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();
        String currentName = null;
        StringBuilder current = new StringBuilder();

        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith(NAME_MARKER)) {
                store(queries, currentName, current);
                currentName = line.substring(NAME_MARKER.length()).trim();
                current = new StringBuilder();
            } else if (!line.startsWith("--") && !line.isEmpty() && currentName != null) {
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(line);
            }
        }
        store(queries, currentName, current);

        LOG.debug("Loaded {} SQL queries from {}", queries.size(), resourcePath);
        return queries;
    }

    /**
     * Load a schema file as individual statements.
     *
     * @param resourcePath path to the SQL file (e.g. "sql/schema.sql")
     * @return DDL statements in file order
     * @throws StoreException if the resource is missing or unreadable
     */
    static List<String> loadStatements(String resourcePath) {
        StringBuilder script = new StringBuilder();
        for (String line : readLines(resourcePath)) {
            if (!line.trim().startsWith("--")) {
                script.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String sql : script.toString().split(";")) {
            if (!sql.isBlank()) {
                statements.add(sql.trim());
            }
        }
        return statements;
    }

    private static void store(Map<String, String> queries, String name, StringBuilder sql) {
        if (name == null || sql.length() == 0) {
            return;
        }
        String text = sql.toString().trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        queries.put(name, text);
    }

    private static List<String> readLines(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new StoreException("SQL resource not found: " + resourcePath);
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read SQL resource: " + resourcePath, e);
        }
        return lines;
    }
}
