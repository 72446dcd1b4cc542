package com.moodsentinel.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.moodsentinel.core.model.FeatureSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads snapshots from a newline-delimited JSON file with snake_case keys.
 *
 * <pre>
 * {"subject_id":"u1","observed_at":"2024-05-01T10:00:00Z","avg_sentiment":-0.6,
 *  "engagement_score":0.5,"post_volume":3,"avg_post_volume":2.0,"crisis_keywords":[]}
 * </pre>
 *
 * <p>
 * Blank lines are ignored. Lines that do not parse are logged and skipped so
 * one bad record does not stop the batch. Every call reads from the start of
 * the file.
 * </p>
 */
public class JsonLinesFeatureSource implements FeatureSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesFeatureSource.class);

    private final Path path;
    private final ObjectMapper mapper;

    public JsonLinesFeatureSource(Path path) {
        this.path = Objects.requireNonNull(path, "Path must not be null");
        this.mapper = snapshotMapper();
    }

    /**
     * @return a mapper binding snake_case snapshot JSON
     */
    public static ObjectMapper snapshotMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Override
    public List<FeatureSnapshot> extract(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        List<FeatureSnapshot> snapshots = new ArrayList<>();
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while (snapshots.size() < limit && (line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    snapshots.add(mapper.readValue(line, FeatureSnapshot.class));
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping unreadable snapshot at {}:{} - {}", path, lineNo, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new SourceException("Failed to read snapshots from " + path, e);
        }
        return snapshots;
    }

    @Override
    public String describe() {
        return "jsonl:" + path;
    }
}
