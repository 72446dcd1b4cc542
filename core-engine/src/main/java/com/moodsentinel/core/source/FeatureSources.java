package com.moodsentinel.core.source;

import com.moodsentinel.core.config.ConfigException;
import com.moodsentinel.core.config.SourceSettings;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Factory building the configured {@link FeatureSource}.
 */
public final class FeatureSources {

    private FeatureSources() {
        // utility class
    }

    /**
     * @param settings source settings; must not be {@code null}
     * @return the source
     * @throws ConfigException if the type is unknown or a required value is
     *                         missing
     */
    public static FeatureSource create(SourceSettings settings) {
        Objects.requireNonNull(settings, "SourceSettings must not be null");
        return switch (settings.getType()) {
            case "jsonl" -> {
                if (settings.getPath() == null || settings.getPath().isBlank()) {
                    throw new ConfigException("source.path is required for a jsonl source");
                }
                yield new JsonLinesFeatureSource(Path.of(settings.getPath()));
            }
            default -> throw new ConfigException("Unknown source type: '" + settings.getType() + "'");
        };
    }
}
