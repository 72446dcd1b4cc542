package com.moodsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.source.JsonLinesFeatureSource;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Converts Kafka record values (snake_case JSON) into {@link FeatureSnapshot}.
 *
 * <p>
 * Malformed records are logged and returned as {@code null}; the job filters
 * them out.
 * </p>
 */
public class FeatureSnapshotDeserializationSchema implements DeserializationSchema<FeatureSnapshot> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FeatureSnapshotDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public FeatureSnapshot deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, FeatureSnapshot.class);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to deserialize feature snapshot, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(FeatureSnapshot nextElement) {
        return false;
    }

    @Override
    public TypeInformation<FeatureSnapshot> getProducedType() {
        return TypeInformation.of(FeatureSnapshot.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = JsonLinesFeatureSource.snapshotMapper();
        }
        return mapper;
    }
}
