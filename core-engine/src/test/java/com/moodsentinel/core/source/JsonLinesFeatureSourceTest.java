package com.moodsentinel.core.source;

import com.moodsentinel.core.config.ConfigException;
import com.moodsentinel.core.config.SourceSettings;
import com.moodsentinel.core.model.FeatureSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesFeatureSource}.
 */
class JsonLinesFeatureSourceTest {

    @Test
    @DisplayName("Should read snake_case snapshots and skip blank or unreadable lines")
    void shouldReadSnapshots() throws URISyntaxException {
        JsonLinesFeatureSource source = new JsonLinesFeatureSource(fixture());

        List<FeatureSnapshot> snapshots = source.extract(100);

        assertThat(snapshots).extracting(FeatureSnapshot::getSubjectId)
                .containsExactly("u-calm", "u-sad", "u-quiet");
        FeatureSnapshot sad = snapshots.get(1);
        assertThat(sad.getObservedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(sad.getAvgSentiment()).isEqualTo(-0.9);
        assertThat(sad.getPostVolume()).isEqualTo(30);
        assertThat(sad.getAvgPostVolume()).isEqualTo(10.0);
        assertThat(sad.getCrisisKeywords()).containsExactly("hopeless");
        assertThat(snapshots.get(2).getCrisisKeywords()).isEmpty();
    }

    @Test
    @DisplayName("Should stop at the limit")
    void shouldHonorLimit() throws URISyntaxException {
        assertThat(new JsonLinesFeatureSource(fixture()).extract(2)).hasSize(2);
    }

    @Test
    @DisplayName("Missing file is a source error")
    void shouldFailForMissingFile() {
        JsonLinesFeatureSource source = new JsonLinesFeatureSource(Path.of("does-not-exist.jsonl"));

        assertThatThrownBy(() -> source.extract(10)).isInstanceOf(SourceException.class);
    }

    @Test
    @DisplayName("Factory requires a path for jsonl sources")
    void shouldRequirePath() {
        SourceSettings settings = new SourceSettings();

        assertThatThrownBy(() -> FeatureSources.create(settings))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("source.path");

        settings.setPath("snapshots.jsonl");
        assertThat(FeatureSources.create(settings)).isInstanceOf(JsonLinesFeatureSource.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path fixture() throws URISyntaxException {
        return Path.of(JsonLinesFeatureSourceTest.class.getClassLoader().getResource("snapshots.jsonl").toURI());
    }
}
