package com.moodsentinel.core.rules;

import com.moodsentinel.core.model.AlertType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignalRules}.
 */
class SignalRulesTest {

    @Test
    @DisplayName("Should create the rule matching each alert type")
    void shouldCreateRulePerType() {
        assertThat(SignalRules.create(AlertType.NEGATIVE_SENTIMENT)).isInstanceOf(NegativeSentimentRule.class);
        assertThat(SignalRules.create(AlertType.LOW_ENGAGEMENT)).isInstanceOf(LowEngagementRule.class);
        assertThat(SignalRules.create(AlertType.ACTIVITY_SPIKE)).isInstanceOf(ActivitySpikeRule.class);
        assertThat(SignalRules.create(AlertType.CRISIS_KEYWORDS)).isInstanceOf(CrisisKeywordRule.class);
    }

    @Test
    @DisplayName("all() returns one rule per type in declaration order")
    void shouldCreateAllRules() {
        assertThat(SignalRules.all())
                .extracting(SignalRule::getType)
                .containsExactly(AlertType.values());
    }

    @Test
    @DisplayName("Should throw for null type")
    void shouldThrowForNullType() {
        assertThatThrownBy(() -> SignalRules.create(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("AlertType");
    }
}
