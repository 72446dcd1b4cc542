package com.moodsentinel.core.rules;

import com.moodsentinel.core.model.AlertType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link SignalRule} instances by alert type.
 *
 * <p>
 * This is the single point of extension when adding a new rule: add the
 * {@link AlertType} value and map it to its rule here.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalRules {

    private static final Logger LOG = LoggerFactory.getLogger(SignalRules.class);

    private SignalRules() {
        // utility class
    }

    /**
     * Create the rule producing the given alert type.
     *
     * @param type the alert type; must not be {@code null}
     * @return a new rule instance
     */
    public static SignalRule create(AlertType type) {
        Objects.requireNonNull(type, "AlertType must not be null");
        return switch (type) {
            case NEGATIVE_SENTIMENT -> new NegativeSentimentRule();
            case LOW_ENGAGEMENT -> new LowEngagementRule();
            case ACTIVITY_SPIKE -> new ActivitySpikeRule();
            case CRISIS_KEYWORDS -> new CrisisKeywordRule();
        };
    }

    /**
     * Create one rule per alert type, in declaration order.
     *
     * @return unmodifiable list of every built-in rule
     */
    public static List<SignalRule> all() {
        List<SignalRule> rules = Arrays.stream(AlertType.values())
                .map(SignalRules::create)
                .toList();
        LOG.debug("Created {} signal rule(s)", rules.size());
        return rules;
    }
}
