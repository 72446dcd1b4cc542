package com.moodsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the alerting YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional; omitted values
 * keep their defaults):
 * </p>
 *
 * <pre>
 * rules:
 *   sentimentThreshold: -0.5
 *   engagementThreshold: 0.2
 *   volumeSpikeThreshold: 2.0
 * gate:
 *   cooldownHours: 2
 *   maxAlertsPerDay: 5
 *   zone: UTC
 * mood:
 *   criticalThreshold: 0.2
 *   warningThreshold: 0.4
 *   recoveryThreshold: 0.6
 * delivery:
 *   channel: log
 *   maxAttempts: 5
 * store:
 *   jdbcUrl: jdbc:h2:file:./data/mood_sentinel
 * source:
 *   type: jsonl
 *   path: snapshots.jsonl
 * </pre>
 *
 * <p>
 * An instance is passed explicitly to each component's constructor; there is
 * no process-wide configuration singleton. Call {@link #validate()} after
 * loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private RuleThresholds rules = new RuleThresholds();
    private GatePolicy gate = new GatePolicy();
    private MoodThresholds mood = new MoodThresholds();
    private DeliverySettings delivery = new DeliverySettings();
    private StoreSettings store = new StoreSettings();
    private SourceSettings source = new SourceSettings();

    /**
     * @return a configuration holding every default value
     */
    public static AlertingConfig defaults() {
        return new AlertingConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception listing them.
     * </p>
     *
     * @throws ConfigException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        rules.validate(errors);
        gate.validate(errors);
        mood.validate(errors);
        delivery.validate(errors);
        store.validate(errors);
        source.validate(errors);

        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Alerting configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public RuleThresholds getRules() {
        return rules;
    }

    public void setRules(RuleThresholds rules) {
        this.rules = rules != null ? rules : new RuleThresholds();
    }

    public GatePolicy getGate() {
        return gate;
    }

    public void setGate(GatePolicy gate) {
        this.gate = gate != null ? gate : new GatePolicy();
    }

    public MoodThresholds getMood() {
        return mood;
    }

    public void setMood(MoodThresholds mood) {
        this.mood = mood != null ? mood : new MoodThresholds();
    }

    public DeliverySettings getDelivery() {
        return delivery;
    }

    public void setDelivery(DeliverySettings delivery) {
        this.delivery = delivery != null ? delivery : new DeliverySettings();
    }

    public StoreSettings getStore() {
        return store;
    }

    public void setStore(StoreSettings store) {
        this.store = store != null ? store : new StoreSettings();
    }

    public SourceSettings getSource() {
        return source;
    }

    public void setSource(SourceSettings source) {
        this.source = source != null ? source : new SourceSettings();
    }

    @Override
    public String toString() {
        return "AlertingConfig{" +
                "rules=" + rules +
                ", gate=" + gate +
                ", mood=" + mood +
                ", delivery=" + delivery +
                ", store=" + store +
                ", source=" + source +
                '}';
    }
}
