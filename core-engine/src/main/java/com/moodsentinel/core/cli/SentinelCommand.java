package com.moodsentinel.core.cli;

import com.moodsentinel.core.config.AlertingConfig;
import com.moodsentinel.core.config.AlertingConfigLoader;
import com.moodsentinel.core.config.ConfigException;
import com.moodsentinel.core.delivery.DeliveryChannels;
import com.moodsentinel.core.delivery.DeliveryCoordinator;
import com.moodsentinel.core.delivery.DeliveryReport;
import com.moodsentinel.core.gate.AlertGate;
import com.moodsentinel.core.pipeline.AlertProcessor;
import com.moodsentinel.core.pipeline.CycleReport;
import com.moodsentinel.core.rules.RuleEvaluator;
import com.moodsentinel.core.source.FeatureSource;
import com.moodsentinel.core.source.FeatureSources;
import com.moodsentinel.core.source.JsonLinesFeatureSource;
import com.moodsentinel.core.stats.AlertStats;
import com.moodsentinel.core.stats.AlertTrend;
import com.moodsentinel.core.stats.StatsReporter;
import com.moodsentinel.core.store.AlertStore;
import com.moodsentinel.core.store.JdbcAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Command-line entry point run by an external scheduler.
 *
 * <pre>
 * evaluate [snapshots.jsonl]    evaluate snapshots and persist admitted alerts
 * deliver [--since-hours N]     run one delivery pass
 * stats [--days N]              print alert statistics
 * </pre>
 *
 * <p>
 * Exit codes: 0 success, 1 runtime failure, 2 usage or configuration error.
 * </p>
 */
public class SentinelCommand {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
            "Usage: sentinel <command> [options]",
            "  evaluate [snapshots.jsonl]   evaluate snapshots and persist admitted alerts",
            "  deliver [--since-hours N]    deliver pending alerts once; older pending alerts expire",
            "  stats [--days N]             print alert statistics");

    private final AlertingConfig config;
    private final AlertStore store;
    private final Clock clock;
    private final PrintStream out;

    public SentinelCommand(AlertingConfig config, AlertStore store, Clock clock, PrintStream out) {
        this.config = Objects.requireNonNull(config, "AlertingConfig must not be null");
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.out = Objects.requireNonNull(out, "Output stream must not be null");
    }

    public static void main(String[] args) {
        int code;
        try {
            AlertingConfig config = AlertingConfigLoader.load();
            Clock clock = Clock.systemUTC();
            AlertStore store = JdbcAlertStore.open(config.getStore(), clock);
            code = new SentinelCommand(config, store, clock, System.out).execute(args);
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            code = EXIT_USAGE;
        } catch (RuntimeException e) {
            LOG.error("Startup failed", e);
            code = EXIT_FAILURE;
        }
        System.exit(code);
    }

    /**
     * Run one command.
     *
     * @param args command name followed by its options
     * @return process exit code
     */
    public int execute(String[] args) {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_USAGE;
        }
        List<String> options = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (args[0].toLowerCase(Locale.ROOT)) {
                case "evaluate" -> evaluate(options);
                case "deliver" -> deliver(options);
                case "stats" -> stats(options);
                default -> {
                    out.println("Unknown command: " + args[0]);
                    out.println(USAGE);
                    yield EXIT_USAGE;
                }
            };
        } catch (ConfigException | IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            LOG.error("Command '{}' failed", args[0], e);
            return EXIT_FAILURE;
        }
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    private int evaluate(List<String> options) {
        FeatureSource source = options.isEmpty()
                ? FeatureSources.create(config.getSource())
                : new JsonLinesFeatureSource(Path.of(options.get(0)));

        AlertProcessor processor = new AlertProcessor(
                new RuleEvaluator(), config.getRules(), new AlertGate(config.getGate()), store, clock);
        CycleReport report = processor.runCycle(source, config.getSource().getLimit());

        out.printf("Processed %d snapshot(s): %d admitted, %d suppressed, %d error(s)%n",
                report.getSnapshots(), report.getAdmitted(), report.getSuppressed(), report.getErrors());
        return report.getErrors() == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private int deliver(List<String> options) {
        intOption(options, "--since-hours").ifPresent(h -> config.getDelivery().setSinceHours(h));
        config.validate();

        try (DeliveryCoordinator coordinator = new DeliveryCoordinator(store, config.getDelivery(), clock)) {
            DeliveryReport report = coordinator.runOnce(DeliveryChannels.create(config.getDelivery().getChannel()));
            out.printf("Delivered %d of %d alert(s): %d failed, %d to retry, %d expired%n",
                    report.getSent(), report.getAttempted(), report.getFailed(), report.getRetried(),
                    report.getExpired());
        }
        return EXIT_OK;
    }

    private int stats(List<String> options) {
        int days = intOption(options, "--days").orElse(7);
        StatsReporter reporter = new StatsReporter(store, clock);
        AlertStats stats = reporter.statistics(days);
        AlertTrend trend = reporter.trend(clock.instant().minus(Duration.ofDays(days)));

        out.printf("Alert statistics (last %d day(s))%n", days);
        out.printf("  Total:         %d%n", stats.getTotal());
        out.printf("  Delivered:     %d%n", stats.getDelivered());
        out.printf("  Pending:       %d%n", stats.getPending());
        out.printf("  Failed:        %d%n", stats.getFailed());
        out.printf(Locale.ROOT, "  Delivery rate: %.1f%%%n", stats.getDeliveryRate());
        stats.getSeverityBreakdown().forEach((sev, n) -> out.printf("  %-13s  %d%n", sev + ":", n));
        out.printf("  Trend:         %s (%d)%n", trend.getDirection(), trend.getMagnitude());
        return EXIT_OK;
    }

    private static OptionalInt intOption(List<String> options, String name) {
        int idx = options.indexOf(name);
        if (idx < 0) {
            return OptionalInt.empty();
        }
        if (idx + 1 >= options.size()) {
            throw new IllegalArgumentException(name + " requires a value");
        }
        String raw = options.get(idx + 1);
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + raw);
            }
            return OptionalInt.of(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + raw, e);
        }
    }
}
