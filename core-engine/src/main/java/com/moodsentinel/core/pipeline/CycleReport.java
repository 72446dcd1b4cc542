package com.moodsentinel.core.pipeline;

/**
 * Totals for one batch of snapshots.
 */
public final class CycleReport {

    private final int snapshots;
    private final int admitted;
    private final int suppressed;
    private final int errors;

    public CycleReport(int snapshots, int admitted, int suppressed, int errors) {
        this.snapshots = snapshots;
        this.admitted = admitted;
        this.suppressed = suppressed;
        this.errors = errors;
    }

    public int getSnapshots() {
        return snapshots;
    }

    public int getAdmitted() {
        return admitted;
    }

    public int getSuppressed() {
        return suppressed;
    }

    /**
     * @return snapshots skipped because evaluation or persistence failed
     */
    public int getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "CycleReport{snapshots=" + snapshots + ", admitted=" + admitted
                + ", suppressed=" + suppressed + ", errors=" + errors + '}';
    }
}
