package com.moodsentinel.core.gate;

import java.util.Objects;

/**
 * Outcome of a gate check: allow or deny, with the reason.
 */
public final class GateDecision {

    private final boolean allowed;
    private final DecisionReason reason;

    private GateDecision(boolean allowed, DecisionReason reason) {
        this.allowed = allowed;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public static GateDecision allow(DecisionReason reason) {
        return new GateDecision(true, reason);
    }

    public static GateDecision deny(DecisionReason reason) {
        return new GateDecision(false, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public DecisionReason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GateDecision that))
            return false;
        return allowed == that.allowed && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowed, reason);
    }

    @Override
    public String toString() {
        return (allowed ? "allow" : "deny") + "(" + reason + ")";
    }
}
