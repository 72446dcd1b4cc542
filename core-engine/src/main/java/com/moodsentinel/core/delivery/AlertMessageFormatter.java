package com.moodsentinel.core.delivery;

import com.moodsentinel.core.model.Alert;

/**
 * Renders an alert as channel message text.
 */
public final class AlertMessageFormatter {

    private AlertMessageFormatter() {
        // utility class
    }

    public static String format(Alert alert) {
        return "[" + alert.getSeverity() + "] " + alert.getType() + '\n'
                + "Subject: " + alert.getSubjectId() + '\n'
                + (alert.getSummary() != null ? alert.getSummary() + '\n' : "")
                + "Created: " + alert.getCreatedAt() + " (alert #" + alert.getId() + ")";
    }
}
