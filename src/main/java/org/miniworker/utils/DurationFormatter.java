package org.miniworker.utils;

import java.util.Locale;

/**
 * Renders a number of seconds the way operators read it in status output:
 * "12.3s", "4m 5s", "1h 23m 45s".
 */
public final class DurationFormatter {

    private DurationFormatter() {}

    public static String format(double seconds) {
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", seconds);
        }
        if (seconds < 3600) {
            long minutes = (long) (seconds / 60);
            double secs = seconds % 60;
            return String.format(Locale.ROOT, "%dm %.0fs", minutes, secs);
        }
        long hours = (long) (seconds / 3600);
        long minutes = (long) ((seconds % 3600) / 60);
        double secs = seconds % 60;
        return String.format(Locale.ROOT, "%dh %dm %.0fs", hours, minutes, secs);
    }
}
