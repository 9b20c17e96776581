package com.dbdrive.server.util;

import java.time.Duration;
import java.util.Locale;

public class FormatUtil {

    private static final int UNIT = 1024;

    private static final String PREFIXES = "KMGTPE";

    // 512 -> "512 B", 2048 -> "2.0 KB"
    public static String humanReadableSize(long bytes) {
        if (bytes < UNIT) {
            return "%d B".formatted(bytes);
        }
        long div = UNIT;
        int exp = 0;
        for (long n = bytes / UNIT; n >= UNIT; n /= UNIT) {
            div *= UNIT;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f %cB", (double) bytes / div, PREFIXES.charAt(exp));
    }

    // rounded to seconds, 90s -> "1m30s", 3700s -> "1h1m40s"
    public static String humanReadableDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0s";
        }
        long seconds = duration.plusMillis(500).getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        StringBuilder sb = new StringBuilder();
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            sb.append(minutes).append('m');
        }
        sb.append(secs).append('s');
        return sb.toString();
    }
}
