package mc.orchestrator.service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RamSize {
    private static final Pattern RAM_PATTERN = Pattern.compile("^\\s*(\\d+)\\s*([GgMmKk])?[Bb]?\\s*$");

    private RamSize() {
    }

    /**
     * Parses "2G", "1536M", "512" (megabytes) into megabytes.
     */
    public static int parseMb(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RAM value is empty");
        }
        Matcher m = RAM_PATTERN.matcher(value);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid RAM value: " + value);
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "M" : m.group(2).toUpperCase(Locale.ROOT);
        long mb = switch (unit) {
            case "G" -> amount * 1024;
            case "K" -> amount / 1024;
            default -> amount;
        };
        if (mb <= 0 || mb > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("RAM value out of range: " + value);
        }
        return (int) mb;
    }

    public static String format(int mb) {
        if (mb % 1024 == 0) {
            return (mb / 1024) + "G";
        }
        return mb + "M";
    }
}
