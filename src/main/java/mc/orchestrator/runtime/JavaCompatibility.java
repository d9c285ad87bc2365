package mc.orchestrator.runtime;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimum Java major version per server type and game version, and parsing of {@code java -version} output.
 */
public final class JavaCompatibility {
    private static final Pattern VERSION_LINE = Pattern.compile("version \"([^\"]+)\"");

    private JavaCompatibility() {
    }

    public static int requiredMajor(String serverType, String gameVersion) {
        String type = serverType == null ? "" : serverType.toLowerCase(Locale.ROOT);
        int minor = gameMinor(gameVersion);
        return switch (type) {
            case "fabric" -> minor > 18 ? 17 : 8;
            case "forge" -> minor == 12 ? 8 : 17;
            case "neoforge" -> 17;
            case "paper", "purpur" -> minor > 17 ? 17 : 8;
            default -> 8;
        };
    }

    public static boolean isCompatible(int javaMajor, String serverType, String gameVersion) {
        return javaMajor >= requiredMajor(serverType, gameVersion);
    }

    /**
     * Extracts the major version from {@code java -version} output: {@code 1.8.0_292} is 8, {@code 17.0.4} is 17.
     */
    public static OptionalInt parseJavaMajor(String versionOutput) {
        if (versionOutput == null) {
            return OptionalInt.empty();
        }
        Matcher m = VERSION_LINE.matcher(versionOutput);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        String[] parts = m.group(1).split("[._+-]");
        try {
            if ("1".equals(parts[0]) && parts.length > 1) {
                return OptionalInt.of(Integer.parseInt(parts[1]));
            }
            return OptionalInt.of(Integer.parseInt(parts[0]));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * "1.20.4" gives 20. Unparseable versions give 0, which selects the most lenient requirement.
     */
    static int gameMinor(String gameVersion) {
        if (gameVersion == null) {
            return 0;
        }
        String[] parts = gameVersion.trim().split("\\.");
        if (parts.length < 2 || !"1".equals(parts[0])) {
            return 0;
        }
        String digits = parts[1].replaceAll("\\D.*$", "");
        if (digits.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
