package mc.orchestrator.service;

import java.util.LinkedHashMap;
import java.util.Map;

public final class MetadataMerger {

    private MetadataMerger() {
    }

    /**
     * Incoming keys win on collision; existing keys not mentioned by {@code incoming} are kept.
     * Null values in {@code incoming} are ignored.
     */
    public static Map<String, String> merge(Map<String, String> existing, Map<String, String> incoming) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (existing != null) {
            existing.forEach((k, v) -> {
                if (k != null && v != null) {
                    merged.put(k, v);
                }
            });
        }
        if (incoming != null) {
            incoming.forEach((k, v) -> {
                if (k != null && v != null) {
                    merged.put(k, v);
                }
            });
        }
        return merged;
    }
}
