package mc.orchestrator.service;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataMergerTest {

    @Test
    void incomingWinsAndUnmentionedKeysSurvive() {
        Map<String, String> existing = Map.of("MAX_RAM", "2G", "SERVER_TYPE", "paper");
        Map<String, String> incoming = Map.of("MAX_RAM", "4G");

        assertThat(MetadataMerger.merge(existing, incoming))
                .containsEntry("MAX_RAM", "4G")
                .containsEntry("SERVER_TYPE", "paper")
                .hasSize(2);
    }

    @Test
    void ignoresNullValuesAndNullMaps() {
        Map<String, String> incoming = new HashMap<>();
        incoming.put("JAVA_OPTS", null);

        assertThat(MetadataMerger.merge(Map.of("JAVA_OPTS", "-Xss1M"), incoming))
                .containsEntry("JAVA_OPTS", "-Xss1M");
        assertThat(MetadataMerger.merge(null, null)).isEmpty();
    }
}
