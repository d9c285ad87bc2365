package mc.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mc.orchestrator.model.ServerMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ServerMetadataStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ServerMetadataStore store;

    @BeforeEach
    void setUp() {
        store = new ServerMetadataStore(new InstanceDirectories(root), "server_meta.json", objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void readOrEmptyReturnsNamedRecordWhenMissing() {
        ServerMetadata metadata = store.readOrEmpty("alpha");

        assertThat(metadata.getName()).isEqualTo("alpha");
        assertThat(metadata.getCreatedTs()).isNull();
    }

    @Test
    void firstWriteStampsCreationTime() {
        store.update("alpha", m -> m.setType("paper"));

        ServerMetadata stored = store.read("alpha").orElseThrow();
        assertThat(stored.getType()).isEqualTo("paper");
        assertThat(stored.getCreatedTs()).isEqualTo(NOW.getEpochSecond());
        assertThat(stored.getCreatedAt()).isEqualTo(NOW.toString());
    }

    @Test
    void updatePreservesKeysItDoesNotModel() throws Exception {
        Path dir = Files.createDirectories(root.resolve("alpha"));
        Files.writeString(dir.resolve("server_meta.json"),
                "{\"name\":\"alpha\",\"server_type\":\"fabric\",\"created_ts\":1700000000,\"custom_panel_tag\":\"blue\"}");

        store.update("alpha", m -> m.setHostPort(25570));

        JsonNode json = objectMapper.readTree(dir.resolve("server_meta.json").toFile());
        assertThat(json.path("custom_panel_tag").asText()).isEqualTo("blue");
        assertThat(json.path("type").asText()).isEqualTo("fabric");
        assertThat(json.path("host_port").asInt()).isEqualTo(25570);
        assertThat(json.path("created_ts").asLong()).isEqualTo(1700000000L);
    }

    @Test
    void unreadableRecordIsTreatedAsMissing() throws Exception {
        Path dir = Files.createDirectories(root.resolve("broken"));
        Files.writeString(dir.resolve("server_meta.json"), "{not json");

        assertThat(store.read("broken")).isEmpty();
    }

    @Test
    void backfillUsesDirectoryModificationTime() throws Exception {
        Path old = Files.createDirectories(root.resolve("old"));
        Files.writeString(old.resolve("server_meta.json"), "{\"name\":\"old\"}");
        Instant modified = Instant.parse("2023-03-03T03:03:03Z");
        Files.setLastModifiedTime(old, FileTime.from(modified));
        store.update("fresh", m -> m.setType("vanilla"));

        int updated = store.backfillCreatedTimestamps();

        assertThat(updated).isEqualTo(1);
        assertThat(store.read("old").orElseThrow().getCreatedTs()).isEqualTo(modified.getEpochSecond());
        assertThat(store.read("fresh").orElseThrow().getCreatedTs()).isEqualTo(NOW.getEpochSecond());
    }
}
