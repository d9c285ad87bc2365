package mc.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.model.ServerMetadata;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads and writes the per-instance sidecar record. Writes go through a temp file and an atomic move.
 */
@Slf4j
public class ServerMetadataStore {
    private final InstanceDirectories directories;
    private final String fileName;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ServerMetadataStore(InstanceDirectories directories, String fileName, ObjectMapper objectMapper, Clock clock) {
        this.directories = directories;
        this.fileName = fileName;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public Path pathFor(String name) {
        return directories.resolve(name).resolve(fileName);
    }

    public Optional<ServerMetadata> read(String name) {
        Path path = pathFor(name);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), ServerMetadata.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable metadata {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public ServerMetadata readOrEmpty(String name) {
        return read(name).orElseGet(() -> {
            ServerMetadata metadata = new ServerMetadata();
            metadata.setName(name);
            return metadata;
        });
    }

    public void write(String name, ServerMetadata metadata) {
        Path path = pathFor(name);
        if (metadata.getCreatedTs() == null) {
            Instant now = clock.instant();
            metadata.setCreatedTs(now.getEpochSecond());
            metadata.setCreatedAt(now.toString());
        }
        try {
            Files.createDirectories(path.getParent());
            Path tmp = path.resolveSibling(fileName + ".tmp");
            objectMapper.writeValue(tmp.toFile(), metadata);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write metadata " + path, e);
        }
    }

    public ServerMetadata update(String name, Consumer<ServerMetadata> mutation) {
        ServerMetadata metadata = readOrEmpty(name);
        mutation.accept(metadata);
        write(name, metadata);
        return metadata;
    }

    /**
     * Adds {@code created_ts} to sidecars lacking it, using the directory's modification time.
     *
     * @return number of records updated
     */
    public int backfillCreatedTimestamps() {
        int updated = 0;
        for (String name : directories.listNames()) {
            Optional<ServerMetadata> existing = read(name);
            if (existing.isPresent() && existing.get().getCreatedTs() != null) {
                continue;
            }
            ServerMetadata metadata = existing.orElseGet(ServerMetadata::new);
            if (metadata.getName() == null) {
                metadata.setName(name);
            }
            try {
                Instant modified = Files.getLastModifiedTime(directories.resolve(name)).toInstant();
                metadata.setCreatedTs(modified.getEpochSecond());
                metadata.setCreatedAt(modified.toString());
                write(name, metadata);
                updated++;
            } catch (IOException | UncheckedIOException e) {
                log.warn("Failed to backfill created timestamp for {}: {}", name, e.getMessage());
            }
        }
        return updated;
    }
}
