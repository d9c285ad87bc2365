package mc.orchestrator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.dto.ExistingServerRequest;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.exception.ServerRuntimeException;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.JavaConfig;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.model.ServerMetadata;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.runtime.RuntimeEnv;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Changes that the runtime substrate cannot apply to a live instance: they stop it, drop its handle and
 * recreate it from the instance directory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServerLifecycleService {
    private static final Set<String> SUPPORTED_JAVA_VERSIONS = Set.of("8", "11", "17", "21");

    private final RuntimeBackend backend;
    private final ServerMetadataStore metadataStore;
    private final InstanceDirectories directories;

    public ServerInstance recreateWithEnv(String id, Map<String, String> envOverrides) {
        return recreate(id, envOverrides, Map.of());
    }

    public ServerInstance updateJavaVersion(String id, String javaVersion) {
        String version = javaVersion == null ? "" : javaVersion.strip();
        if (!SUPPORTED_JAVA_VERSIONS.contains(version)) {
            throw new IllegalArgumentException("Invalid Java version: " + javaVersion + ". Must be 8, 11, 17, or 21");
        }
        ServerInstance instance = require(id);
        String binary = JavaConfig.binaryFor(version);
        metadataStore.update(instance.getName(), metadata -> {
            JavaConfig current = metadata.getJavaConfig();
            metadata.applyJavaConfig(new JavaConfig(version, binary, current == null ? null : current.extraArgs()));
        });

        Map<String, String> env = new LinkedHashMap<>();
        env.put(RuntimeEnv.JAVA_VERSION, version);
        env.put(RuntimeEnv.JAVA_BIN, binary);
        log.info("Switching {} to Java {}", instance.getName(), version);
        return recreate(id, env, Map.of(RuntimeEnv.JAVA_VERSION_LABEL, version));
    }

    /**
     * Renames the instance and its directory. Fails before anything is stopped when the new name is taken.
     */
    public ServerInstance rename(String id, String newName) {
        ServerInstance instance = require(id);
        String oldName = instance.getName();
        directories.resolve(newName);
        if (oldName.equals(newName)) {
            throw new IllegalArgumentException("Server is already named " + newName);
        }
        if (directories.exists(newName)) {
            throw new ServerRuntimeException("A server named " + newName + " already exists");
        }

        ServerMetadata metadata = metadataStore.readOrEmpty(oldName);
        Integer hostPort = instance.primaryHostPort() != null ? instance.primaryHostPort() : metadata.getHostPort();
        String minRam = instance.getEnvironment().getOrDefault(RuntimeEnv.MIN_RAM, metadata.getMinRam());
        String maxRam = instance.getEnvironment().getOrDefault(RuntimeEnv.MAX_RAM, metadata.getMaxRam());
        Map<String, String> envOverrides = new LinkedHashMap<>(metadata.getEnvOverrides());

        dropHandle(instance);
        try {
            directories.rename(oldName, newName);
        } catch (IOException e) {
            log.error("Failed to rename {} to {}: {}", oldName, newName, e.getMessage());
            throw new ServerRuntimeException("Failed to rename " + oldName + " to " + newName + ": " + e.getMessage(), e);
        }
        metadataStore.update(newName, m -> m.recordRename(oldName, newName));
        log.info("Renamed server {} to {}", oldName, newName);

        return backend.createFromExisting(ExistingServerRequest.builder()
                .name(newName)
                .hostPort(hostPort)
                .minRam(minRam)
                .maxRam(maxRam)
                .envOverrides(envOverrides)
                .build());
    }

    private ServerInstance recreate(String id, Map<String, String> envOverrides, Map<String, String> extraLabels) {
        ServerInstance instance = require(id);
        ServerMetadata metadata = metadataStore.readOrEmpty(instance.getName());
        Integer hostPort = instance.primaryHostPort() != null ? instance.primaryHostPort() : metadata.getHostPort();
        String minRam = instance.getEnvironment().getOrDefault(RuntimeEnv.MIN_RAM, metadata.getMinRam());
        String maxRam = instance.getEnvironment().getOrDefault(RuntimeEnv.MAX_RAM, metadata.getMaxRam());

        dropHandle(instance);
        return backend.createFromExisting(ExistingServerRequest.builder()
                .name(instance.getName())
                .hostPort(hostPort)
                .minRam(minRam)
                .maxRam(maxRam)
                .envOverrides(envOverrides == null ? new LinkedHashMap<>() : new LinkedHashMap<>(envOverrides))
                .extraLabels(new LinkedHashMap<>(extraLabels))
                .build());
    }

    private void dropHandle(ServerInstance instance) {
        try {
            backend.stop(instance.getId(), false);
        } catch (RuntimeException e) {
            log.warn("Stopping {} before recreation failed: {}", instance.getName(), e.getMessage());
        }
        try {
            backend.removeHandle(instance.getId());
        } catch (RuntimeException e) {
            log.warn("Removing runtime handle of {} failed: {}", instance.getName(), e.getMessage());
        }
    }

    private ServerInstance require(String id) {
        ServerInstance instance = backend.get(id);
        if (instance.getStatus() == InstanceStatus.NOT_FOUND) {
            throw new InstanceNotFoundException(id);
        }
        return instance;
    }
}
