package mc.orchestrator.runtime.docker;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.dto.CreateServerRequest;
import mc.orchestrator.dto.ExistingServerRequest;
import mc.orchestrator.exception.InstanceExistsException;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.exception.PortConflictException;
import mc.orchestrator.exception.ServerRuntimeException;
import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.DeleteResult;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.OperationResult;
import mc.orchestrator.model.PortBinding;
import mc.orchestrator.model.ResourceLimits;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.model.ServerMetadata;
import mc.orchestrator.runtime.GracefulShutdown;
import mc.orchestrator.runtime.JavaCompatibility;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.runtime.RuntimeEnv;
import mc.orchestrator.service.InstanceDirectories;
import mc.orchestrator.service.MetadataMerger;
import mc.orchestrator.service.PortAllocator;
import mc.orchestrator.service.RamSize;
import mc.orchestrator.service.ServerMetadataStore;
import mc.orchestrator.service.TtlCache;
import mc.orchestrator.service.command.CommandDispatcher;
import mc.orchestrator.service.provisioning.ArtifactValidator;
import mc.orchestrator.service.provisioning.ProvisioningService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Runs every instance in its own container created from the runtime image.
 * The container name is the instance name; the container id is the instance id.
 */
@Slf4j
public class ContainerRuntimeBackend implements RuntimeBackend {
    public static final String LABEL_TYPE = "mc.type";
    public static final String LABEL_VERSION = "mc.version";
    public static final String LABEL_LOADER_VERSION = "mc.loader_version";

    private static final String SERVERS_MOUNT_TARGET = "/data/servers";
    private static final String LIST_KEY = "all";

    private final DockerRuntimeClient client;
    private final RuntimeProperties properties;
    private final PortAllocator portAllocator;
    private final ProvisioningService provisioning;
    private final ServerMetadataStore metadataStore;
    private final InstanceDirectories directories;
    private final CommandDispatcher dispatcher;
    private final GracefulShutdown shutdown;
    private final TtlCache<String, List<ServerInstance>> listCache;

    public ContainerRuntimeBackend(DockerRuntimeClient client,
                                   RuntimeProperties properties,
                                   PortAllocator portAllocator,
                                   ProvisioningService provisioning,
                                   ServerMetadataStore metadataStore,
                                   InstanceDirectories directories,
                                   CommandDispatcher dispatcher,
                                   Clock clock) {
        this.client = client;
        this.properties = properties;
        this.portAllocator = portAllocator;
        this.provisioning = provisioning;
        this.metadataStore = metadataStore;
        this.directories = directories;
        this.dispatcher = dispatcher;
        RuntimeProperties.Stop stop = properties.getStop();
        this.shutdown = new GracefulShutdown(dispatcher, stop.getCommand(), stop.getTimeout(), stop.getPollInterval());
        this.listCache = new TtlCache<>(properties.getCache().getListTtl(), clock);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.CONTAINER;
    }

    @Override
    public ServerInstance create(CreateServerRequest request) {
        ensureRuntimeImage();
        String name = request.getName();
        Path dir = directories.resolve(name);
        if (client.containerExists(name)) {
            throw new InstanceExistsException(name, "a container with this name exists");
        }
        if (Files.exists(metadataStore.pathFor(name))) {
            throw new InstanceExistsException(name, "metadata record present, use createFromExisting");
        }
        provisioning.ensureArtifacts(request.getType(), request.getVersion(), dir,
                request.getLoaderVersion(), request.getInstallerVersion());

        int minMb = RamSize.parseMb(request.getMinRam());
        int maxMb = RamSize.parseMb(request.getMaxRam());
        int hostPort = portAllocator.pick(request.getHostPort());

        Map<String, String> env = new LinkedHashMap<>();
        env.put(RuntimeEnv.SERVER_DIR_NAME, name);
        env.put(RuntimeEnv.MIN_RAM, request.getMinRam());
        env.put(RuntimeEnv.MAX_RAM, request.getMaxRam());
        env.put(RuntimeEnv.SERVER_PORT, String.valueOf(properties.getPorts().getGamePort()));
        env.put(RuntimeEnv.SERVER_TYPE, request.getType());
        env.put(RuntimeEnv.SERVER_VERSION, request.getVersion());
        findServerJar(request.getType(), dir).ifPresent(jar -> env.put(RuntimeEnv.SERVER_JAR, jar));
        Map<String, String> overrides = MetadataMerger.merge(Map.of(), request.getEnvOverrides());
        env.putAll(overrides);

        Map<String, String> labels = baseLabels();
        labels.put(LABEL_TYPE, request.getType());
        labels.put(LABEL_VERSION, request.getVersion());
        if (request.getLoaderVersion() != null) {
            labels.put(LABEL_LOADER_VERSION, request.getLoaderVersion());
        }
        if (request.getExtraLabels() != null) {
            labels.putAll(MetadataMerger.merge(Map.of(), request.getExtraLabels()));
        }

        ContainerLaunchSpec spec = launchSpec(name, labels, env, hostPort, new ResourceLimits(minMb, maxMb));
        Launched launched = launchWithPortRetry(spec);
        log.info("Container {} created successfully for server {} on host port {}", launched.containerId(), name,
                launched.hostPort());

        metadataStore.update(name, metadata -> {
            metadata.setName(name);
            metadata.setType(request.getType());
            metadata.setVersion(request.getVersion());
            metadata.setLoaderVersion(request.getLoaderVersion());
            metadata.recordRam(request.getMinRam(), request.getMaxRam(), minMb, maxMb);
            metadata.setHostPort(launched.hostPort());
            metadata.setEnvOverrides(overrides);
            metadata.setLabels(request.getExtraLabels());
        });
        listCache.invalidateAll();

        checkJavaCompatibility(launched.containerId(), name, request.getType(), request.getVersion());
        return get(launched.containerId());
    }

    @Override
    public ServerInstance createFromExisting(ExistingServerRequest request) {
        ensureRuntimeImage();
        String name = request.getName();
        if (!directories.exists(name)) {
            throw new InstanceNotFoundException(name);
        }
        ServerMetadata stored = metadataStore.readOrEmpty(name);

        String minRam = firstNonBlank(request.getMinRam(), stored.getMinRam(), RuntimeEnv.DEFAULT_MIN_RAM);
        String maxRam = firstNonBlank(request.getMaxRam(), stored.getMaxRam(), RuntimeEnv.DEFAULT_MAX_RAM);
        int minMb = RamSize.parseMb(minRam);
        int maxMb = RamSize.parseMb(maxRam);
        Integer preferred = request.getHostPort() != null ? request.getHostPort() : stored.getHostPort();
        int hostPort = portAllocator.pick(preferred);

        Map<String, String> overrides = MetadataMerger.merge(stored.getEnvOverrides(), request.getEnvOverrides());
        Map<String, String> env = new LinkedHashMap<>();
        env.put(RuntimeEnv.SERVER_DIR_NAME, name);
        env.put(RuntimeEnv.MIN_RAM, minRam);
        env.put(RuntimeEnv.MAX_RAM, maxRam);
        env.put(RuntimeEnv.SERVER_PORT, String.valueOf(properties.getPorts().getGamePort()));
        if (stored.getType() != null) {
            env.put(RuntimeEnv.SERVER_TYPE, stored.getType());
        }
        if (stored.getVersion() != null) {
            env.put(RuntimeEnv.SERVER_VERSION, stored.getVersion());
        }
        env.putAll(overrides);

        Map<String, String> labels = baseLabels();
        labels.put(LABEL_TYPE, stored.getType() != null ? stored.getType() : "custom");
        if (stored.getVersion() != null) {
            labels.put(LABEL_VERSION, stored.getVersion());
        }
        if (stored.getLoaderVersion() != null) {
            labels.put(LABEL_LOADER_VERSION, stored.getLoaderVersion());
        }
        Map<String, String> customLabels = MetadataMerger.merge(stored.getLabels(), request.getExtraLabels());
        labels.putAll(customLabels);

        ContainerLaunchSpec spec = launchSpec(name, labels, env, hostPort, new ResourceLimits(minMb, maxMb));
        Launched launched = launchWithPortRetry(spec);
        log.info("Container {} created from existing dir for server {}", launched.containerId(), name);

        metadataStore.update(name, metadata -> {
            metadata.setName(name);
            metadata.recordRam(minRam, maxRam, minMb, maxMb);
            metadata.setHostPort(launched.hostPort());
            metadata.setEnvOverrides(overrides);
            metadata.setLabels(customLabels);
        });
        listCache.invalidateAll();
        return get(launched.containerId());
    }

    @Override
    public OperationResult start(String id) {
        client.startContainer(id);
        listCache.invalidateAll();
        return new OperationResult(id, client.inspect(id).status(), "start");
    }

    @Override
    public OperationResult stop(String id, boolean force) {
        ContainerView view;
        try {
            view = client.inspect(id);
        } catch (InstanceNotFoundException e) {
            return new OperationResult(id, InstanceStatus.NOT_FOUND, "noop");
        }
        if (!view.running()) {
            return new OperationResult(id, view.status(), "noop");
        }

        GracefulShutdown.Outcome outcome = shutdown.run(toInstance(view), () -> client.inspect(id).running());
        listCache.invalidateAll();
        if (outcome.stopped()) {
            return new OperationResult(id, currentStatus(id), outcome.method().orElse("graceful"));
        }

        try {
            if (force) {
                client.killContainer(id);
            } else {
                client.stopContainer(id, properties.getContainer().getDockerStopTimeout());
            }
        } catch (InstanceNotFoundException e) {
            return new OperationResult(id, InstanceStatus.NOT_FOUND, "noop");
        } catch (RuntimeException e) {
            log.error("Docker stop/kill failed for {}: {}", id, e.getMessage());
        }
        return new OperationResult(id, currentStatus(id), outcome.method().orElse(force ? "kill" : "docker-stop"));
    }

    @Override
    public OperationResult restart(String id) {
        try {
            stop(id, false);
        } catch (RuntimeException e) {
            log.warn("Graceful stop failed during restart for {}: {}", id, e.getMessage());
        }
        return start(id);
    }

    @Override
    public OperationResult kill(String id) {
        ContainerView view;
        try {
            view = client.inspect(id);
        } catch (InstanceNotFoundException e) {
            return new OperationResult(id, InstanceStatus.NOT_FOUND, "noop");
        }
        if (!view.running()) {
            return new OperationResult(id, view.status(), "noop");
        }
        client.killContainer(id);
        listCache.invalidateAll();
        return new OperationResult(id, currentStatus(id), "kill");
    }

    @Override
    public DeleteResult delete(String id) {
        String name;
        try {
            name = client.inspect(id).name();
            client.removeContainer(id);
        } catch (InstanceNotFoundException e) {
            log.info("Container {} already gone, nothing to delete", id);
            return new DeleteResult(id, true, false);
        } finally {
            listCache.invalidateAll();
        }
        boolean dirRemoved = false;
        try {
            dirRemoved = directories.delete(name);
        } catch (IllegalArgumentException e) {
            log.warn("Container {} has no usable instance directory name: {}", id, name);
        }
        return new DeleteResult(id, true, dirRemoved);
    }

    @Override
    public void removeHandle(String id) {
        try {
            client.removeContainer(id);
        } catch (InstanceNotFoundException e) {
            log.debug("Container {} already removed", id);
        }
        listCache.invalidateAll();
    }

    @Override
    public List<ServerInstance> list() {
        return listCache.get(LIST_KEY, () -> {
            List<ServerInstance> instances = new ArrayList<>();
            for (ContainerView view : client.listContainers(Map.of(properties.getContainer().getManagedLabel(), "true"))) {
                instances.add(toInstance(view));
            }
            return List.copyOf(instances);
        });
    }

    @Override
    public ServerInstance get(String id) {
        try {
            return toInstance(client.inspect(id));
        } catch (InstanceNotFoundException e) {
            return ServerInstance.notFound(id, BackendKind.CONTAINER);
        }
    }

    @Override
    public String logs(String id, int tail) {
        return client.logs(id, tail);
    }

    @Override
    public CommandResult sendCommand(String id, String command) {
        return dispatcher.dispatch(toInstance(client.inspect(id)), command);
    }

    private void ensureRuntimeImage() {
        String image = properties.getContainer().getImage();
        if (!client.imageExists(image)) {
            log.error("Runtime image '{}' not found", image);
            throw new ServerRuntimeException("Runtime image '" + image + "' not found. Build or pull it before creating servers.");
        }
    }

    private ContainerLaunchSpec launchSpec(String name, Map<String, String> labels, Map<String, String> env,
                                           int hostPort, ResourceLimits limits) {
        RuntimeProperties.Container container = properties.getContainer();
        ContainerLaunchSpec.ContainerLaunchSpecBuilder builder = ContainerLaunchSpec.builder()
                .name(name)
                .image(container.getImage())
                .labels(labels)
                .env(env)
                .containerPort(properties.getPorts().getGamePort())
                .hostPort(hostPort)
                .memoryBytes(limits.maxRamBytes())
                .network(container.getNetwork())
                .workingDir(container.getWorkingDir())
                .entrypoint(container.getEntrypoint());
        if (container.getHostRoot() != null && !container.getHostRoot().isBlank()) {
            builder.bindHostPath(Path.of(container.getHostRoot()).resolve(name).toString())
                    .bindTarget(container.getWorkingDir());
        } else {
            builder.volumeName(container.getVolumeName()).volumeTarget(SERVERS_MOUNT_TARGET);
        }
        return builder.build();
    }

    /**
     * Creates and starts the container. A bind conflict on the host port removes the half-created container and
     * retries with the next free port, up to the configured attempt budget.
     */
    private Launched launchWithPortRetry(ContainerLaunchSpec initial) {
        ContainerLaunchSpec spec = initial;
        int attempts = properties.getContainer().getCreateAttempts();
        List<Integer> tried = new ArrayList<>();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            tried.add(spec.hostPort());
            String containerId = null;
            try {
                containerId = client.createContainer(spec);
                client.startContainer(containerId);
                return new Launched(containerId, spec.hostPort());
            } catch (RuntimeException e) {
                if (containerId != null) {
                    discard(containerId);
                }
                if (!DockerRuntimeClient.isPortConflict(e)) {
                    if (e instanceof ServerRuntimeException) {
                        throw e;
                    }
                    log.error("Failed to create container for server {}: {}", spec.name(), e.getMessage());
                    throw new ServerRuntimeException("Failed to create Docker container for server " + spec.name()
                            + ": " + e.getMessage(), e);
                }
                log.warn("Host port {} already allocated for {} (attempt {}/{})", spec.hostPort(), spec.name(),
                        attempt, attempts);
                if (spec.hostPort() >= PortAllocator.MAX_PORT) {
                    break;
                }
                if (attempt < attempts) {
                    int next = portAllocator.pick(spec.hostPort() + 1);
                    spec = spec.toBuilder().hostPort(next).build();
                }
            }
        }
        log.error("Giving up creating {} after {} port conflicts, tried {}", spec.name(), tried.size(), tried);
        throw new PortConflictException("Could not bind a host port for " + spec.name() + " after trying " + tried,
                spec.hostPort());
    }

    private void discard(String containerId) {
        try {
            client.removeContainer(containerId);
        } catch (RuntimeException e) {
            log.warn("Could not remove failed container {}: {}", containerId, e.getMessage());
        }
    }

    private void checkJavaCompatibility(String containerId, String name, String type, String version) {
        try {
            ExecResult result = client.exec(containerId, properties.getContainer().getExecTimeout(),
                    "sh", "-c", "java -version 2>&1");
            OptionalInt major = result.succeeded() ? JavaCompatibility.parseJavaMajor(result.output()) : OptionalInt.empty();
            if (major.isEmpty()) {
                log.warn("Could not determine Java version in container for server {}. It may have compatibility issues.", name);
            } else if (!JavaCompatibility.isCompatible(major.getAsInt(), type, version)) {
                log.warn("Incompatible Java {} detected for {} {} (needs {}+). The server will continue but may have issues.",
                        major.getAsInt(), type, version, JavaCompatibility.requiredMajor(type, version));
            } else {
                log.info("Java {} is compatible with {} {}", major.getAsInt(), type, version);
            }
        } catch (RuntimeException e) {
            log.warn("Could not get Java version from container {}: {}", containerId, e.getMessage());
        }
    }

    private ServerInstance toInstance(ContainerView view) {
        int gamePort = properties.getPorts().getGamePort();
        List<PortBinding> ports = new ArrayList<>();
        for (PortBinding binding : view.ports()) {
            boolean primary = binding.containerPort() == gamePort && "tcp".equals(binding.protocol());
            ports.add(new PortBinding(binding.containerPort(), binding.protocol(), binding.hostPort(),
                    binding.hostAddress(), primary));
        }
        Map<String, String> labels = view.labels() == null ? Map.of() : view.labels();
        Map<String, String> env = view.env() == null ? Map.of() : view.env();

        ResourceLimits limits = null;
        String minRam = env.get(RuntimeEnv.MIN_RAM);
        String maxRam = env.get(RuntimeEnv.MAX_RAM);
        if (minRam != null && maxRam != null) {
            try {
                limits = new ResourceLimits(RamSize.parseMb(minRam), RamSize.parseMb(maxRam));
            } catch (IllegalArgumentException e) {
                log.debug("Container {} carries unparseable RAM settings {}/{}", view.name(), minRam, maxRam);
            }
        }

        return ServerInstance.builder()
                .id(view.id())
                .name(view.name())
                .backendKind(BackendKind.CONTAINER)
                .status(view.status())
                .type(labels.get(LABEL_TYPE))
                .version(labels.get(LABEL_VERSION))
                .loaderVersion(labels.get(LABEL_LOADER_VERSION))
                .portBindings(List.copyOf(ports))
                .resourceLimits(limits)
                .javaConfig(RuntimeEnv.javaConfig(env, labels.get(RuntimeEnv.JAVA_VERSION_LABEL)))
                .labels(labels)
                .environment(env)
                .createdAt(view.createdAt())
                .build();
    }

    private InstanceStatus currentStatus(String id) {
        try {
            return client.inspect(id).status();
        } catch (InstanceNotFoundException e) {
            return InstanceStatus.NOT_FOUND;
        }
    }

    private Map<String, String> baseLabels() {
        RuntimeProperties.Container container = properties.getContainer();
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(container.getManagedLabel(), "true");
        labels.put("com.docker.compose.project", container.getComposeProject());
        labels.put("com.docker.compose.service", container.getComposeService());
        labels.put("com.docker.compose.version", "2");
        labels.put("org.opencontainers.image.title", "Minecraft Runtime");
        labels.put("org.opencontainers.image.description", "Minecraft server runtime container managed by mc-orchestrator");
        return labels;
    }

    private static Optional<String> findServerJar(String type, Path dir) {
        List<String> candidates = "fabric".equals(type == null ? "" : type.toLowerCase(Locale.ROOT))
                ? List.of(ArtifactValidator.SERVER_JAR, "fabric-server-launch.jar")
                : List.of(ArtifactValidator.SERVER_JAR);
        for (String candidate : candidates) {
            Path jar = dir.resolve(candidate);
            try {
                if (Files.isRegularFile(jar) && Files.size(jar) > 0) {
                    return Optional.of(candidate);
                }
            } catch (IOException e) {
                log.debug("Could not inspect {}: {}", jar, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private record Launched(String containerId, int hostPort) {
    }
}
