package mc.orchestrator.runtime.process;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.dto.CreateServerRequest;
import mc.orchestrator.dto.ExistingServerRequest;
import mc.orchestrator.exception.InstanceExistsException;
import mc.orchestrator.exception.InstanceNotFoundException;
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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Runs every instance as a child process of the orchestrator, one per instance directory.
 * The instance id is the instance name.
 */
@Slf4j
public class ProcessRuntimeBackend implements RuntimeBackend {
    private static final String LIST_KEY = "all";

    private final RuntimeProperties properties;
    private final PortAllocator portAllocator;
    private final ProvisioningService provisioning;
    private final ServerMetadataStore metadataStore;
    private final InstanceDirectories directories;
    private final ProcessTable table;
    private final CommandDispatcher dispatcher;
    private final GracefulShutdown shutdown;
    private final TtlCache<String, List<ServerInstance>> listCache;

    public ProcessRuntimeBackend(RuntimeProperties properties,
                                 PortAllocator portAllocator,
                                 ProvisioningService provisioning,
                                 ServerMetadataStore metadataStore,
                                 InstanceDirectories directories,
                                 ProcessTable table,
                                 CommandDispatcher dispatcher,
                                 Clock clock) {
        this.properties = properties;
        this.portAllocator = portAllocator;
        this.provisioning = provisioning;
        this.metadataStore = metadataStore;
        this.directories = directories;
        this.table = table;
        this.dispatcher = dispatcher;
        RuntimeProperties.Stop stop = properties.getStop();
        this.shutdown = new GracefulShutdown(dispatcher, stop.getCommand(), stop.getTimeout(), stop.getPollInterval());
        this.listCache = new TtlCache<>(properties.getCache().getListTtl(), clock);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.PROCESS;
    }

    @Override
    public ServerInstance create(CreateServerRequest request) {
        String name = request.getName();
        Path dir = directories.resolve(name);
        ensureNameAvailable(name, dir);
        provisioning.ensureArtifacts(request.getType(), request.getVersion(), dir,
                request.getLoaderVersion(), request.getInstallerVersion());

        int minMb = RamSize.parseMb(request.getMinRam());
        int maxMb = RamSize.parseMb(request.getMaxRam());
        int hostPort = portAllocator.pick(request.getHostPort());
        Map<String, String> overrides = MetadataMerger.merge(Map.of(), request.getEnvOverrides());

        Map<String, String> env = new LinkedHashMap<>();
        env.put(RuntimeEnv.SERVER_DIR_NAME, name);
        env.put(RuntimeEnv.MIN_RAM, request.getMinRam());
        env.put(RuntimeEnv.MAX_RAM, request.getMaxRam());
        env.put(RuntimeEnv.SERVER_PORT, String.valueOf(hostPort));
        env.put(RuntimeEnv.SERVER_TYPE, request.getType());
        env.put(RuntimeEnv.SERVER_VERSION, request.getVersion());
        if (Files.isRegularFile(dir.resolve(ArtifactValidator.SERVER_JAR))) {
            env.put(RuntimeEnv.SERVER_JAR, ArtifactValidator.SERVER_JAR);
        }
        env.putAll(overrides);

        metadataStore.update(name, metadata -> {
            metadata.setName(name);
            metadata.setType(request.getType());
            metadata.setVersion(request.getVersion());
            metadata.setLoaderVersion(request.getLoaderVersion());
            metadata.recordRam(request.getMinRam(), request.getMaxRam(), minMb, maxMb);
            metadata.setHostPort(hostPort);
            metadata.setEnvOverrides(overrides);
            metadata.setLabels(request.getExtraLabels());
        });
        spawn(name, env, hostPort);
        return get(name);
    }

    @Override
    public ServerInstance createFromExisting(ExistingServerRequest request) {
        String name = request.getName();
        if (!directories.exists(name)) {
            throw new InstanceNotFoundException(name);
        }
        if (table.livePid(name).isPresent()) {
            throw new ServerRuntimeException("Server " + name + " is already running");
        }
        ServerMetadata stored = metadataStore.readOrEmpty(name);

        String minRam = firstNonBlank(request.getMinRam(), stored.getMinRam(), RuntimeEnv.DEFAULT_MIN_RAM);
        String maxRam = firstNonBlank(request.getMaxRam(), stored.getMaxRam(), RuntimeEnv.DEFAULT_MAX_RAM);
        int minMb = RamSize.parseMb(minRam);
        int maxMb = RamSize.parseMb(maxRam);
        Integer preferred = request.getHostPort() != null ? request.getHostPort() : stored.getHostPort();
        int hostPort = portAllocator.pick(preferred);
        Map<String, String> overrides = MetadataMerger.merge(stored.getEnvOverrides(), request.getEnvOverrides());
        Map<String, String> labels = MetadataMerger.merge(stored.getLabels(), request.getExtraLabels());

        Map<String, String> env = new LinkedHashMap<>();
        env.put(RuntimeEnv.SERVER_DIR_NAME, name);
        env.put(RuntimeEnv.MIN_RAM, minRam);
        env.put(RuntimeEnv.MAX_RAM, maxRam);
        env.put(RuntimeEnv.SERVER_PORT, String.valueOf(hostPort));
        if (stored.getType() != null) {
            env.put(RuntimeEnv.SERVER_TYPE, stored.getType());
        }
        if (stored.getVersion() != null) {
            env.put(RuntimeEnv.SERVER_VERSION, stored.getVersion());
        }
        env.putAll(overrides);

        metadataStore.update(name, metadata -> {
            metadata.setName(name);
            metadata.recordRam(minRam, maxRam, minMb, maxMb);
            metadata.setHostPort(hostPort);
            metadata.setEnvOverrides(overrides);
            metadata.setLabels(labels);
        });
        spawn(name, env, hostPort);
        return get(name);
    }

    @Override
    public OperationResult start(String id) {
        if (table.livePid(id).isPresent()) {
            return new OperationResult(id, InstanceStatus.RUNNING, "noop");
        }
        createFromExisting(ExistingServerRequest.builder().name(id).build());
        return new OperationResult(id, get(id).getStatus(), "start");
    }

    @Override
    public OperationResult stop(String id, boolean force) {
        if (!exists(id)) {
            return new OperationResult(id, InstanceStatus.NOT_FOUND, "noop");
        }
        Optional<Long> pid = table.livePid(id);
        if (pid.isEmpty()) {
            table.forget(id);
            return new OperationResult(id, InstanceStatus.STOPPED, "noop");
        }

        String method;
        if (force) {
            terminate(pid.get(), true);
            method = "kill";
        } else {
            GracefulShutdown.Outcome outcome = shutdown.run(toInstance(id), () -> ProcessTable.isAlive(pid.get()));
            if (!outcome.stopped()) {
                terminate(pid.get(), false);
            }
            method = outcome.stopped() ? outcome.method().orElse("graceful") : "signal";
        }
        table.forget(id);
        listCache.invalidateAll();
        return new OperationResult(id, ProcessTable.isAlive(pid.get()) ? InstanceStatus.ERROR : InstanceStatus.STOPPED,
                method);
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
        return stop(id, true);
    }

    @Override
    public DeleteResult delete(String id) {
        if (!exists(id)) {
            return new DeleteResult(id, true, false);
        }
        removeHandle(id);
        boolean dirRemoved = directories.delete(id);
        listCache.invalidateAll();
        return new DeleteResult(id, true, dirRemoved);
    }

    @Override
    public void removeHandle(String id) {
        if (!exists(id)) {
            return;
        }
        table.livePid(id).ifPresent(pid -> terminate(pid, true));
        table.forget(id);
        listCache.invalidateAll();
    }

    @Override
    public List<ServerInstance> list() {
        return listCache.get(LIST_KEY, () -> directories.listNames().stream()
                .map(this::toInstance)
                .toList());
    }

    @Override
    public ServerInstance get(String id) {
        if (!exists(id)) {
            return ServerInstance.notFound(id, BackendKind.PROCESS);
        }
        return toInstance(id);
    }

    @Override
    public String logs(String id, int tail) {
        if (!exists(id)) {
            throw new InstanceNotFoundException(id);
        }
        Path logFile = directories.resolve(id).resolve(properties.getProcess().getLogFileName());
        if (!Files.isRegularFile(logFile)) {
            return "";
        }
        Deque<String> lines = new ArrayDeque<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(logFile), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.addLast(line);
                if (tail > 0 && lines.size() > tail) {
                    lines.removeFirst();
                }
            }
        } catch (IOException e) {
            throw new ServerRuntimeException("Failed to read log of " + id + ": " + e.getMessage(), e);
        }
        return String.join("\n", lines);
    }

    @Override
    public CommandResult sendCommand(String id, String command) {
        if (!exists(id)) {
            throw new InstanceNotFoundException(id);
        }
        return dispatcher.dispatch(toInstance(id), command);
    }

    private void spawn(String name, Map<String, String> env, int port) {
        Path dir = directories.resolve(name);
        RuntimeProperties.Process config = properties.getProcess();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ServerRuntimeException("Could not create server directory " + dir, e);
        }
        provisioning.acceptEula(dir);
        ensureServerPort(dir, port);

        List<String> command = new ArrayList<>();
        if (config.isNewSession()) {
            command.add("setsid");
        }
        command.addAll(config.getLaunchCommand());

        ProcessBuilder processBuilder = new ProcessBuilder(command)
                .directory(dir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(dir.resolve(config.getLogFileName()).toFile()))
                .redirectInput(ProcessBuilder.Redirect.PIPE);
        processBuilder.environment().putAll(env);
        try {
            Process process = processBuilder.start();
            table.register(name, process);
            log.info("Started server {} as pid {} on port {}", name, process.pid(), port);
        } catch (IOException e) {
            log.error("Failed to launch server process for {}: {}", name, e.getMessage());
            throw new ServerRuntimeException("Failed to launch server process for " + name + ": " + e.getMessage(), e);
        } finally {
            listCache.invalidateAll();
        }
    }

    /**
     * Sends SIGTERM to the process tree, waits for it to exit, then SIGKILLs whatever is left.
     */
    private void terminate(long pid, boolean immediately) {
        Optional<ProcessHandle> root = ProcessHandle.of(pid);
        if (root.isEmpty()) {
            return;
        }
        RuntimeProperties.Process config = properties.getProcess();
        List<ProcessHandle> tree = Stream.concat(Stream.of(root.get()), root.get().descendants()).toList();
        if (!immediately) {
            tree.forEach(ProcessHandle::destroy);
            long deadline = System.nanoTime() + config.getTermWait().toNanos();
            while (root.get().isAlive() && System.nanoTime() < deadline) {
                sleep(config.getLivenessPoll());
            }
            if (!root.get().isAlive()) {
                return;
            }
            log.warn("Process {} ignored SIGTERM for {}s, killing", pid, config.getTermWait().toSeconds());
        }
        tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        try {
            root.get().onExit().get(config.getTermWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Process {} still alive after SIGKILL: {}", pid, e.getMessage());
        }
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static void ensureServerPort(Path dir, int port) {
        Path props = dir.resolve("server.properties");
        try {
            List<String> lines = new ArrayList<>();
            if (Files.isRegularFile(props)) {
                for (String line : Files.readAllLines(props, StandardCharsets.ISO_8859_1)) {
                    if (!line.isBlank()) {
                        lines.add(line);
                    }
                }
            }
            boolean found = false;
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).strip().startsWith("server-port=")) {
                    lines.set(i, "server-port=" + port);
                    found = true;
                    break;
                }
            }
            if (!found) {
                lines.add("server-port=" + port);
            }
            Files.writeString(props, String.join("\n", lines) + "\n", StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            log.warn("Could not align server-port in {}: {}", props, e.getMessage());
        }
    }

    private void ensureNameAvailable(String name, Path dir) {
        table.livePid(name).ifPresent(pid -> {
            throw new InstanceExistsException(name, "running as pid " + pid);
        });
        if (Files.exists(dir)) {
            throw new InstanceExistsException(name, "directory " + dir + " already exists, use createFromExisting");
        }
    }

    private boolean exists(String id) {
        try {
            return directories.exists(id);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private ServerInstance toInstance(String name) {
        ServerMetadata metadata = metadataStore.readOrEmpty(name);
        Optional<Long> pid = table.livePid(name);

        Map<String, String> env = new LinkedHashMap<>();
        if (metadata.getMinRam() != null) {
            env.put(RuntimeEnv.MIN_RAM, metadata.getMinRam());
        }
        if (metadata.getMaxRam() != null) {
            env.put(RuntimeEnv.MAX_RAM, metadata.getMaxRam());
        }
        if (metadata.getHostPort() != null) {
            env.put(RuntimeEnv.SERVER_PORT, String.valueOf(metadata.getHostPort()));
        }
        env.putAll(metadata.getEnvOverrides());

        List<PortBinding> ports = metadata.getHostPort() == null
                ? List.of()
                : List.of(PortBinding.primaryTcp(metadata.getHostPort(), metadata.getHostPort(), "0.0.0.0"));
        ResourceLimits limits = metadata.getMinRamMb() != null && metadata.getMaxRamMb() != null
                ? new ResourceLimits(metadata.getMinRamMb(), metadata.getMaxRamMb())
                : null;

        return ServerInstance.builder()
                .id(name)
                .name(name)
                .backendKind(BackendKind.PROCESS)
                .status(pid.isPresent() ? InstanceStatus.RUNNING : InstanceStatus.STOPPED)
                .type(metadata.getType())
                .version(metadata.getVersion())
                .loaderVersion(metadata.getLoaderVersion())
                .portBindings(ports)
                .resourceLimits(limits)
                .javaConfig(RuntimeEnv.javaConfig(env, metadata.getJavaVersion()))
                .labels(metadata.getLabels())
                .environment(env)
                .createdAt(metadata.getCreatedTs() == null ? null : Instant.ofEpochSecond(metadata.getCreatedTs()))
                .pid(pid.orElse(null))
                .build();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
