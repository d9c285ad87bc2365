package mc.orchestrator.runtime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import com.github.dockerjava.api.model.CpuStatsConfig;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.MemoryStatsConfig;
import com.github.dockerjava.api.model.Mount;
import com.github.dockerjava.api.model.MountType;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.StatisticNetworksConfig;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.InvocationBuilder;
import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.exception.BackendUnavailableException;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.PortBinding;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Thin facade over the Docker engine API. Translates engine failures into this project's exceptions:
 * an unreachable daemon is retried once and then surfaced as {@link BackendUnavailableException},
 * an unknown container as {@link InstanceNotFoundException}.
 */
@Slf4j
public class DockerRuntimeClient {
    private static final String DOCKER_HINT =
            "Ensure Docker is installed, running, and that the process can access the Docker socket "
                    + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerClient dockerClient;

    public DockerRuntimeClient(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    public boolean imageExists(String image) {
        return callDocker("inspect image " + image, () -> {
            try {
                dockerClient.inspectImageCmd(image).exec();
                return true;
            } catch (NotFoundException e) {
                return false;
            }
        });
    }

    public boolean containerExists(String nameOrId) {
        return callDocker("inspect container " + nameOrId, () -> {
            try {
                dockerClient.inspectContainerCmd(nameOrId).exec();
                return true;
            } catch (NotFoundException e) {
                return false;
            }
        });
    }

    public List<ContainerView> listContainers(Map<String, String> labelFilter) {
        return callDocker("list containers", () -> {
            var cmd = dockerClient.listContainersCmd().withShowAll(true);
            if (labelFilter != null && !labelFilter.isEmpty()) {
                cmd = cmd.withLabelFilter(labelFilter);
            }
            List<ContainerView> views = new ArrayList<>();
            for (Container c : cmd.exec()) {
                views.add(toView(c));
            }
            return views;
        });
    }

    public ContainerView inspect(String containerId) {
        return callDocker("inspect container " + containerId, containerId,
                () -> toView(dockerClient.inspectContainerCmd(containerId).exec()));
    }

    public String createContainer(ContainerLaunchSpec spec) {
        return callDocker("create container " + spec.name(), () -> {
            ExposedPort gamePort = ExposedPort.tcp(spec.containerPort());
            Ports.Binding hostBinding = spec.hostPort() == null
                    ? Ports.Binding.empty()
                    : Ports.Binding.bindPort(spec.hostPort());
            HostConfig hostConfig = HostConfig.newHostConfig()
                    .withPortBindings(new com.github.dockerjava.api.model.PortBinding(hostBinding, gamePort));
            if (spec.bindHostPath() != null) {
                hostConfig = hostConfig.withBinds(new Bind(spec.bindHostPath(), new Volume(spec.bindTarget()), AccessMode.rw));
            } else if (spec.volumeName() != null) {
                hostConfig = hostConfig.withMounts(List.of(new Mount()
                        .withType(MountType.VOLUME)
                        .withSource(spec.volumeName())
                        .withTarget(spec.volumeTarget())));
            }
            if (spec.memoryBytes() != null) {
                hostConfig = hostConfig.withMemory(spec.memoryBytes());
            }
            if (spec.network() != null && !spec.network().isBlank()) {
                hostConfig = hostConfig.withNetworkMode(spec.network());
            }

            CreateContainerCmd createCmd = dockerClient.createContainerCmd(spec.image())
                    .withName(spec.name())
                    .withLabels(spec.labels())
                    .withEnv(toEnvList(spec.env()))
                    .withExposedPorts(gamePort)
                    .withHostConfig(hostConfig)
                    .withTty(true)
                    .withStdinOpen(true)
                    .withAttachStdin(true)
                    .withWorkingDir(spec.workingDir());
            if (spec.entrypoint() != null && !spec.entrypoint().isEmpty()) {
                createCmd = createCmd.withEntrypoint(spec.entrypoint());
            }
            CreateContainerResponse response = createCmd.exec();
            return response.getId();
        });
    }

    public void startContainer(String containerId) {
        callDocker("start container " + containerId, containerId, () -> {
            try {
                dockerClient.startContainerCmd(containerId).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already running", containerId);
            }
            return null;
        });
    }

    public void stopContainer(String containerId, Duration timeout) {
        callDocker("stop container " + containerId, containerId, () -> {
            try {
                dockerClient.stopContainerCmd(containerId).withTimeout((int) timeout.toSeconds()).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already stopped", containerId);
            }
            return null;
        });
    }

    public void killContainer(String containerId) {
        callDocker("kill container " + containerId, containerId, () -> {
            dockerClient.killContainerCmd(containerId).exec();
            return null;
        });
    }

    public void removeContainer(String containerId) {
        callDocker("remove container " + containerId, containerId, () -> {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            return null;
        });
    }

    public String logs(String containerId, int tail) {
        return callDocker("read logs of " + containerId, containerId, () -> {
            StringBuilder out = new StringBuilder();
            var cmd = dockerClient.logContainerCmd(containerId).withStdOut(true).withStdErr(true);
            if (tail > 0) {
                cmd = cmd.withTail(tail);
            }
            try {
                cmd.exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        out.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                    }
                }).awaitCompletion(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return out.toString();
        });
    }

    public ExecResult exec(String containerId, Duration timeout, String... command) {
        return callDocker("exec in " + containerId, containerId, () -> {
            String execId = dockerClient.execCreateCmd(containerId)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withCmd(command)
                    .exec()
                    .getId();
            StringBuilder out = new StringBuilder();
            try {
                boolean finished = dockerClient.execStartCmd(execId).exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        out.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                    }
                }).awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    return new ExecResult(-1, "exec timed out: " + Arrays.toString(command));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new ExecResult(-1, "exec interrupted");
            }
            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return new ExecResult(exitCode == null ? -1 : exitCode, out.toString());
        });
    }

    /**
     * Writes one line to the container's attached stdin and collects whatever it prints within {@code readWindow}.
     */
    public String attachAndWrite(String containerId, String line, Duration readWindow) throws IOException {
        StringBuilder out = new StringBuilder();
        ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                out.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
            }
        };
        callDocker("attach to " + containerId, containerId, () -> dockerClient.attachContainerCmd(containerId)
                .withStdIn(new ByteArrayInputStream((line + "\n").getBytes(StandardCharsets.UTF_8)))
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(true)
                .exec(callback));
        try {
            callback.awaitCompletion(readWindow.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            callback.close();
        }
        return out.toString().strip();
    }

    public ContainerStatsSnapshot stats(String containerId) {
        return callDocker("read stats of " + containerId, containerId, () -> {
            InvocationBuilder.AsyncResultCallback<Statistics> callback = new InvocationBuilder.AsyncResultCallback<>();
            dockerClient.statsCmd(containerId).withNoStream(true).exec(callback);
            Statistics stats = callback.awaitResult();
            try {
                callback.close();
            } catch (IOException e) {
                log.debug("Failed to close stats stream for {}: {}", containerId, e.getMessage());
            }
            return toSnapshot(stats);
        });
    }

    public static boolean isPortConflict(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (messageContains(t, "port is already allocated") || messageContains(t, "address already in use")) {
                return true;
            }
        }
        return false;
    }

    private ContainerStatsSnapshot toSnapshot(Statistics stats) {
        CpuStatsConfig cpu = stats.getCpuStats();
        CpuStatsConfig preCpu = stats.getPreCpuStats();
        long cpuTotal = cpu != null && cpu.getCpuUsage() != null ? nz(cpu.getCpuUsage().getTotalUsage()) : 0L;
        long preCpuTotal = preCpu != null && preCpu.getCpuUsage() != null ? nz(preCpu.getCpuUsage().getTotalUsage()) : 0L;
        long system = cpu != null ? nz(cpu.getSystemCpuUsage()) : 0L;
        long preSystem = preCpu != null ? nz(preCpu.getSystemCpuUsage()) : 0L;
        int onlineCpus = 0;
        if (cpu != null && cpu.getOnlineCpus() != null) {
            onlineCpus = cpu.getOnlineCpus().intValue();
        } else if (cpu != null && cpu.getCpuUsage() != null && cpu.getCpuUsage().getPercpuUsage() != null) {
            onlineCpus = cpu.getCpuUsage().getPercpuUsage().size();
        }

        MemoryStatsConfig memory = stats.getMemoryStats();
        long usage = memory != null ? nz(memory.getUsage()) : 0L;
        Long cache = memory != null && memory.getStats() != null ? memory.getStats().getCache() : null;
        long limit = memory != null ? nz(memory.getLimit()) : 0L;

        long rx = 0L;
        long tx = 0L;
        Map<String, StatisticNetworksConfig> networks = stats.getNetworks();
        if (networks != null) {
            for (StatisticNetworksConfig net : networks.values()) {
                rx += nz(net.getRxBytes());
                tx += nz(net.getTxBytes());
            }
        }
        return new ContainerStatsSnapshot(cpuTotal, preCpuTotal, system, preSystem, Math.max(onlineCpus, 1),
                usage, cache, limit, rx, tx);
    }

    private ContainerView toView(Container c) {
        String name = c.getNames() != null && c.getNames().length > 0 ? stripSlash(c.getNames()[0]) : c.getId();
        List<PortBinding> ports = new ArrayList<>();
        if (c.getPorts() != null) {
            for (ContainerPort p : c.getPorts()) {
                if (p.getPrivatePort() == null) {
                    continue;
                }
                ports.add(new PortBinding(p.getPrivatePort(), p.getType() == null ? "tcp" : p.getType(),
                        p.getPublicPort(), p.getIp(), false));
            }
        }
        Instant created = c.getCreated() == null ? null : Instant.ofEpochSecond(c.getCreated());
        return new ContainerView(c.getId(), name, c.getState(), c.getImage(),
                c.getLabels() == null ? Map.of() : c.getLabels(), Map.of(), dedupe(ports), created, null);
    }

    private ContainerView toView(InspectContainerResponse r) {
        Map<String, String> env = new LinkedHashMap<>();
        Map<String, String> labels = Map.of();
        String image = null;
        if (r.getConfig() != null) {
            if (r.getConfig().getEnv() != null) {
                for (String entry : r.getConfig().getEnv()) {
                    int idx = entry.indexOf('=');
                    if (idx > 0) {
                        env.put(entry.substring(0, idx), entry.substring(idx + 1));
                    }
                }
            }
            if (r.getConfig().getLabels() != null) {
                labels = r.getConfig().getLabels();
            }
            image = r.getConfig().getImage();
        }
        List<PortBinding> ports = new ArrayList<>();
        if (r.getNetworkSettings() != null && r.getNetworkSettings().getPorts() != null) {
            for (Map.Entry<ExposedPort, Ports.Binding[]> e : r.getNetworkSettings().getPorts().getBindings().entrySet()) {
                ExposedPort exposed = e.getKey();
                String protocol = exposed.getProtocol() == null ? "tcp" : exposed.getProtocol().toString();
                Ports.Binding[] bindings = e.getValue();
                if (bindings == null || bindings.length == 0) {
                    ports.add(new PortBinding(exposed.getPort(), protocol, null, null, false));
                    continue;
                }
                Ports.Binding chosen = Arrays.stream(bindings)
                        .filter(b -> "0.0.0.0".equals(b.getHostIp()))
                        .findFirst()
                        .orElse(bindings[0]);
                ports.add(new PortBinding(exposed.getPort(), protocol, parsePort(chosen.getHostPortSpec()),
                        chosen.getHostIp(), false));
            }
        }
        String state = r.getState() != null ? r.getState().getStatus() : null;
        Long memory = r.getHostConfig() != null ? r.getHostConfig().getMemory() : null;
        return new ContainerView(r.getId(), stripSlash(r.getName()), state, image, labels, env, ports,
                parseInstant(r.getCreated()), memory);
    }

    private List<PortBinding> dedupe(List<PortBinding> ports) {
        Map<String, PortBinding> byKey = new LinkedHashMap<>();
        for (PortBinding p : ports) {
            PortBinding existing = byKey.get(p.key());
            if (existing == null || (existing.hostPort() == null && p.hostPort() != null)
                    || ("0.0.0.0".equals(p.hostAddress()) && !"0.0.0.0".equals(existing.hostAddress()))) {
                byKey.put(p.key(), p);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private static Integer parsePort(String spec) {
        if (spec == null || spec.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(spec.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String stripSlash(String name) {
        return name != null && name.startsWith("/") ? name.substring(1) : name;
    }

    private static long nz(Long value) {
        return value == null ? 0L : value;
    }

    private List<String> toEnvList(Map<String, String> env) {
        if (env == null) {
            return List.of();
        }
        return env.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .toList();
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        return callDocker(action, null, supplier);
    }

    private <T> T callDocker(String action, String containerId, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (NotFoundException e) {
            if (containerId != null) {
                throw new InstanceNotFoundException(containerId, e);
            }
            throw e;
        } catch (RuntimeException e) {
            if (!isDockerUnavailable(e)) {
                throw e;
            }
            log.warn("Docker daemon unreachable while trying to {}; retrying once", action);
        }
        try {
            return supplier.get();
        } catch (NotFoundException e) {
            if (containerId != null) {
                throw new InstanceNotFoundException(containerId, e);
            }
            throw e;
        } catch (RuntimeException e) {
            if (isDockerUnavailable(e)) {
                log.error("Docker daemon unavailable, could not {}", action);
                throw new BackendUnavailableException(
                        "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT, e);
            }
            throw e;
        }
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof BackendUnavailableException
                    || t instanceof ConnectException
                    || t instanceof NoRouteToHostException
                    || t instanceof SocketTimeoutException
                    || t instanceof UnknownHostException
                    || t instanceof FileNotFoundException
                    || t instanceof NoSuchFileException
                    || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "Could not find a valid Docker environment")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private static boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
