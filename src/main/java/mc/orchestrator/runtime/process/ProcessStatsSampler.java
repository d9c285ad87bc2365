package mc.orchestrator.runtime.process;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.model.ResourceStats;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.stats.CpuMath;
import mc.orchestrator.service.stats.ResourceStatsSampler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static mc.orchestrator.model.ResourceStats.round2;

/**
 * Samples the whole process tree of an instance. CPU is measured over a short blocking window, so every call
 * takes at least that long. Network counters are not available per process and are reported as zero.
 */
@Slf4j
public class ProcessStatsSampler implements ResourceStatsSampler {
    private static final double KB_PER_MB = 1024.0;
    private static final Duration PS_TIMEOUT = Duration.ofSeconds(5);

    private final Duration sampleWindow;

    public ProcessStatsSampler(Duration sampleWindow) {
        this.sampleWindow = sampleWindow;
    }

    @Override
    public ResourceStats sample(ServerInstance instance) {
        Optional<ProcessHandle> root = instance.getPid() == null ? Optional.empty() : ProcessHandle.of(instance.getPid());
        if (root.isEmpty() || !root.get().isAlive()) {
            return ResourceStats.unavailable(instance.getId(), "Process is not running");
        }

        List<ProcessHandle> tree = Stream.concat(Stream.of(root.get()), root.get().descendants()).toList();
        Map<Long, Long> before = cpuNanos(tree);
        long started = System.nanoTime();
        try {
            Thread.sleep(sampleWindow.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        long elapsed = System.nanoTime() - started;
        Map<Long, Long> after = cpuNanos(tree);

        long cpuDelta = 0L;
        for (Map.Entry<Long, Long> entry : after.entrySet()) {
            Long previous = before.get(entry.getKey());
            if (previous != null) {
                cpuDelta += Math.max(0L, entry.getValue() - previous);
            }
        }

        long rssKb = 0L;
        for (ProcessHandle handle : tree) {
            if (handle.isAlive()) {
                rssKb += residentKb(handle.pid());
            }
        }
        double usageMb = rssKb / KB_PER_MB;
        double limitMb = instance.getResourceLimits() == null ? 0.0 : instance.getResourceLimits().maxRamMb();
        double memoryPercent = limitMb > 0 ? usageMb / limitMb * 100.0 : 0.0;

        return ResourceStats.builder()
                .id(instance.getId())
                .cpuPercent(round2(CpuMath.processPercent(cpuDelta, elapsed)))
                .memoryUsageMb(round2(usageMb))
                .memoryLimitMb(round2(limitMb))
                .memoryPercent(round2(memoryPercent))
                .networkRxMb(0.0)
                .networkTxMb(0.0)
                .build();
    }

    private static Map<Long, Long> cpuNanos(List<ProcessHandle> tree) {
        Map<Long, Long> result = new HashMap<>();
        for (ProcessHandle handle : tree) {
            handle.info().totalCpuDuration().ifPresent(d -> result.put(handle.pid(), d.toNanos()));
        }
        return result;
    }

    /**
     * Resident set size from {@code /proc/<pid>/status}, falling back to {@code ps} where procfs is absent.
     */
    static long residentKb(long pid) {
        Path status = Path.of("/proc", Long.toString(pid), "status");
        if (Files.isReadable(status)) {
            try {
                for (String line : Files.readAllLines(status, StandardCharsets.UTF_8)) {
                    if (line.startsWith("VmRSS:")) {
                        return Long.parseLong(line.substring("VmRSS:".length()).replaceAll("[^0-9]", ""));
                    }
                }
                return 0L;
            } catch (IOException | NumberFormatException e) {
                log.debug("Could not read {}: {}", status, e.getMessage());
            }
        }
        try {
            Process ps = new ProcessBuilder("ps", "-p", String.valueOf(pid), "-o", "rss=").start();
            return rssFromPs(ps, PS_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | NumberFormatException e) {
            log.debug("Could not get RSS for pid {}: {}", pid, e.getMessage());
        }
        return 0L;
    }

    /**
     * Reads the single {@code rss=} line of a finished {@code ps}. A {@code ps} still running after
     * {@code timeout} is killed and counts as zero.
     */
    static long rssFromPs(Process ps, Duration timeout) throws IOException, InterruptedException {
        if (!ps.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            ps.destroyForcibly();
            log.debug("ps {} timed out after {}ms", ps.pid(), timeout.toMillis());
            return 0L;
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(ps.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            return line == null || line.isBlank() ? 0L : Long.parseLong(line.trim());
        }
    }
}
