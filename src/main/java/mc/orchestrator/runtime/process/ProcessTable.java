package mc.orchestrator.runtime.process;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.service.InstanceDirectories;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks server processes: the pid file in each instance directory, plus the {@link Process} handles
 * of children spawned by this JVM, whose stdin pipes stay writable.
 */
@Slf4j
public class ProcessTable {
    private final InstanceDirectories directories;
    private final String pidFileName;
    private final Map<String, Process> children = new ConcurrentHashMap<>();

    public ProcessTable(InstanceDirectories directories, String pidFileName) {
        this.directories = directories;
        this.pidFileName = pidFileName;
    }

    public void register(String name, Process process) {
        children.put(name, process);
        writePid(name, process.pid());
    }

    public Optional<Process> attached(String name) {
        Process process = children.get(name);
        if (process == null || !process.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(process);
    }

    public Optional<Long> readPid(String name) {
        Path pidFile = pidFile(name);
        if (!Files.isRegularFile(pidFile)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(pidFile, StandardCharsets.UTF_8).strip();
            return content.isEmpty() ? Optional.empty() : Optional.of(Long.parseLong(content));
        } catch (IOException | NumberFormatException e) {
            log.warn("Ignoring unreadable pid file {}: {}", pidFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * The recorded pid, if that process is still alive.
     */
    public Optional<Long> livePid(String name) {
        return readPid(name).filter(ProcessTable::isAlive);
    }

    public void forget(String name) {
        children.remove(name);
        try {
            Files.deleteIfExists(pidFile(name));
        } catch (IOException e) {
            log.warn("Could not remove pid file for {}: {}", name, e.getMessage());
        }
    }

    public static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private void writePid(String name, long pid) {
        try {
            Files.writeString(pidFile(name), Long.toString(pid), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not write pid file for {}: {}", name, e.getMessage());
        }
    }

    private Path pidFile(String name) {
        return directories.resolve(name).resolve(pidFileName);
    }
}
