package mc.orchestrator.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Layout of instance directories under the servers root: one directory per instance name.
 */
@Slf4j
public class InstanceDirectories {
    @Getter
    private final Path root;

    public InstanceDirectories(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Creates {@code preferred}; when that is not possible falls back to {@code fallback}.
     */
    public static InstanceDirectories createWithFallback(Path preferred, Path fallback) {
        try {
            Files.createDirectories(preferred);
            return new InstanceDirectories(preferred);
        } catch (IOException | SecurityException e) {
            log.warn("Could not create servers root {} ({}); falling back to {}", preferred, e.getMessage(), fallback);
            try {
                Files.createDirectories(fallback);
            } catch (IOException ex) {
                log.error("Failed to create fallback servers root {}", fallback, ex);
            }
            return new InstanceDirectories(fallback);
        }
    }

    public Path resolve(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\")
                || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Invalid server name: " + name);
        }
        return root.resolve(name);
    }

    public boolean exists(String name) {
        return Files.isDirectory(resolve(name));
    }

    public List<String> listNames() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> stream = Files.list(root)) {
            stream.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .forEach(names::add);
        } catch (IOException e) {
            log.warn("Failed to list servers root {}: {}", root, e.getMessage());
        }
        return names;
    }

    /**
     * Moves {@code from} to {@code to}. Fails without touching anything if {@code to} already exists.
     */
    public Path rename(String from, String to) throws IOException {
        Path source = resolve(from);
        Path target = resolve(to);
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException("Target directory already exists: " + target);
        }
        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException("Source directory does not exist: " + source);
        }
        return Files.move(source, target);
    }

    /**
     * Best-effort removal of an instance directory. A symlinked instance directory has its target removed
     * only when that target is a directory of the same name directly under the servers root's real path;
     * any other target is shared and only the link goes. Links inside the tree are unlinked, never followed.
     */
    public boolean delete(String name) {
        Path dir = resolve(name);
        try {
            if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
                return false;
            }
            if (Files.isSymbolicLink(dir)) {
                Path target = dir.toRealPath();
                Files.delete(dir);
                if (isDedicatedTarget(name, target)) {
                    deleteTree(target);
                } else {
                    log.info("Left shared symlink target {} of {} in place", target, dir);
                }
                return true;
            }
            deleteTree(dir);
            return true;
        } catch (IOException e) {
            log.warn("Failed to remove instance directory {}: {}", dir, e.getMessage());
            return false;
        }
    }

    private boolean isDedicatedTarget(String name, Path target) throws IOException {
        Path realRoot = Files.exists(root) ? root.toRealPath() : root;
        return target.getFileName() != null
                && target.getFileName().toString().equals(name)
                && realRoot.equals(target.getParent());
    }

    private void deleteTree(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
