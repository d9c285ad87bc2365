package mc.orchestrator.service.provisioning;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class ArtifactValidator {
    public static final String SERVER_JAR = "server.jar";
    private static final Set<String> INSTALLER_TYPES = Set.of("forge", "neoforge");

    private final long minBytes;

    public ArtifactValidator(long minBytes) {
        this.minBytes = minBytes;
    }

    public static boolean isInstallerType(String type) {
        return type != null && INSTALLER_TYPES.contains(type.toLowerCase(Locale.ROOT));
    }

    /**
     * The file that must be present before the instance can start: {@code server.jar}, the Fabric launcher
     * when no {@code server.jar} exists, or the installer jar for installer-based types.
     */
    public Path primaryArtifact(String type, Path dir) {
        if (isInstallerType(type)) {
            return findInstaller(dir).orElse(dir.resolve(SERVER_JAR));
        }
        Path serverJar = dir.resolve(SERVER_JAR);
        if (!Files.exists(serverJar) && "fabric".equalsIgnoreCase(type)) {
            Path launcher = dir.resolve("fabric-server-launch.jar");
            if (Files.exists(launcher)) {
                return launcher;
            }
        }
        return serverJar;
    }

    public boolean isValid(Path artifact) {
        try {
            if (!Files.isRegularFile(artifact)) {
                return false;
            }
            long size = Files.size(artifact);
            if (size < minBytes) {
                log.debug("Artifact {} is too small ({} bytes < {})", artifact, size, minBytes);
                return false;
            }
            String fileName = artifact.getFileName().toString().toLowerCase(Locale.ROOT);
            if (fileName.endsWith(".jar") || fileName.endsWith(".zip")) {
                return hasZipMagic(artifact);
            }
            return true;
        } catch (IOException e) {
            log.debug("Could not inspect artifact {}: {}", artifact, e.getMessage());
            return false;
        }
    }

    private boolean hasZipMagic(Path artifact) throws IOException {
        byte[] magic = new byte[2];
        try (InputStream in = Files.newInputStream(artifact)) {
            if (in.readNBytes(magic, 0, 2) < 2) {
                return false;
            }
        }
        boolean ok = magic[0] == 'P' && magic[1] == 'K';
        if (!ok) {
            log.debug("Artifact {} is missing the PK header", artifact);
        }
        return ok;
    }

    private Optional<Path> findInstaller(Path dir) {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*installer*.jar")) {
            for (Path p : stream) {
                return Optional.of(p);
            }
        } catch (IOException e) {
            log.debug("Could not scan {} for installers: {}", dir, e.getMessage());
        }
        return Optional.empty();
    }
}
