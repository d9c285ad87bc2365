package mc.orchestrator.service.provisioning;

import mc.orchestrator.exception.ProvisioningException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProvisioningServiceTest {

    private static final long MIN_BYTES = 100;

    @TempDir
    Path dir;

    private static byte[] validJar() {
        byte[] bytes = new byte[256];
        Arrays.fill(bytes, (byte) 1);
        bytes[0] = 'P';
        bytes[1] = 'K';
        return bytes;
    }

    @Test
    void validArtifactOnFirstAttemptNeedsNoRepair() {
        AtomicInteger calls = new AtomicInteger();
        ProvisioningService service = new ProvisioningService((type, version, target, loader, installer) -> {
            calls.incrementAndGet();
            Files.write(target.resolve("server.jar"), validJar());
        }, new ArtifactValidator(MIN_BYTES));

        Path artifact = service.ensureArtifacts("paper", "1.20.4", dir, null, null);

        assertThat(artifact).isEqualTo(dir.resolve("server.jar"));
        assertThat(calls).hasValue(1);
        assertThat(dir.resolve("eula.txt")).hasContent("eula=true");
    }

    @Test
    void truncatedJarTriggersExactlyOneRepair() {
        AtomicInteger calls = new AtomicInteger();
        ProvisioningService service = new ProvisioningService((type, version, target, loader, installer) -> {
            if (calls.incrementAndGet() == 1) {
                Files.write(target.resolve("server.jar"), new byte[10]);
            } else {
                Files.write(target.resolve("server.jar"), validJar());
            }
        }, new ArtifactValidator(MIN_BYTES));

        Path artifact = service.ensureArtifacts("vanilla", "1.20.4", dir, null, null);

        assertThat(calls).hasValue(2);
        assertThat(artifact).hasBinaryContent(validJar());
    }

    @Test
    void failedRepairRaisesProvisioningError() {
        AtomicInteger calls = new AtomicInteger();
        ProvisioningService service = new ProvisioningService((type, version, target, loader, installer) -> {
            calls.incrementAndGet();
            throw new IOException("upstream returned 503");
        }, new ArtifactValidator(MIN_BYTES));

        assertThatThrownBy(() -> service.ensureArtifacts("purpur", "1.20.4", dir, null, null))
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("purpur 1.20.4")
                .hasMessageContaining("upstream returned 503");
        assertThat(calls).hasValue(2);
    }

    @Test
    void installerTypesAreValidatedOnTheInstallerJar() throws IOException {
        ArtifactValidator validator = new ArtifactValidator(MIN_BYTES);
        Path installer = Files.write(dir.resolve("forge-1.20.1-47.2.0-installer.jar"), validJar());

        assertThat(validator.primaryArtifact("forge", dir)).isEqualTo(installer);
        assertThat(validator.isValid(installer)).isTrue();
    }

    @Test
    void jarWithoutZipHeaderIsInvalid() throws IOException {
        byte[] bytes = validJar();
        bytes[0] = '<';
        Path jar = Files.write(dir.resolve("server.jar"), bytes);

        assertThat(new ArtifactValidator(MIN_BYTES).isValid(jar)).isFalse();
    }
}
