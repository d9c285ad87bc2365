package mc.orchestrator.service.provisioning;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.exception.ProvisioningException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Makes sure an instance directory holds a valid provisioning artifact, repairing it once if needed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProvisioningService {
    private final ServerFilesProvisioner provisioner;
    private final ArtifactValidator validator;

    public Path ensureArtifacts(String type, String version, Path dir, String loaderVersion, String installerVersion) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ProvisioningException("Could not create server directory " + dir, e);
        }

        Exception firstFailure = null;
        try {
            provisioner.prepareFiles(type, version, dir, loaderVersion, installerVersion);
        } catch (Exception e) {
            log.warn("Preparing {} {} in {} failed: {}; attempting repair", type, version, dir, e.getMessage());
            firstFailure = e;
        }

        Path artifact = validator.primaryArtifact(type, dir);
        if (firstFailure == null && validator.isValid(artifact)) {
            log.info("Server artifact ready at {}", artifact);
            acceptEula(dir);
            return artifact;
        }
        if (firstFailure == null) {
            log.warn("{} missing or invalid after preparing {} {}; attempting repair", artifact, type, version);
        }
        return repair(type, version, dir, loaderVersion, installerVersion, artifact, firstFailure);
    }

    private Path repair(String type, String version, Path dir, String loaderVersion, String installerVersion,
                        Path badArtifact, Exception firstFailure) {
        try {
            Files.deleteIfExists(badArtifact);
        } catch (IOException e) {
            log.error("Could not remove corrupt artifact {}", badArtifact, e);
        }

        Exception repairFailure = null;
        try {
            provisioner.prepareFiles(type, version, dir, loaderVersion, installerVersion);
        } catch (Exception e) {
            repairFailure = e;
        }

        Path artifact = validator.primaryArtifact(type, dir);
        if (repairFailure == null && validator.isValid(artifact)) {
            log.info("Repaired server artifact at {}", artifact);
            acceptEula(dir);
            return artifact;
        }

        StringBuilder message = new StringBuilder()
                .append("Failed to provision a valid ").append(type).append(' ').append(version)
                .append(" artifact in ").append(dir);
        if (repairFailure != null) {
            message.append(" (repair: ").append(repairFailure.getMessage()).append(')');
        } else if (firstFailure != null) {
            message.append(" (first attempt: ").append(firstFailure.getMessage()).append(')');
        } else {
            message.append(" (").append(artifact.getFileName()).append(" still fails size/magic validation)");
        }
        log.error(message.toString());
        throw new ProvisioningException(message.toString(), repairFailure != null ? repairFailure : firstFailure);
    }

    public void acceptEula(Path dir) {
        try {
            Files.writeString(dir.resolve("eula.txt"), "eula=true\n");
        } catch (IOException e) {
            log.warn("Could not write eula.txt in {}: {}", dir, e.getMessage());
        }
    }
}
