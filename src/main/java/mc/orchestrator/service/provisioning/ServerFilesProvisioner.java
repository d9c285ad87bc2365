package mc.orchestrator.service.provisioning;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Places a runnable server jar or installer for {@code type}/{@code version} into {@code dir}
 * and accepts the EULA there.
 */
public interface ServerFilesProvisioner {

    void prepareFiles(String type, String version, Path dir, String loaderVersion, String installerVersion)
            throws IOException;
}
