package mc.orchestrator.runtime.process;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.ServerMetadata;
import mc.orchestrator.service.InstanceDirectories;
import mc.orchestrator.service.PortScope;
import mc.orchestrator.service.PortUsageProbe;
import mc.orchestrator.service.ServerMetadataStore;
import mc.orchestrator.service.command.RconEndpoint;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Ports held by running process instances: the recorded game port and, for {@link PortScope#ALL}, the RCON port.
 */
@RequiredArgsConstructor
public class ProcessPortUsageProbe implements PortUsageProbe {
    private final InstanceDirectories directories;
    private final ServerMetadataStore metadataStore;
    private final ProcessTable table;

    @Override
    public Set<Integer> usedPorts(PortScope scope) {
        Set<Integer> used = new HashSet<>();
        for (String name : directories.listNames()) {
            if (table.livePid(name).isEmpty()) {
                continue;
            }
            Optional<ServerMetadata> metadata = metadataStore.read(name);
            if (metadata.isEmpty()) {
                continue;
            }
            if (metadata.get().getHostPort() != null) {
                used.add(metadata.get().getHostPort());
            }
            if (scope == PortScope.ALL) {
                String rconPort = metadata.get().getEnvOverrides().get(RconEndpoint.RCON_PORT);
                if (rconPort != null && rconPort.strip().matches("\\d+")) {
                    used.add(Integer.parseInt(rconPort.strip()));
                }
            }
        }
        return used;
    }
}
