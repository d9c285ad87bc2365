package mc.orchestrator.runtime.docker;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.PortBinding;
import mc.orchestrator.service.PortScope;
import mc.orchestrator.service.PortUsageProbe;

import java.util.HashSet;
import java.util.Set;

/**
 * Host ports published by any container on the engine, managed by us or not.
 */
@RequiredArgsConstructor
public class DockerPortUsageProbe implements PortUsageProbe {
    private final DockerRuntimeClient client;
    private final int gamePort;

    @Override
    public Set<Integer> usedPorts(PortScope scope) {
        Set<Integer> used = new HashSet<>();
        for (ContainerView container : client.listContainers(null)) {
            for (PortBinding binding : container.ports()) {
                if (binding.hostPort() == null) {
                    continue;
                }
                if (scope == PortScope.GAME_PORT && binding.containerPort() != gamePort) {
                    continue;
                }
                used.add(binding.hostPort());
            }
        }
        return used;
    }
}
