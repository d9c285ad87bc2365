package mc.orchestrator.runtime.docker;

import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.PortBinding;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Engine-independent snapshot of one container, as listed or inspected.
 */
public record ContainerView(String id,
                            String name,
                            String state,
                            String image,
                            Map<String, String> labels,
                            Map<String, String> env,
                            List<PortBinding> ports,
                            Instant createdAt,
                            Long memoryBytes) {

    public InstanceStatus status() {
        return InstanceStatus.fromDockerState(state);
    }

    public boolean running() {
        return status() == InstanceStatus.RUNNING;
    }
}
