package mc.orchestrator.service;

import java.util.Set;

@FunctionalInterface
public interface PortUsageProbe {

    Set<Integer> usedPorts(PortScope scope);
}
