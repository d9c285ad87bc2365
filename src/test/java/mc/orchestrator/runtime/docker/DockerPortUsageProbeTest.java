package mc.orchestrator.runtime.docker;

import mc.orchestrator.model.PortBinding;
import mc.orchestrator.service.PortScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DockerPortUsageProbeTest {

    private final DockerRuntimeClient client = mock(DockerRuntimeClient.class);
    private final DockerPortUsageProbe probe = new DockerPortUsageProbe(client, 25565);

    @BeforeEach
    void setUp() {
        ContainerView managed = new ContainerView("c1", "survival", "running", "mc-runtime:latest", Map.of(), Map.of(),
                List.of(PortBinding.tcp(25565, 25565, "0.0.0.0"), PortBinding.tcp(25575, 25575, "0.0.0.0")), null, null);
        ContainerView foreign = new ContainerView("c2", "postgres", "running", "postgres:16", Map.of(), Map.of(),
                List.of(PortBinding.tcp(5432, 5432, "0.0.0.0"), PortBinding.tcp(9000, null, null)), null, null);
        when(client.listContainers(null)).thenReturn(List.of(managed, foreign));
    }

    @Test
    void allScopeIncludesEveryPublishedPort() {
        assertThat(probe.usedPorts(PortScope.ALL)).containsExactlyInAnyOrder(25565, 25575, 5432);
    }

    @Test
    void gamePortScopeKeepsOnlyGamePortBindings() {
        assertThat(probe.usedPorts(PortScope.GAME_PORT)).containsExactly(25565);
    }
}
