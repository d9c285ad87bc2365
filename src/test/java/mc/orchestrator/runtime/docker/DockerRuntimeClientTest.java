package mc.orchestrator.runtime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.StartContainerCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.NetworkSettings;
import com.github.dockerjava.api.model.Ports;
import mc.orchestrator.exception.BackendUnavailableException;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.InstanceStatus;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DockerRuntimeClientTest {

    private final DockerClient dockerClient = mock(DockerClient.class);
    private final InspectContainerCmd inspectCmd = mock(InspectContainerCmd.class);
    private final DockerRuntimeClient client = new DockerRuntimeClient(dockerClient);

    @Test
    void unknownContainerBecomesInstanceNotFound() {
        when(dockerClient.inspectContainerCmd("abc")).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenThrow(new NotFoundException("No such container: abc"));

        assertThatThrownBy(() -> client.inspect("abc"))
                .isInstanceOfSatisfying(InstanceNotFoundException.class,
                        e -> assertThat(e.getInstanceId()).isEqualTo("abc"));
    }

    @Test
    void containerExistsByName() {
        InspectContainerCmd missingCmd = mock(InspectContainerCmd.class);
        when(dockerClient.inspectContainerCmd("survival")).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(mock(InspectContainerResponse.class));
        when(dockerClient.inspectContainerCmd("ghost")).thenReturn(missingCmd);
        when(missingCmd.exec()).thenThrow(new NotFoundException("No such container: ghost"));

        assertThat(client.containerExists("survival")).isTrue();
        assertThat(client.containerExists("ghost")).isFalse();
    }

    @Test
    void unreachableDaemonIsRetriedOnceThenReported() {
        when(dockerClient.inspectContainerCmd("abc")).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenThrow(new RuntimeException(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> client.inspect("abc"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("Docker daemon is unavailable");
        verify(inspectCmd, times(2)).exec();
    }

    @Test
    void startingRunningContainerIsNotAnError() {
        StartContainerCmd startCmd = mock(StartContainerCmd.class);
        when(dockerClient.startContainerCmd("abc")).thenReturn(startCmd);
        when(startCmd.exec()).thenThrow(new NotModifiedException("container already started"));

        assertThatCode(() -> client.startContainer("abc")).doesNotThrowAnyException();
    }

    @Test
    void inspectPrefersWildcardHostBinding() {
        InspectContainerResponse response = mock(InspectContainerResponse.class);
        InspectContainerResponse.ContainerState state = mock(InspectContainerResponse.ContainerState.class);
        ContainerConfig config = mock(ContainerConfig.class);
        NetworkSettings network = mock(NetworkSettings.class);
        Ports ports = new Ports();
        ports.bind(ExposedPort.tcp(25565), Ports.Binding.bindIpAndPort("::", 25570));
        ports.bind(ExposedPort.tcp(25565), Ports.Binding.bindIpAndPort("0.0.0.0", 25570));
        when(response.getId()).thenReturn("abc");
        when(response.getName()).thenReturn("/survival");
        when(response.getCreated()).thenReturn("2024-06-01T10:15:30Z");
        when(response.getState()).thenReturn(state);
        when(state.getStatus()).thenReturn("running");
        when(response.getConfig()).thenReturn(config);
        when(config.getEnv()).thenReturn(new String[]{"MAX_RAM=2G", "JAVA_OPTS=-XX:+UseG1GC -Dfoo=a=b"});
        when(config.getLabels()).thenReturn(Map.of("mc.type", "paper"));
        when(response.getNetworkSettings()).thenReturn(network);
        when(network.getPorts()).thenReturn(ports);
        when(dockerClient.inspectContainerCmd("abc")).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(response);

        ContainerView view = client.inspect("abc");

        assertThat(view.name()).isEqualTo("survival");
        assertThat(view.status()).isEqualTo(InstanceStatus.RUNNING);
        assertThat(view.env()).containsEntry("JAVA_OPTS", "-XX:+UseG1GC -Dfoo=a=b");
        assertThat(view.ports()).singleElement().satisfies(p -> {
            assertThat(p.hostPort()).isEqualTo(25570);
            assertThat(p.hostAddress()).isEqualTo("0.0.0.0");
        });
    }

    @Test
    void recognisesPortConflictsAnywhereInTheCauseChain() {
        RuntimeException wrapped = new RuntimeException("create failed",
                new IllegalStateException("driver failed: Bind for 0.0.0.0:25565 failed: port is already allocated"));

        assertThat(DockerRuntimeClient.isPortConflict(wrapped)).isTrue();
        assertThat(DockerRuntimeClient.isPortConflict(new RuntimeException("listen tcp: address already in use"))).isTrue();
        assertThat(DockerRuntimeClient.isPortConflict(new RuntimeException("no space left on device"))).isFalse();
    }
}
