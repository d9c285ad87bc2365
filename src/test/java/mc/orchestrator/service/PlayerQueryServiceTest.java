package mc.orchestrator.service;

import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.PlayerInfo;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.service.command.RconConnector;
import mc.orchestrator.service.command.RconEndpoint;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PlayerQueryServiceTest {

    private final RuntimeBackend backend = mock(RuntimeBackend.class);
    private final RconConnector connector = mock(RconConnector.class);
    private final PlayerQueryService service = new PlayerQueryService(backend, connector, new RuntimeProperties());

    private static ServerInstance processInstance(InstanceStatus status, Map<String, String> env) {
        return ServerInstance.builder()
                .id("lobby").name("lobby").backendKind(BackendKind.PROCESS).status(status).environment(env).build();
    }

    @Test
    void parsesVanillaListWithNames() {
        PlayerInfo info = PlayerQueryService.parse("There are 2 of a max of 20 players online: Steve, Alex");

        assertThat(info.online()).isEqualTo(2);
        assertThat(info.max()).isEqualTo(20);
        assertThat(info.names()).containsExactly("Steve", "Alex");
    }

    @Test
    void parsesShortFormWithoutNames() {
        PlayerInfo info = PlayerQueryService.parse("0/50 players online");

        assertThat(info).isEqualTo(new PlayerInfo(0, 50, List.of()));
    }

    @Test
    void unknownResponseIsEmpty() {
        assertThat(PlayerQueryService.parse("Unknown command")).isEqualTo(PlayerInfo.empty());
    }

    @Test
    void queriesRconForRunningInstances() throws IOException {
        when(backend.get("lobby")).thenReturn(processInstance(InstanceStatus.RUNNING,
                Map.of("ENABLE_RCON", "TRUE", "RCON_PASSWORD", "pw", "RCON_PORT", "25600")));
        when(connector.execute(eq(new RconEndpoint("localhost", 25600, "pw")), eq("list")))
                .thenReturn("There are 1 of a max of 10 players online: Notch");

        assertThat(service.players("lobby").names()).containsExactly("Notch");
    }

    @Test
    void rconFailureYieldsEmptyInfo() throws IOException {
        when(backend.get("lobby")).thenReturn(processInstance(InstanceStatus.RUNNING,
                Map.of("ENABLE_RCON", "true", "RCON_PASSWORD", "pw")));
        when(connector.execute(any(), any())).thenThrow(new IOException("refused"));

        assertThat(service.players("lobby")).isEqualTo(PlayerInfo.empty());
    }

    @Test
    void stoppedInstanceIsNotQueried() {
        when(backend.get("lobby")).thenReturn(processInstance(InstanceStatus.STOPPED,
                Map.of("ENABLE_RCON", "true", "RCON_PASSWORD", "pw")));

        assertThat(service.players("lobby")).isEqualTo(PlayerInfo.empty());
        verifyNoInteractions(connector);
    }

    @Test
    void missingInstanceIsReported() {
        when(backend.get("ghost")).thenReturn(ServerInstance.notFound("ghost", BackendKind.PROCESS));

        assertThatThrownBy(() -> service.players("ghost")).isInstanceOf(InstanceNotFoundException.class);
    }
}
