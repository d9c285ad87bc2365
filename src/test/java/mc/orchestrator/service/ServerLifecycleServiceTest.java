package mc.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import mc.orchestrator.dto.ExistingServerRequest;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.exception.ServerRuntimeException;
import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.PortBinding;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.model.ServerMetadata;
import mc.orchestrator.runtime.RuntimeBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ServerLifecycleServiceTest {

    @TempDir
    Path root;

    private final RuntimeBackend backend = mock(RuntimeBackend.class);
    private ServerMetadataStore metadataStore;
    private ServerLifecycleService service;

    @BeforeEach
    void setUp() throws Exception {
        InstanceDirectories directories = new InstanceDirectories(root);
        metadataStore = new ServerMetadataStore(directories, "server_meta.json", new ObjectMapper(), Clock.systemUTC());
        service = new ServerLifecycleService(backend, metadataStore, directories);
        Files.createDirectories(root.resolve("survival"));
        metadataStore.update("survival", m -> {
            m.setType("paper");
            m.setHostPort(25570);
            m.setEnvOverrides(Map.of("MOTD", "hello"));
        });
        when(backend.get("c1")).thenReturn(ServerInstance.builder()
                .id("c1")
                .name("survival")
                .backendKind(BackendKind.CONTAINER)
                .status(InstanceStatus.RUNNING)
                .portBindings(List.of(PortBinding.primaryTcp(25565, 25570, "0.0.0.0")))
                .environment(Map.of("MIN_RAM", "1G", "MAX_RAM", "3G"))
                .build());
        when(backend.createFromExisting(any())).thenAnswer(inv -> ServerInstance.builder()
                .id("c2")
                .name(inv.getArgument(0, ExistingServerRequest.class).getName())
                .status(InstanceStatus.RUNNING)
                .build());
    }

    @Test
    void renameRefusesTakenNameBeforeStoppingAnything() throws Exception {
        Files.createDirectories(root.resolve("creative"));

        assertThatThrownBy(() -> service.rename("c1", "creative"))
                .isInstanceOf(ServerRuntimeException.class)
                .hasMessageContaining("creative");
        verify(backend, never()).stop(anyString(), anyBoolean());
        verify(backend, never()).removeHandle(anyString());
        assertThat(root.resolve("survival")).isDirectory();
    }

    @Test
    void renameMovesDirectoryAndRecreatesUnderNewName() {
        ServerInstance renamed = service.rename("c1", "hardcore");

        InOrder order = inOrder(backend);
        order.verify(backend).stop("c1", false);
        order.verify(backend).removeHandle("c1");
        ArgumentCaptor<ExistingServerRequest> request = ArgumentCaptor.forClass(ExistingServerRequest.class);
        order.verify(backend).createFromExisting(request.capture());

        assertThat(renamed.getName()).isEqualTo("hardcore");
        assertThat(request.getValue().getHostPort()).isEqualTo(25570);
        assertThat(request.getValue().getMaxRam()).isEqualTo("3G");
        assertThat(request.getValue().getEnvOverrides()).containsEntry("MOTD", "hello");
        assertThat(root.resolve("survival")).doesNotExist();
        ServerMetadata metadata = metadataStore.read("hardcore").orElseThrow();
        assertThat(metadata.getName()).isEqualTo("hardcore");
        assertThat(metadata.getPreviousNames()).containsExactly("survival");
    }

    @Test
    void renameRejectsInvalidOrSameName() {
        assertThatThrownBy(() -> service.rename("c1", "../escape")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.rename("c1", "survival")).isInstanceOf(IllegalArgumentException.class);
        verify(backend, never()).removeHandle(anyString());
    }

    @Test
    void updateJavaVersionRecordsChoiceAndRecreatesWithIt() {
        service.updateJavaVersion("c1", "17");

        ArgumentCaptor<ExistingServerRequest> request = ArgumentCaptor.forClass(ExistingServerRequest.class);
        verify(backend).createFromExisting(request.capture());
        assertThat(request.getValue().getEnvOverrides())
                .containsEntry("JAVA_VERSION", "17")
                .containsEntry("JAVA_BIN", "/usr/local/bin/java17");
        assertThat(request.getValue().getExtraLabels()).containsEntry("mc.java_version", "17");
        ServerMetadata metadata = metadataStore.read("survival").orElseThrow();
        assertThat(metadata.getJavaVersion()).isEqualTo("17");
        assertThat(metadata.getJavaBin()).isEqualTo("/usr/local/bin/java17");
    }

    @Test
    void updateJavaVersionRejectsUnsupportedVersions() {
        assertThatThrownBy(() -> service.updateJavaVersion("c1", "16"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("8, 11, 17, or 21");
        verify(backend, never()).createFromExisting(any());
    }

    @Test
    void recreateKeepsPortAndRamOfCurrentInstance() {
        service.recreateWithEnv("c1", Map.of("DIFFICULTY", "hard"));

        ArgumentCaptor<ExistingServerRequest> request = ArgumentCaptor.forClass(ExistingServerRequest.class);
        verify(backend).createFromExisting(request.capture());
        assertThat(request.getValue().getName()).isEqualTo("survival");
        assertThat(request.getValue().getHostPort()).isEqualTo(25570);
        assertThat(request.getValue().getMinRam()).isEqualTo("1G");
        assertThat(request.getValue().getEnvOverrides()).containsExactly(Map.entry("DIFFICULTY", "hard"));
    }

    @Test
    void unknownInstanceIsReported() {
        when(backend.get("ghost")).thenReturn(ServerInstance.notFound("ghost", BackendKind.CONTAINER));

        assertThatThrownBy(() -> service.recreateWithEnv("ghost", Map.of()))
                .isInstanceOf(InstanceNotFoundException.class);
    }
}
