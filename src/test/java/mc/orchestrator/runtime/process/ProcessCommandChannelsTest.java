package mc.orchestrator.runtime.process;

import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.InstanceDirectories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessCommandChannelsTest {

    @TempDir
    Path root;

    private static ServerInstance instance(Long pid) {
        return ServerInstance.builder().id("alpha").name("alpha").backendKind(BackendKind.PROCESS)
                .status(InstanceStatus.RUNNING).pid(pid).build();
    }

    @Test
    void controlPipeAppendsCommandWhenPresent() throws Exception {
        Path dir = Files.createDirectories(root.resolve("alpha"));
        Files.writeString(dir.resolve("console.in"), "");
        ControlPipeChannel channel = new ControlPipeChannel(new InstanceDirectories(root), "console.in");

        assertThat(channel.supports(instance(null))).isTrue();
        Optional<CommandResult> first = channel.trySend(instance(null), "say one");
        channel.trySend(instance(null), "say two");

        assertThat(first).get().extracting(CommandResult::method).isEqualTo("control-pipe");
        assertThat(Files.readAllLines(dir.resolve("console.in"))).containsExactly("say one", "say two");
    }

    @Test
    void controlPipeIsSkippedWithoutFile() throws Exception {
        Files.createDirectories(root.resolve("alpha"));
        ControlPipeChannel channel = new ControlPipeChannel(new InstanceDirectories(root), "console.in");

        assertThat(channel.supports(instance(null))).isFalse();
    }

    @Test
    void attachedStdinNeedsChildOfThisJvm() {
        AttachedStdinChannel channel = new AttachedStdinChannel(new ProcessTable(new InstanceDirectories(root), ".server.pid"));

        assertThat(channel.supports(instance(ProcessHandle.current().pid()))).isFalse();
    }

    @Test
    void pidChannelsNeedARecordedPid() {
        assertThat(new InitProcessStdinChannel().supports(instance(null))).isFalse();
        assertThat(new JavaDescendantStdinChannel().supports(instance(null))).isFalse();
    }

    @Test
    void findJavaIgnoresTreesWithoutJava() {
        assertThat(JavaDescendantStdinChannel.findJava(ProcessHandle.current().pid())).isEmpty();
    }
}
