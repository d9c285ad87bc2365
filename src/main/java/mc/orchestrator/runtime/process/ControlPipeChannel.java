package mc.orchestrator.runtime.process;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.InstanceDirectories;
import mc.orchestrator.service.command.CommandChannel;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Appends the command to the control file the runtime entrypoint tails, when the instance has one.
 */
@RequiredArgsConstructor
public class ControlPipeChannel implements CommandChannel {
    private final InstanceDirectories directories;
    private final String pipeName;

    @Override
    public String name() {
        return "control-pipe";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return Files.isRegularFile(pipe(instance));
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception {
        Files.writeString(pipe(instance), command + "\n", StandardCharsets.UTF_8, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        return Optional.of(CommandResult.ok("Command written to " + pipeName + ": " + command, name()));
    }

    private Path pipe(ServerInstance instance) {
        return directories.resolve(instance.getName()).resolve(pipeName);
    }
}
