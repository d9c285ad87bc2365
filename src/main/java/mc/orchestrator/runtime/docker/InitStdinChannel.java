package mc.orchestrator.runtime.docker;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandChannel;

import java.time.Duration;
import java.util.Optional;

/**
 * Echoes the command into the stdin of the container's PID 1.
 */
@RequiredArgsConstructor
public class InitStdinChannel implements CommandChannel {
    private final DockerRuntimeClient client;
    private final Duration execTimeout;

    @Override
    public String name() {
        return "stdin";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return instance.getStatus() == InstanceStatus.RUNNING;
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) {
        ExecResult result = client.exec(instance.getId(), execTimeout,
                "sh", "-c", "echo " + ShellQuoting.quote(command) + " > /proc/1/fd/0");
        if (!result.succeeded()) {
            return Optional.empty();
        }
        return Optional.of(CommandResult.ok("Command sent via stdin: " + command, name()));
    }
}
