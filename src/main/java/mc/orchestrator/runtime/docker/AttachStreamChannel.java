package mc.orchestrator.runtime.docker;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandChannel;

import java.time.Duration;
import java.util.Optional;

/**
 * Writes the command to the container's attached stdin and returns whatever is printed in the read window.
 */
@RequiredArgsConstructor
public class AttachStreamChannel implements CommandChannel {
    private final DockerRuntimeClient client;
    private final Duration readWindow;

    @Override
    public String name() {
        return "attach_socket";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return instance.getStatus() == InstanceStatus.RUNNING;
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception {
        String output = client.attachAndWrite(instance.getId(), command, readWindow);
        return Optional.of(CommandResult.ok(output, name()));
    }
}
