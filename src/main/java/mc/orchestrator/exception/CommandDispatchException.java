package mc.orchestrator.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class CommandDispatchException extends ServerRuntimeException {
    private final List<String> attemptedChannels;

    public CommandDispatchException(String instanceId, List<String> attemptedChannels) {
        super("Could not deliver command to " + instanceId + " via any channel " + attemptedChannels);
        this.attemptedChannels = List.copyOf(attemptedChannels);
    }
}
