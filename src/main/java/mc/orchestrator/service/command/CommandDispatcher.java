package mc.orchestrator.service.command;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.exception.CommandDispatchException;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tries each channel in order until one delivers the command. Individual channel failures are logged
 * and the next channel is attempted; only a complete miss is reported to the caller.
 */
@Slf4j
public class CommandDispatcher {
    private final List<CommandChannel> channels;

    public CommandDispatcher(List<CommandChannel> channels) {
        this.channels = List.copyOf(channels);
    }

    public List<String> channelNames() {
        return channels.stream().map(CommandChannel::name).toList();
    }

    public CommandResult dispatch(ServerInstance instance, String command) {
        String normalized = normalize(command);
        List<String> attempted = new ArrayList<>();
        for (CommandChannel channel : channels) {
            if (!channel.supports(instance)) {
                log.debug("Skipping {} for {}: not applicable", channel.name(), instance.getName());
                continue;
            }
            attempted.add(channel.name());
            try {
                Optional<CommandResult> result = channel.trySend(instance, normalized);
                if (result.isPresent()) {
                    log.debug("Command '{}' delivered to {} via {}", normalized, instance.getName(), channel.name());
                    return result.get();
                }
                log.debug("Channel {} could not deliver to {}", channel.name(), instance.getName());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while sending via {} to {}", channel.name(), instance.getName());
                break;
            } catch (Exception e) {
                log.warn("Channel {} failed for {}: {}", channel.name(), instance.getName(), e.getMessage());
            }
        }
        log.error("Command '{}' could not be delivered to {} (tried {})", normalized, instance.getName(), attempted);
        throw new CommandDispatchException(instance.getId(), attempted);
    }

    static String normalize(String command) {
        String trimmed = command == null ? "" : command.strip();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Command is empty");
        }
        return trimmed;
    }
}
