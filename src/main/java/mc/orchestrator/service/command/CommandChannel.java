package mc.orchestrator.service.command;

import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;

import java.util.Optional;

/**
 * One way of delivering a console command to a running instance.
 */
public interface CommandChannel {

    String name();

    /**
     * Whether this channel should be attempted at all for the instance. Unsupported channels are skipped
     * without calling {@link #trySend}.
     */
    default boolean supports(ServerInstance instance) {
        return true;
    }

    /**
     * @return the result when the command was delivered, empty when this channel could not deliver it
     */
    Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception;
}
