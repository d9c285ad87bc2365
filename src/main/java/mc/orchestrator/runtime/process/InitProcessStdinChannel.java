package mc.orchestrator.runtime.process;

import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandChannel;

import java.util.Optional;

/**
 * Writes into the stdin of the recorded server pid, for processes spawned by an earlier orchestrator run.
 */
public class InitProcessStdinChannel implements CommandChannel {

    @Override
    public String name() {
        return "stdin";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return instance.getPid() != null && ProcStdin.isWritable(instance.getPid());
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception {
        ProcStdin.write(instance.getPid(), command);
        return Optional.of(CommandResult.ok("Command sent via stdin: " + command, name()));
    }
}
