package mc.orchestrator.runtime.process;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandChannel;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Writes to the stdin pipe of a server process this JVM spawned.
 */
@RequiredArgsConstructor
public class AttachedStdinChannel implements CommandChannel {
    private final ProcessTable table;

    @Override
    public String name() {
        return "attached-stdin";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return table.attached(instance.getName()).isPresent();
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception {
        Optional<Process> process = table.attached(instance.getName());
        if (process.isEmpty()) {
            return Optional.empty();
        }
        OutputStream stdin = process.get().getOutputStream();
        synchronized (stdin) {
            stdin.write((command + "\n").getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }
        return Optional.of(CommandResult.ok("Command sent via stdin: " + command, name()));
    }
}
