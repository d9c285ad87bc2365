package mc.orchestrator.runtime.process;

import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandChannel;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Writes to the stdin of the first {@code java} process below the recorded pid, for entrypoints that
 * wrap the server instead of exec-ing it.
 */
public class JavaDescendantStdinChannel implements CommandChannel {

    @Override
    public String name() {
        return "pid-stdin";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return instance.getPid() != null;
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception {
        Optional<Long> javaPid = findJava(instance.getPid());
        if (javaPid.isEmpty() || !ProcStdin.isWritable(javaPid.get())) {
            return Optional.empty();
        }
        ProcStdin.write(javaPid.get(), command);
        return Optional.of(CommandResult.ok("Command sent via PID " + javaPid.get() + ": " + command, name()));
    }

    static Optional<Long> findJava(long rootPid) {
        return ProcessHandle.of(rootPid)
                .flatMap(root -> root.descendants()
                        .filter(p -> p.info().command()
                                .map(c -> Path.of(c).getFileName().toString().equals("java"))
                                .orElse(false))
                        .map(ProcessHandle::pid)
                        .findFirst());
    }
}
