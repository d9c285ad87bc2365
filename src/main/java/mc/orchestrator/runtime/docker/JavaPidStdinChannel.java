package mc.orchestrator.runtime.docker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandChannel;

import java.time.Duration;
import java.util.Optional;

/**
 * Finds the java process inside the container and writes to its stdin, for images whose PID 1 is a wrapper.
 */
@Slf4j
@RequiredArgsConstructor
public class JavaPidStdinChannel implements CommandChannel {
    private static final String FIND_JAVA = "ps -eo pid,comm | grep java | awk '{print $1}' | head -n 1";

    private final DockerRuntimeClient client;
    private final Duration execTimeout;

    @Override
    public String name() {
        return "pid-stdin";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return instance.getStatus() == InstanceStatus.RUNNING;
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) {
        ExecResult lookup = client.exec(instance.getId(), execTimeout, "sh", "-c", FIND_JAVA);
        String pid = lookup.output() == null ? "" : lookup.output().strip();
        if (!lookup.succeeded() || !pid.matches("\\d+")) {
            log.debug("No java process found in {}", instance.getName());
            return Optional.empty();
        }
        ExecResult write = client.exec(instance.getId(), execTimeout,
                "sh", "-c", "echo " + ShellQuoting.quote(command) + " > /proc/" + pid + "/fd/0");
        if (!write.succeeded()) {
            return Optional.empty();
        }
        return Optional.of(CommandResult.ok("Command sent via PID " + pid + ": " + command, name()));
    }
}
