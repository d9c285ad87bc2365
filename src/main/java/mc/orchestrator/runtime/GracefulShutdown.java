package mc.orchestrator.runtime;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.exception.CommandDispatchException;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.command.CommandDispatcher;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Sends the stop command through the dispatcher and waits for the instance to go down.
 * Escalation past the deadline is left to the backend.
 */
@Slf4j
public class GracefulShutdown {
    private final CommandDispatcher dispatcher;
    private final String stopCommand;
    private final Duration timeout;
    private final Duration pollInterval;

    public GracefulShutdown(CommandDispatcher dispatcher, String stopCommand, Duration timeout, Duration pollInterval) {
        this.dispatcher = dispatcher;
        this.stopCommand = stopCommand;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    public Outcome run(ServerInstance instance, BooleanSupplier stillRunning) {
        String method = null;
        try {
            CommandResult result = dispatcher.dispatch(instance, stopCommand);
            method = result.method();
        } catch (CommandDispatchException e) {
            log.warn("Failed to send graceful stop to {}: {}", instance.getName(), e.getMessage());
        }

        long deadline = System.nanoTime() + Math.max(timeout.toNanos(), pollInterval.toNanos());
        while (System.nanoTime() < deadline) {
            if (!isRunning(instance, stillRunning)) {
                return new Outcome(true, Optional.ofNullable(method));
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to stop", instance.getName());
                break;
            }
        }
        boolean stopped = !isRunning(instance, stillRunning);
        if (!stopped) {
            log.info("{} still running after {}s, escalating", instance.getName(), timeout.toSeconds());
        }
        return new Outcome(stopped, Optional.ofNullable(method));
    }

    private boolean isRunning(ServerInstance instance, BooleanSupplier stillRunning) {
        try {
            return stillRunning.getAsBoolean();
        } catch (InstanceNotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            // a failed status probe counts as "maybe stopping"; keep waiting
            log.debug("Status probe for {} failed: {}", instance.getName(), e.getMessage());
            return true;
        }
    }

    public record Outcome(boolean stopped, Optional<String> method) {
    }
}
