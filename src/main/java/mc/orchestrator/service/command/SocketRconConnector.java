package mc.orchestrator.service.command;

import lombok.extern.slf4j.Slf4j;
import nl.vv32.rcon.Rcon;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens a short-lived authenticated session per command.
 */
@Slf4j
public class SocketRconConnector implements RconConnector {
    private final int attempts;
    private final Duration retryDelay;

    public SocketRconConnector(int attempts, Duration retryDelay) {
        this.attempts = Math.max(1, attempts);
        this.retryDelay = retryDelay;
    }

    @Override
    public String execute(RconEndpoint endpoint, String command) throws IOException {
        return executeWithRetry(endpoint, command, attempts);
    }

    private String executeWithRetry(RconEndpoint endpoint, String command, int attemptsLeft) throws IOException {
        try (Rcon rcon = Rcon.open(endpoint.host(), endpoint.port())) {
            if (!rcon.authenticate(endpoint.password())) {
                throw new IOException("RCON authentication failed for " + endpoint.host() + ":" + endpoint.port());
            }
            String response = rcon.sendCommand(command);
            log.debug("RCON command '{}' on {}:{} returned: {}", command, endpoint.host(), endpoint.port(), response);
            return response;
        } catch (IOException e) {
            log.debug("RCON command '{}' failed on {}:{} (attempts left: {}): {}",
                    command, endpoint.host(), endpoint.port(), attemptsLeft - 1, e.getMessage());
            if (attemptsLeft <= 1) {
                throw e;
            }
            try {
                Thread.sleep(retryDelay.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IOException("RCON retry interrupted", ie);
            }
            return executeWithRetry(endpoint, command, attemptsLeft - 1);
        }
    }
}
