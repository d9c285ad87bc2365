package mc.orchestrator.service.command;

import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.ServerInstance;

import java.util.Map;
import java.util.Optional;

public record RconEndpoint(String host, int port, String password) {
    public static final String ENABLE_RCON = "ENABLE_RCON";
    public static final String RCON_PASSWORD = "RCON_PASSWORD";
    public static final String RCON_PORT = "RCON_PORT";

    /**
     * Resolves where RCON is reachable for the instance, if its environment enables it. Container instances
     * are reached through the host port published for the RCON port; process instances listen on it directly.
     */
    public static Optional<RconEndpoint> of(ServerInstance instance, String host, int defaultRconPort) {
        Map<String, String> env = instance.getEnvironment();
        if (env == null || !"true".equalsIgnoreCase(env.getOrDefault(ENABLE_RCON, "false"))) {
            return Optional.empty();
        }
        String password = env.get(RCON_PASSWORD);
        if (password == null || password.isBlank()) {
            return Optional.empty();
        }
        int rconPort;
        try {
            rconPort = Integer.parseInt(env.getOrDefault(RCON_PORT, String.valueOf(defaultRconPort)).trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        Integer port = instance.hostPortFor(rconPort);
        if (port == null && instance.getBackendKind() == BackendKind.PROCESS) {
            port = rconPort;
        }
        if (port == null) {
            return Optional.empty();
        }
        return Optional.of(new RconEndpoint(host, port, password));
    }
}
