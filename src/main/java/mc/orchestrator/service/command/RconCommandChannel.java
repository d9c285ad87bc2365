package mc.orchestrator.service.command;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.ServerInstance;

import java.util.Optional;

@RequiredArgsConstructor
public class RconCommandChannel implements CommandChannel {
    private final RconConnector connector;
    private final String host;
    private final int defaultRconPort;

    @Override
    public String name() {
        return "rcon";
    }

    @Override
    public boolean supports(ServerInstance instance) {
        return RconEndpoint.of(instance, host, defaultRconPort).isPresent();
    }

    @Override
    public Optional<CommandResult> trySend(ServerInstance instance, String command) throws Exception {
        Optional<RconEndpoint> endpoint = RconEndpoint.of(instance, host, defaultRconPort);
        if (endpoint.isEmpty()) {
            return Optional.empty();
        }
        String response = connector.execute(endpoint.get(), command);
        return Optional.of(CommandResult.ok(response, name()));
    }
}
