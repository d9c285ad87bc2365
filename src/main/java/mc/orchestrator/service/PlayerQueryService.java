package mc.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.PlayerInfo;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.service.command.RconConnector;
import mc.orchestrator.service.command.RconEndpoint;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Online player counts over RCON only; console channels are never used so the server log stays clean.
 */
@Slf4j
@Service
public class PlayerQueryService {
    private static final Pattern VANILLA_LIST = Pattern.compile("There are\\s+(\\d+)\\s+of a max of\\s+(\\d+)\\s+players online");
    private static final Pattern SHORT_LIST = Pattern.compile("(\\d+)\\s*/\\s*(\\d+)\\s*players? online");

    private final RuntimeBackend backend;
    private final RconConnector connector;
    private final String rconHost;
    private final int defaultRconPort;

    public PlayerQueryService(RuntimeBackend backend, RconConnector connector, RuntimeProperties properties) {
        this.backend = backend;
        this.connector = connector;
        this.rconHost = properties.getRcon().getHost();
        this.defaultRconPort = properties.getPorts().getRconPort();
    }

    public PlayerInfo players(String id) {
        ServerInstance instance = backend.get(id);
        if (instance.getStatus() == InstanceStatus.NOT_FOUND) {
            throw new InstanceNotFoundException(id);
        }
        Optional<RconEndpoint> endpoint = RconEndpoint.of(instance, rconHost, defaultRconPort);
        if (endpoint.isEmpty() || !instance.getStatus().isRunning()) {
            return PlayerInfo.empty();
        }
        try {
            return parse(connector.execute(endpoint.get(), "list"));
        } catch (IOException e) {
            log.debug("RCON list failed for {}: {}", instance.getName(), e.getMessage());
            return PlayerInfo.empty();
        }
    }

    static PlayerInfo parse(String response) {
        if (response == null) {
            return PlayerInfo.empty();
        }
        Matcher m = VANILLA_LIST.matcher(response);
        if (!m.find()) {
            m = SHORT_LIST.matcher(response);
            if (!m.find()) {
                return PlayerInfo.empty();
            }
        }
        int online = Integer.parseInt(m.group(1));
        int max = Integer.parseInt(m.group(2));
        List<String> names = List.of();
        int colon = response.indexOf(':');
        if (colon != -1 && colon + 1 < response.length()) {
            names = Arrays.stream(response.substring(colon + 1).split(","))
                    .map(String::strip)
                    .filter(n -> !n.isEmpty())
                    .toList();
        }
        return new PlayerInfo(online, max, names);
    }
}
