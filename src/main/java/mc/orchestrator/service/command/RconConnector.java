package mc.orchestrator.service.command;

import java.io.IOException;

@FunctionalInterface
public interface RconConnector {

    String execute(RconEndpoint endpoint, String command) throws IOException;
}
