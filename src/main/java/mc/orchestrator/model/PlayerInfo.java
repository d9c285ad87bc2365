package mc.orchestrator.model;

import java.util.List;

public record PlayerInfo(int online, int max, List<String> names) {

    public static PlayerInfo empty() {
        return new PlayerInfo(0, 0, List.of());
    }
}
