package mc.orchestrator.model;

public record PortBinding(int containerPort, String protocol, Integer hostPort, String hostAddress, boolean primary) {

    public static PortBinding primaryTcp(int containerPort, Integer hostPort, String hostAddress) {
        return new PortBinding(containerPort, "tcp", hostPort, hostAddress, true);
    }

    public static PortBinding tcp(int containerPort, Integer hostPort, String hostAddress) {
        return new PortBinding(containerPort, "tcp", hostPort, hostAddress, false);
    }

    public String key() {
        return containerPort + "/" + protocol;
    }
}
