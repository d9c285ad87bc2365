package mc.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ServerInstance {
    private String id;
    private String name;
    private BackendKind backendKind;
    private InstanceStatus status;
    private String type;
    private String version;
    private String loaderVersion;
    @Builder.Default
    private List<PortBinding> portBindings = List.of();
    private ResourceLimits resourceLimits;
    private JavaConfig javaConfig;
    @Builder.Default
    private Map<String, String> labels = Map.of();
    @Builder.Default
    private Map<String, String> environment = Map.of();
    private Instant createdAt;
    private Long pid;

    public Integer primaryHostPort() {
        return portBindings.stream()
                .filter(PortBinding::primary)
                .map(PortBinding::hostPort)
                .findFirst()
                .orElse(null);
    }

    public Integer hostPortFor(int containerPort) {
        return portBindings.stream()
                .filter(b -> b.containerPort() == containerPort && "tcp".equals(b.protocol()))
                .map(PortBinding::hostPort)
                .filter(p -> p != null)
                .findFirst()
                .orElse(null);
    }

    public static ServerInstance notFound(String id, BackendKind kind) {
        return ServerInstance.builder()
                .id(id)
                .name(id)
                .backendKind(kind)
                .status(InstanceStatus.NOT_FOUND)
                .build();
    }
}
