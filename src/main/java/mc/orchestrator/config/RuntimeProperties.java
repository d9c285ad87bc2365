package mc.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import mc.orchestrator.model.BackendKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "mc.runtime")
public class RuntimeProperties {
    @NotNull
    private BackendKind backend = BackendKind.CONTAINER;
    @NotNull
    private Path serversRoot = Path.of("/data/servers");
    @NotNull
    private Path fallbackServersRoot = Path.of("servers_data");
    @NotBlank
    private String metadataFileName = "server_meta.json";

    @Valid
    private Ports ports = new Ports();
    @Valid
    private Container container = new Container();
    @Valid
    private Process process = new Process();
    @Valid
    private Stop stop = new Stop();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Provisioning provisioning = new Provisioning();
    @Valid
    private Rcon rcon = new Rcon();

    @Data
    public static class Ports {
        @Min(1)
        @Max(65535)
        private int rangeStart = 25565;
        @Min(1)
        @Max(65535)
        private int rangeEnd = 25999;
        @Min(1)
        @Max(65535)
        private int gamePort = 25565;
        @Min(1)
        @Max(65535)
        private int rconPort = 25575;
    }

    @Data
    public static class Container {
        /**
         * Engine endpoint, e.g. {@code unix:///var/run/docker.sock} or {@code tcp://host:2375}.
         * Blank means the docker-java defaults ({@code DOCKER_HOST} or the local socket).
         */
        private String dockerHost = "";
        @NotBlank
        private String image = "mc-runtime:latest";
        /**
         * Absolute host path holding instance directories. When blank, the named volume is mounted instead.
         */
        private String hostRoot = "";
        @NotBlank
        private String volumeName = "minecraft-server_mc_servers_data";
        private String network;
        @NotBlank
        private String managedLabel = "minecraft_server_manager";
        @NotBlank
        private String composeProject = "blockpanel-unified";
        @NotBlank
        private String composeService = "minecraft-runtime";
        private List<String> entrypoint = new ArrayList<>();
        @NotBlank
        private String workingDir = "/data";
        @Min(1)
        private int createAttempts = 10;
        @NotNull
        private Duration dockerStopTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration attachReadWindow = Duration.ofMillis(200);
        @NotNull
        private Duration execTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Process {
        @NotEmpty
        private List<String> launchCommand = new ArrayList<>(List.of("/usr/local/bin/runtime-entrypoint.sh"));
        private boolean newSession = true;
        @NotNull
        private Duration termWait = Duration.ofSeconds(10);
        @NotNull
        private Duration livenessPoll = Duration.ofMillis(500);
        @NotBlank
        private String logFileName = "server.stdout.log";
        @NotBlank
        private String pidFileName = ".server.pid";
        @NotBlank
        private String controlPipeName = "console.in";
        @NotNull
        private Duration cpuSampleWindow = Duration.ofMillis(150);
    }

    @Data
    public static class Stop {
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);
        @NotBlank
        private String command = "stop";
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration listTtl = Duration.ofSeconds(2);
        @NotNull
        private Duration statsTtl = Duration.ofSeconds(3);
    }

    @Data
    public static class Provisioning {
        @Min(1)
        private long minArtifactBytes = 100 * 1024;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration downloadTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Rcon {
        @NotBlank
        private String host = "localhost";
        @Min(1)
        private int retryAttempts = 1;
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(1);
    }
}
