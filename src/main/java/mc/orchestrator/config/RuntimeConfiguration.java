package mc.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import mc.orchestrator.service.InstanceDirectories;
import mc.orchestrator.service.PortAllocator;
import mc.orchestrator.service.PortUsageProbe;
import mc.orchestrator.service.ServerMetadataStore;
import mc.orchestrator.service.command.RconConnector;
import mc.orchestrator.service.command.SocketRconConnector;
import mc.orchestrator.service.provisioning.ArtifactValidator;
import mc.orchestrator.service.provisioning.HttpServerFilesProvisioner;
import mc.orchestrator.service.provisioning.ServerFilesProvisioner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by both backends that need configured values or may be replaced; plain services are
 * component-scanned. The backend itself, its port probe, command channels and stats sampler
 * come from the backend-specific configuration selected by {@code mc.runtime.backend}.
 */
@Configuration
@RequiredArgsConstructor
public class RuntimeConfiguration {
    private final RuntimeProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InstanceDirectories instanceDirectories() {
        return InstanceDirectories.createWithFallback(properties.getServersRoot(), properties.getFallbackServersRoot());
    }

    @Bean
    public ServerMetadataStore serverMetadataStore(InstanceDirectories directories, ObjectMapper objectMapper, Clock clock) {
        return new ServerMetadataStore(directories, properties.getMetadataFileName(), objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ServerFilesProvisioner serverFilesProvisioner(ObjectMapper objectMapper) {
        RuntimeProperties.Provisioning provisioning = properties.getProvisioning();
        return new HttpServerFilesProvisioner(objectMapper, provisioning.getConnectTimeout(),
                provisioning.getDownloadTimeout());
    }

    @Bean
    public ArtifactValidator artifactValidator() {
        return new ArtifactValidator(properties.getProvisioning().getMinArtifactBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public RconConnector rconConnector() {
        RuntimeProperties.Rcon rcon = properties.getRcon();
        return new SocketRconConnector(rcon.getRetryAttempts(), rcon.getRetryDelay());
    }

    @Bean
    public PortAllocator portAllocator(PortUsageProbe probe) {
        RuntimeProperties.Ports ports = properties.getPorts();
        return new PortAllocator(probe, ports.getRangeStart(), ports.getRangeEnd());
    }
}
