package mc.orchestrator.runtime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.service.InstanceDirectories;
import mc.orchestrator.service.PortAllocator;
import mc.orchestrator.service.PortUsageProbe;
import mc.orchestrator.service.ServerMetadataStore;
import mc.orchestrator.service.command.CommandDispatcher;
import mc.orchestrator.service.command.RconCommandChannel;
import mc.orchestrator.service.command.RconConnector;
import mc.orchestrator.service.provisioning.ProvisioningService;
import mc.orchestrator.service.stats.ResourceStatsSampler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
@ConditionalOnProperty(prefix = "mc.runtime", name = "backend", havingValue = "container", matchIfMissing = true)
public class DockerConfiguration {
    private final RuntimeProperties properties;

    public DockerConfiguration(RuntimeProperties properties) {
        this.properties = properties;
    }

    @Bean
    public DefaultDockerClientConfig dockerClientConfig() {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        String host = properties.getContainer().getDockerHost();
        if (host != null && !host.isBlank()) {
            builder.withDockerHost(host);
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public DockerClient dockerClient(DefaultDockerClientConfig config) {
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public DockerRuntimeClient dockerRuntimeClient(DockerClient dockerClient) {
        return new DockerRuntimeClient(dockerClient);
    }

    @Bean
    public PortUsageProbe dockerPortUsageProbe(DockerRuntimeClient client) {
        return new DockerPortUsageProbe(client, properties.getPorts().getGamePort());
    }

    @Bean
    public CommandDispatcher containerCommandDispatcher(DockerRuntimeClient client, RconConnector rconConnector) {
        RuntimeProperties.Container container = properties.getContainer();
        return new CommandDispatcher(List.of(
                new RconCommandChannel(rconConnector, properties.getRcon().getHost(), properties.getPorts().getRconPort()),
                new AttachStreamChannel(client, container.getAttachReadWindow()),
                new InitStdinChannel(client, container.getExecTimeout()),
                new JavaPidStdinChannel(client, container.getExecTimeout())));
    }

    @Bean
    public ResourceStatsSampler containerStatsSampler(DockerRuntimeClient client) {
        return new ContainerStatsSampler(client);
    }

    @Bean
    public RuntimeBackend containerRuntimeBackend(DockerRuntimeClient client,
                                                  PortAllocator portAllocator,
                                                  ProvisioningService provisioning,
                                                  ServerMetadataStore metadataStore,
                                                  InstanceDirectories directories,
                                                  CommandDispatcher containerCommandDispatcher,
                                                  Clock clock) {
        return new ContainerRuntimeBackend(client, properties, portAllocator, provisioning, metadataStore, directories,
                containerCommandDispatcher, clock);
    }
}
