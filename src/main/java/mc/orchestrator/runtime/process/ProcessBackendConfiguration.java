package mc.orchestrator.runtime.process;

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
@ConditionalOnProperty(prefix = "mc.runtime", name = "backend", havingValue = "process")
public class ProcessBackendConfiguration {
    private final RuntimeProperties properties;

    public ProcessBackendConfiguration(RuntimeProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ProcessTable processTable(InstanceDirectories directories) {
        return new ProcessTable(directories, properties.getProcess().getPidFileName());
    }

    @Bean
    public PortUsageProbe processPortUsageProbe(InstanceDirectories directories, ServerMetadataStore metadataStore,
                                                ProcessTable table) {
        return new ProcessPortUsageProbe(directories, metadataStore, table);
    }

    @Bean
    public CommandDispatcher processCommandDispatcher(ProcessTable table, InstanceDirectories directories,
                                                      RconConnector rconConnector) {
        return new CommandDispatcher(List.of(
                new RconCommandChannel(rconConnector, properties.getRcon().getHost(), properties.getPorts().getRconPort()),
                new AttachedStdinChannel(table),
                new ControlPipeChannel(directories, properties.getProcess().getControlPipeName()),
                new InitProcessStdinChannel(),
                new JavaDescendantStdinChannel()));
    }

    @Bean
    public ResourceStatsSampler processStatsSampler() {
        return new ProcessStatsSampler(properties.getProcess().getCpuSampleWindow());
    }

    @Bean
    public RuntimeBackend processRuntimeBackend(PortAllocator portAllocator,
                                                ProvisioningService provisioning,
                                                ServerMetadataStore metadataStore,
                                                InstanceDirectories directories,
                                                ProcessTable table,
                                                CommandDispatcher processCommandDispatcher,
                                                Clock clock) {
        return new ProcessRuntimeBackend(properties, portAllocator, provisioning, metadataStore, directories, table,
                processCommandDispatcher, clock);
    }
}
