package mc.orchestrator.config;

import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.runtime.process.ProcessBackendConfiguration;
import mc.orchestrator.runtime.process.ProcessRuntimeBackend;
import mc.orchestrator.service.PlayerQueryService;
import mc.orchestrator.service.ServerLifecycleService;
import mc.orchestrator.service.command.RconConnector;
import mc.orchestrator.service.command.SocketRconConnector;
import mc.orchestrator.service.provisioning.ProvisioningService;
import mc.orchestrator.service.stats.BulkStatsService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimeConfigurationTest {

    @TempDir
    Path root;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(ProcessWiring.class);

    @Test
    void processBackendWiresScannedServices() {
        runner.withPropertyValues("mc.runtime.backend=process", "mc.runtime.servers-root=" + root)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(ServerLifecycleService.class);
                    assertThat(context).hasSingleBean(PlayerQueryService.class);
                    assertThat(context).hasSingleBean(BulkStatsService.class);
                    assertThat(context).hasSingleBean(ProvisioningService.class);
                    assertThat(context).getBean(RuntimeBackend.class).isInstanceOf(ProcessRuntimeBackend.class);
                    assertThat(context).getBean(RconConnector.class).isInstanceOf(SocketRconConnector.class);
                });
    }

    @Configuration
    @EnableConfigurationProperties(RuntimeProperties.class)
    @Import({RuntimeConfiguration.class, ProcessBackendConfiguration.class, ServerLifecycleService.class,
            PlayerQueryService.class, BulkStatsService.class, ProvisioningService.class})
    static class ProcessWiring {
    }
}
