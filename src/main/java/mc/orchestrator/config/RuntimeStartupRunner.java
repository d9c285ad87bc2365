package mc.orchestrator.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.service.InstanceDirectories;
import mc.orchestrator.service.ServerMetadataStore;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RuntimeStartupRunner implements ApplicationRunner {

    private final RuntimeBackend backend;
    private final InstanceDirectories directories;
    private final ServerMetadataStore metadataStore;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Runtime backend {} managing servers under {}", backend.kind(), directories.getRoot());
        int backfilled = metadataStore.backfillCreatedTimestamps();
        if (backfilled > 0) {
            log.info("Backfilled created timestamps for {} server(s)", backfilled);
        }
    }
}
