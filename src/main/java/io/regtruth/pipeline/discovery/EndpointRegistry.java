package io.regtruth.pipeline.discovery;

import io.regtruth.pipeline.config.EndpointSource;
import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.store.EndpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds configured endpoints into the endpoint store on startup. Endpoints already present
 * keep their runtime state.
 */
@Component
public class EndpointRegistry implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(EndpointRegistry.class);

    private final EndpointStore endpointStore;
    private final PipelineConfig config;

    public EndpointRegistry(EndpointStore endpointStore, PipelineConfig config) {
        this.endpointStore = endpointStore;
        this.config = config;
    }

    @Override
    public void run(ApplicationArguments args) {
        registerConfiguredEndpoints();
    }

    public int registerConfiguredEndpoints() {
        int registered = 0;
        for (EndpointSource source : config.endpoints()) {
            endpointStore.saveIfAbsent(source.toEndpoint());
            registered++;
        }
        logger.info("Registered {} discovery endpoints ({} enabled)", registered, config.getEnabledEndpoints().size());
        return registered;
    }
}
