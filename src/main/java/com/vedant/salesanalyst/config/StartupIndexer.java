package com.vedant.salesanalyst.config;

import com.vedant.salesanalyst.model.GlossaryStatus;
import com.vedant.salesanalyst.service.SchemaIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Indexes the configured schema once the application is up, when enabled. */
@Component
public class StartupIndexer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupIndexer.class);

    private final SchemaIndexer schemaIndexer;
    private final boolean enabled;

    public StartupIndexer(SchemaIndexer schemaIndexer,
                          @Value("${analyst.index-on-startup:false}") boolean enabled) {
        this.schemaIndexer = schemaIndexer;
        this.enabled = enabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Startup indexing disabled; call POST /api/schema/reindex to build the index");
            return;
        }
        String schema = schemaIndexer.activeSchema();
        try {
            GlossaryStatus status = schemaIndexer.reindex(schema);
            log.info("Startup indexing of schema {} done: {}", schema, status.status());
        } catch (RuntimeException e) {
            // the service still answers once a later re-index succeeds
            log.error("Startup indexing of schema {} failed: {}", schema, e.getMessage(), e);
        }
    }
}
