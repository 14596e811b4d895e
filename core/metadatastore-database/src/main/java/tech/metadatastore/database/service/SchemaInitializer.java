package tech.metadatastore.database.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.metadatastore.database.config.MetadataStoreConfig;
import tech.metadatastore.database.storage.MetadataDatabase;

/**
 * Declares the indexes of every metadata collection on startup, so the unique
 * scan_id index is in place before the first header is written.
 *
 * <p>A failure here aborts startup.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger LOG = Logger.getLogger(SchemaInitializer.class);

    @Inject
    MetadataDatabase database;

    @Inject
    MetadataStoreConfig config;

    void onStart(@Observes StartupEvent event) {
        if (!config.createIndexesOnStartup()) {
            LOG.info("Index creation on startup disabled, indexes will be declared on first save");
            return;
        }

        LOG.info("Declaring metadata collection indexes...");
        try {
            database.ensureAllIndexes();
            LOG.info("Metadata collection indexes declared");
        } catch (RuntimeException e) {
            LOG.error("Failed to declare metadata collection indexes", e);
            throw e;
        }
    }
}
