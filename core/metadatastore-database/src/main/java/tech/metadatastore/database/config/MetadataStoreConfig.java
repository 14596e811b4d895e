package tech.metadatastore.database.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the metadata store.
 *
 * <p>Configure in application.properties:
 * <pre>
 * quarkus.mongodb.connection-string=mongodb://localhost:27017
 * metadatastore.database=metadatastore
 * metadatastore.create-indexes-on-startup=true
 * </pre>
 */
@ConfigMapping(prefix = "metadatastore")
public interface MetadataStoreConfig {

    /**
     * MongoDB database holding the metadata collections.
     */
    @WithDefault("metadatastore")
    String database();

    /**
     * Declare every collection index at startup, before any record is saved.
     * When disabled, indexes are declared by the first save into each collection.
     */
    @WithName("create-indexes-on-startup")
    @WithDefault("true")
    boolean createIndexesOnStartup();
}
