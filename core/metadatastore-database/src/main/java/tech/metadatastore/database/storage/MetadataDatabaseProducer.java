package tech.metadatastore.database.storage;

import com.mongodb.client.MongoClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.metadatastore.database.config.MetadataStoreConfig;
import tech.metadatastore.database.storage.mongo.MongoMetadataDatabase;

/**
 * CDI producer for the process-wide MetadataDatabase, backed by the
 * MongoClient provided by the Quarkus MongoDB extension.
 */
@ApplicationScoped
public class MetadataDatabaseProducer {

    private static final Logger LOG = Logger.getLogger(MetadataDatabaseProducer.class);

    @Inject
    MongoClient mongoClient;

    @Inject
    MetadataStoreConfig config;

    @Produces
    @Singleton
    public MetadataDatabase produceDatabase() {
        LOG.infof("Using MongoDB database '%s' for metadata", config.database());
        return new MongoMetadataDatabase(mongoClient.getDatabase(config.database()));
    }
}
