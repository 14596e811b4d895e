package tech.metadatastore.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.metadatastore.database.model.Header;
import tech.metadatastore.database.model.MetadataRecord;
import tech.metadatastore.database.storage.MetadataDatabase;
import tech.metadatastore.database.storage.RecordCollection;
import tech.metadatastore.database.storage.SaveOptions;

/**
 * Entry point for data-acquisition code: saves metadata records against the
 * process-wide database handle.
 *
 * <p>Errors from the backend are not caught; a duplicate scan_id or a lost
 * connection reaches the caller as the driver reported it.
 */
@ApplicationScoped
public class MetadataStore {

    private static final Logger LOG = Logger.getLogger(MetadataStore.class);

    @Inject
    MetadataDatabase database;

    public ObjectId save(MetadataRecord record) {
        return save(record, SaveOptions.defaults());
    }

    /**
     * Save a record with caller-supplied write options.
     *
     * @return The identifier generated for the stored document
     */
    public ObjectId save(MetadataRecord record, SaveOptions options) {
        ObjectId id = record.save(database, options);
        LOG.debugf("Saved %s record %s", record.metadataCollection().getCollectionName(), id);
        return id;
    }

    public RecordCollection headerCollection() {
        return Header.getCollection(database);
    }
}
