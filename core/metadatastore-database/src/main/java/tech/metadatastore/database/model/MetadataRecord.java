package tech.metadatastore.database.model;

import org.bson.Document;
import org.bson.types.ObjectId;
import tech.metadatastore.database.schema.MetadataCollection;
import tech.metadatastore.database.storage.MetadataDatabase;
import tech.metadatastore.database.storage.SaveOptions;

/**
 * A validated metadata record that can be written to its collection.
 *
 * <p>Records are immutable values. They only touch the database during
 * {@link #save(MetadataDatabase, SaveOptions)}, which inserts the composed
 * document and then makes sure the collection's indexes exist.
 */
public interface MetadataRecord {

    /**
     * The collection this record is stored in.
     */
    MetadataCollection metadataCollection();

    /**
     * Compose the document persisted for this record. Field names and order
     * are fixed; absent optional values are written as explicit nulls.
     */
    Document toDocument();

    default ObjectId save(MetadataDatabase database) {
        return save(database, SaveOptions.defaults());
    }

    /**
     * Insert this record and ensure its collection's indexes.
     *
     * @param database The metadata database
     * @param options  Write options passed through to the insert
     * @return The identifier generated for the stored document
     */
    default ObjectId save(MetadataDatabase database, SaveOptions options) {
        MetadataCollection target = metadataCollection();
        ObjectId id = database.collection(target).insert(toDocument(), options);
        database.ensureIndexes(target);
        return id;
    }
}
