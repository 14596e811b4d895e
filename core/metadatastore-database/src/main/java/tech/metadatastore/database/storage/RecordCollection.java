package tech.metadatastore.database.storage;

import org.bson.Document;
import org.bson.types.ObjectId;
import tech.metadatastore.database.schema.IndexDefinition;

/**
 * Handle to one collection of the metadata database.
 *
 * <p>Implementations report backend failures (duplicate keys, lost
 * connections) by throwing the backend's own exception; nothing is wrapped.
 */
public interface RecordCollection {

    /**
     * @return the collection name
     */
    String name();

    /**
     * Insert a single document.
     *
     * @param document The composed document, without an {@code _id}
     * @param options  Write options for this insert
     * @return The identifier generated for the stored document
     */
    ObjectId insert(Document document, SaveOptions options);

    /**
     * Create the index if it does not exist yet. Declaring an index that
     * already exists with the same keys and options is a no-op.
     *
     * @param index The index to declare
     */
    void ensureIndex(IndexDefinition index);
}
