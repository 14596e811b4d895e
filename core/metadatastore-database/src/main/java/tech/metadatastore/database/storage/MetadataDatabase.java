package tech.metadatastore.database.storage;

import org.jboss.logging.Logger;
import tech.metadatastore.database.schema.IndexDefinition;
import tech.metadatastore.database.schema.MetadataCollection;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide handle to the metadata database.
 *
 * <p>Index declarations are remembered per handle: once every index of a
 * collection has been declared successfully, later calls to
 * {@link #ensureIndexes(MetadataCollection)} return without contacting the
 * backend. A failed declaration is not remembered and is attempted again on
 * the next call.
 */
public abstract class MetadataDatabase {

    private static final Logger LOG = Logger.getLogger(MetadataDatabase.class);

    private final Set<MetadataCollection> indexed = ConcurrentHashMap.newKeySet();

    /**
     * Get a handle to the named collection.
     */
    public abstract RecordCollection collection(String name);

    public RecordCollection collection(MetadataCollection target) {
        return collection(target.getCollectionName());
    }

    /**
     * Declare all indexes of the given collection unless that already
     * succeeded through this handle.
     */
    public void ensureIndexes(MetadataCollection target) {
        if (indexed.contains(target)) {
            return;
        }
        RecordCollection collection = collection(target);
        for (IndexDefinition index : target.getIndexes()) {
            collection.ensureIndex(index);
        }
        indexed.add(target);
        LOG.infof("Ensured %d index(es) on %s", target.getIndexes().size(), target.getCollectionName());
    }

    /**
     * Declare the indexes of every metadata collection.
     */
    public void ensureAllIndexes() {
        for (MetadataCollection target : MetadataCollection.values()) {
            ensureIndexes(target);
        }
    }

    public boolean isIndexed(MetadataCollection target) {
        return indexed.contains(target);
    }
}
