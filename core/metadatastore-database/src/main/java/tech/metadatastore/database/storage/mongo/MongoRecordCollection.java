package tech.metadatastore.database.storage.mongo;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.InsertOneOptions;
import com.mongodb.client.result.InsertOneResult;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.metadatastore.database.schema.IndexDefinition;
import tech.metadatastore.database.storage.RecordCollection;
import tech.metadatastore.database.storage.SaveOptions;

import java.util.List;

/**
 * MongoDB implementation of RecordCollection.
 * Driver exceptions (e.g. MongoWriteException for a duplicate scan_id) propagate unchanged.
 */
public class MongoRecordCollection implements RecordCollection {

    private static final Logger LOG = Logger.getLogger(MongoRecordCollection.class);

    private final MongoCollection<Document> collection;

    public MongoRecordCollection(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    @Override
    public String name() {
        return collection.getNamespace().getCollectionName();
    }

    @Override
    public ObjectId insert(Document document, SaveOptions options) {
        SaveOptions effective = options != null ? options : SaveOptions.defaults();

        MongoCollection<Document> target = effective.writeConcern() != null
            ? collection.withWriteConcern(effective.writeConcern())
            : collection;

        InsertOneOptions insertOptions = new InsertOneOptions();
        if (effective.bypassDocumentValidation() != null) {
            insertOptions.bypassDocumentValidation(effective.bypassDocumentValidation());
        }
        if (effective.comment() != null) {
            insertOptions.comment(effective.comment());
        }

        InsertOneResult result = target.insertOne(document, insertOptions);
        ObjectId id = toObjectId(result.getInsertedId(), document);
        LOG.debugf("Inserted %s into %s", id, name());
        return id;
    }

    @Override
    public void ensureIndex(IndexDefinition index) {
        String created = collection.createIndex(toKeys(index), new IndexOptions().unique(index.unique()));
        LOG.debugf("Ensured index %s on %s", created, name());
    }

    /**
     * Direct access to the driver collection for ad-hoc use.
     */
    public MongoCollection<Document> mongoCollection() {
        return collection;
    }

    static Bson toKeys(IndexDefinition index) {
        List<Bson> keys = index.keys().stream()
            .map(key -> key.direction() == IndexDefinition.Direction.ASCENDING
                ? Indexes.ascending(key.field())
                : Indexes.descending(key.field()))
            .toList();
        return keys.size() == 1 ? keys.get(0) : Indexes.compoundIndex(keys);
    }

    private static ObjectId toObjectId(BsonValue insertedId, Document document) {
        if (insertedId != null && insertedId.isObjectId()) {
            return insertedId.asObjectId().getValue();
        }
        // the driver also writes the generated _id back into the document
        return document.getObjectId("_id");
    }
}
