package tech.metadatastore.database.storage.mongo;

import com.mongodb.client.MongoDatabase;
import tech.metadatastore.database.storage.MetadataDatabase;

/**
 * MetadataDatabase backed by a MongoDB database.
 */
public class MongoMetadataDatabase extends MetadataDatabase {

    private final MongoDatabase database;

    public MongoMetadataDatabase(MongoDatabase database) {
        this.database = database;
    }

    @Override
    public MongoRecordCollection collection(String name) {
        return new MongoRecordCollection(database.getCollection(name));
    }
}
