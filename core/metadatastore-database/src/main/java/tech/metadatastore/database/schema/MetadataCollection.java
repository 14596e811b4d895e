package tech.metadatastore.database.schema;

import java.util.List;

import static tech.metadatastore.database.schema.IndexDefinition.descending;

/**
 * The collections written by the metadata store and the indexes each one needs.
 * Collection names are part of the stored data contract and must not change.
 */
public enum MetadataCollection {

    HEADER("header", List.of(
        descending("scan_id").buildUnique(),
        descending("owner").thenDescending("start_time").build()
    )),

    EVENT_DESCRIPTOR("event_type_descriptor", List.of(
        descending("header_id").thenDescending("descriptor_name").build()
    )),

    // Indexing the free-form "data" sub-document only supports whole-value
    // equality matches and is subject to the server's index key size limit.
    EVENT("event", List.of(
        descending("event_descriptor_id").thenAscending("header_id").thenDescending("data").build()
    )),

    BEAMLINE_CONFIG("beamline_config", List.of(
        descending("header_id").build()
    ));

    private final String collectionName;
    private final List<IndexDefinition> indexes;

    MetadataCollection(String collectionName, List<IndexDefinition> indexes) {
        this.collectionName = collectionName;
        this.indexes = indexes;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public List<IndexDefinition> getIndexes() {
        return indexes;
    }
}
