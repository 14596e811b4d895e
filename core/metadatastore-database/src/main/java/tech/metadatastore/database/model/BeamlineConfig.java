package tech.metadatastore.database.model;

import lombok.Builder;
import org.bson.Document;
import tech.metadatastore.database.schema.MetadataCollection;
import tech.metadatastore.database.validation.Validators;

import java.util.Map;
import java.util.Set;

/**
 * Snapshot of beamline configuration parameters taken for a run.
 */
@Builder(toBuilder = true)
public record BeamlineConfig(
    Object headerId,
    Map<String, Object> configParams
) implements MetadataRecord {

    private static final Set<String> FIELDS = Set.of("header_id", "config_params");

    public BeamlineConfig {
        headerId = Validators.reference(headerId, "header_id");
        configParams = Validators.dict(configParams, "config_params");
    }

    public static BeamlineConfig of(Object headerId) {
        return new BeamlineConfig(headerId, null);
    }

    public static BeamlineConfig fromFields(Map<String, ?> fields) {
        Validators.knownFields(fields, FIELDS);
        return new BeamlineConfig(
            fields.get("header_id"),
            Validators.dict(fields.get("config_params"), "config_params")
        );
    }

    @Override
    public MetadataCollection metadataCollection() {
        return MetadataCollection.BEAMLINE_CONFIG;
    }

    @Override
    public Document toDocument() {
        return new Document()
            .append("header_id", headerId)
            .append("config_params", configParams);
    }
}
