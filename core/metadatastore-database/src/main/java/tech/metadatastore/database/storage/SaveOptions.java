package tech.metadatastore.database.storage;

import com.mongodb.WriteConcern;
import lombok.Builder;
import lombok.With;

/**
 * Caller-supplied write options, passed through to the insert unchanged.
 * Unset values leave the collection's own defaults in effect.
 */
@Builder(toBuilder = true)
@With
public record SaveOptions(
    WriteConcern writeConcern,
    Boolean bypassDocumentValidation,
    String comment
) {
    private static final SaveOptions DEFAULTS = new SaveOptions(null, null, null);

    public static SaveOptions defaults() {
        return DEFAULTS;
    }
}
