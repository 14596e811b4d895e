package tech.metadatastore.database.exception;

import java.util.Map;

/**
 * Base exception for metadata store errors raised by this library.
 *
 * <p>Errors reported by the MongoDB driver are not wrapped in this type; they
 * reach the caller unchanged.
 */
public class MetadataStoreException extends RuntimeException {

    private final Map<String, Object> context;

    public MetadataStoreException(String message) {
        this(message, null, Map.of());
    }

    public MetadataStoreException(String message, Throwable cause) {
        this(message, cause, Map.of());
    }

    public MetadataStoreException(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.context = context != null ? context : Map.of();
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
