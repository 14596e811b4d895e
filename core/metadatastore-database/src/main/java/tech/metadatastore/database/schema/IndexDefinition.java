package tech.metadatastore.database.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * An index declaration: an ordered list of keys plus a uniqueness flag.
 * Key order is significant and is preserved when the index is created.
 */
public record IndexDefinition(
    List<IndexKey> keys,
    boolean unique
) {

    public IndexDefinition {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("An index needs at least one key");
        }
        keys = List.copyOf(keys);
    }

    public enum Direction {
        ASCENDING(1),
        DESCENDING(-1);

        private final int value;

        Direction(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }
    }

    public record IndexKey(String field, Direction direction) {}

    public static Builder on(String field, Direction direction) {
        return new Builder().then(field, direction);
    }

    public static Builder descending(String field) {
        return on(field, Direction.DESCENDING);
    }

    /**
     * Field names in declaration order.
     */
    public List<String> fieldNames() {
        return keys.stream().map(IndexKey::field).toList();
    }

    public static final class Builder {
        private final List<IndexKey> keys = new ArrayList<>();

        private Builder() {}

        public Builder then(String field, Direction direction) {
            keys.add(new IndexKey(field, direction));
            return this;
        }

        public Builder thenDescending(String field) {
            return then(field, Direction.DESCENDING);
        }

        public Builder thenAscending(String field) {
            return then(field, Direction.ASCENDING);
        }

        public IndexDefinition build() {
            return new IndexDefinition(keys, false);
        }

        public IndexDefinition buildUnique() {
            return new IndexDefinition(keys, true);
        }
    }
}
