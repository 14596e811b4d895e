package tech.metadatastore.database.model;

import lombok.Builder;
import org.bson.Document;
import tech.metadatastore.database.schema.MetadataCollection;
import tech.metadatastore.database.validation.Validators;

import java.util.Map;
import java.util.Set;

/**
 * Describes the shape of a family of events recorded under one header.
 *
 * <p>{@code typeDescriptor} maps each data field name to its type.
 * {@code headerId} is a logical reference to the header's generated id;
 * the header's existence is not checked.
 */
@Builder(toBuilder = true)
public record EventDescriptor(
    Object headerId,
    Integer eventTypeId,
    String descriptorName,
    String tag,
    Map<String, Object> typeDescriptor
) implements MetadataRecord {

    private static final Set<String> FIELDS = Set.of(
        "header_id", "event_type_id", "descriptor_name", "tag", "type_descriptor");

    public EventDescriptor {
        headerId = Validators.reference(headerId, "header_id");
        eventTypeId = Validators.integer(eventTypeId, "event_type_id");
        descriptorName = Validators.requiredString(descriptorName, "descriptor_name");
        tag = Validators.optionalString(tag, "tag");
        typeDescriptor = Validators.dict(typeDescriptor, "type_descriptor");
    }

    public static EventDescriptor of(Object headerId, int eventTypeId, String descriptorName) {
        return EventDescriptor.builder()
            .headerId(headerId)
            .eventTypeId(eventTypeId)
            .descriptorName(descriptorName)
            .build();
    }

    public static EventDescriptor fromFields(Map<String, ?> fields) {
        Validators.knownFields(fields, FIELDS);
        return new EventDescriptor(
            fields.get("header_id"),
            Validators.integer(fields.get("event_type_id"), "event_type_id"),
            Validators.requiredString(fields.get("descriptor_name"), "descriptor_name"),
            Validators.optionalString(fields.get("tag"), "tag"),
            Validators.dict(fields.get("type_descriptor"), "type_descriptor")
        );
    }

    @Override
    public MetadataCollection metadataCollection() {
        return MetadataCollection.EVENT_DESCRIPTOR;
    }

    @Override
    public Document toDocument() {
        return new Document()
            .append("header_id", headerId)
            .append("event_type_id", eventTypeId)
            .append("descriptor_name", descriptorName)
            .append("tag", tag)
            .append("type_descriptor", typeDescriptor);
    }
}
