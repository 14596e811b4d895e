package tech.metadatastore.database.model;

import lombok.Builder;
import org.bson.Document;
import tech.metadatastore.database.schema.MetadataCollection;
import tech.metadatastore.database.support.CurrentUser;
import tech.metadatastore.database.validation.Validators;

import java.util.Map;
import java.util.Set;

/**
 * One captured data point, belonging to a header and an event descriptor.
 *
 * <p>Values in {@code data} are stored exactly as given. Nothing orders
 * events or keeps {@code seqNo} unique within a descriptor.
 */
@Builder(toBuilder = true)
public record Event(
    Object headerId,
    Object eventDescriptorId,
    Integer seqNo,
    String owner,
    String description,
    Map<String, Object> data
) implements MetadataRecord {

    private static final Set<String> FIELDS = Set.of(
        "header_id", "event_descriptor_id", "seq_no", "owner", "description", "data");

    public Event {
        headerId = Validators.reference(headerId, "header_id");
        eventDescriptorId = Validators.reference(eventDescriptorId, "event_descriptor_id");
        seqNo = Validators.nonNegativeInteger(seqNo, "seq_no");
        owner = owner == null ? CurrentUser.name() : Validators.requiredString(owner, "owner");
        description = Validators.optionalString(description, "description");
        data = Validators.dict(data, "data");
    }

    public static Event of(Object headerId, Object eventDescriptorId, int seqNo, Map<String, Object> data) {
        return Event.builder()
            .headerId(headerId)
            .eventDescriptorId(eventDescriptorId)
            .seqNo(seqNo)
            .data(data)
            .build();
    }

    public static Event fromFields(Map<String, ?> fields) {
        Validators.knownFields(fields, FIELDS);
        return new Event(
            fields.get("header_id"),
            fields.get("event_descriptor_id"),
            Validators.nonNegativeInteger(fields.get("seq_no"), "seq_no"),
            Validators.optionalString(fields.get("owner"), "owner"),
            Validators.optionalString(fields.get("description"), "description"),
            Validators.dict(fields.get("data"), "data")
        );
    }

    @Override
    public MetadataCollection metadataCollection() {
        return MetadataCollection.EVENT;
    }

    @Override
    public Document toDocument() {
        return new Document()
            .append("header_id", headerId)
            .append("event_descriptor_id", eventDescriptorId)
            .append("seq_no", seqNo)
            .append("owner", owner)
            .append("description", description)
            .append("data", data);
    }
}
