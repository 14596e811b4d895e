package tech.metadatastore.database.model;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.metadatastore.database.exception.ValidationException;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EventDescriptorTest {

    private final ObjectId headerId = new ObjectId();

    @Test
    @DisplayName("toDocument should contain every descriptor field in stored order")
    void toDocument_shouldContainAllFieldsInOrder() {
        Document doc = EventDescriptor.builder()
            .headerId(headerId)
            .eventTypeId(2)
            .descriptorName("scan")
            .tag("primary")
            .typeDescriptor(Map.of("x", "float"))
            .build()
            .toDocument();

        assertThat(doc.keySet()).containsExactly(
            "header_id", "event_type_id", "descriptor_name", "tag", "type_descriptor");
        assertThat(doc.get("header_id")).isEqualTo(headerId);
        assertThat(doc.get("event_type_id")).isEqualTo(2);
        assertThat(doc.getString("tag")).isEqualTo("primary");
        assertThat(doc.get("type_descriptor", Map.class)).containsEntry("x", "float");
    }

    @Test
    @DisplayName("optional fields should default to null tag and empty type descriptor")
    void defaults_shouldApply_whenOptionalFieldsOmitted() {
        Document doc = EventDescriptor.of(headerId, 1, "scan").toDocument();

        assertThat(doc.containsKey("tag")).isTrue();
        assertThat(doc.get("tag")).isNull();
        assertThat(doc.get("type_descriptor", Map.class)).isEmpty();
    }

    @Test
    @DisplayName("constructor should reject an empty descriptor name")
    void constructor_shouldThrow_whenDescriptorNameEmpty() {
        assertThatThrownBy(() -> EventDescriptor.of(headerId, 1, ""))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getField()).isEqualTo("descriptor_name"));
    }

    @Test
    @DisplayName("constructor should reject a missing header reference")
    void constructor_shouldThrow_whenHeaderIdMissing() {
        assertThatThrownBy(() -> EventDescriptor.of(null, 1, "scan"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("header_id is required");
    }

    @Test
    @DisplayName("fromFields should reject a non-integer event type id")
    void fromFields_shouldThrow_whenEventTypeIdNotInteger() {
        assertThatThrownBy(() -> EventDescriptor.fromFields(Map.of(
                "header_id", headerId,
                "event_type_id", 1.25,
                "descriptor_name", "scan")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("event_type_id");
    }

    @Test
    @DisplayName("fromFields should reject a non-mapping type descriptor")
    void fromFields_shouldThrow_whenTypeDescriptorNotMapping() {
        assertThatThrownBy(() -> EventDescriptor.fromFields(Map.of(
                "header_id", headerId,
                "event_type_id", 1,
                "descriptor_name", "scan",
                "type_descriptor", "x:float")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("type_descriptor must be a mapping");
    }
}
