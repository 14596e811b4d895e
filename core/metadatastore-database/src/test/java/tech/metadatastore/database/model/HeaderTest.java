package tech.metadatastore.database.model;

import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.metadatastore.database.exception.ValidationException;
import tech.metadatastore.database.schema.MetadataCollection;
import tech.metadatastore.database.support.CurrentUser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Header construction and document composition.
 */
class HeaderTest {

    private static final Instant T0 = Instant.parse("2014-04-10T18:34:23Z");

    @Test
    @DisplayName("toDocument should contain every header field in stored order")
    void toDocument_shouldContainAllFieldsInOrder() {
        Document doc = Header.of(T0, 42).toDocument();

        assertThat(doc.keySet()).containsExactly(
            "start_time", "end_time", "owner", "scan_id", "status",
            "beamline_id", "header_versions", "custom", "tags");
    }

    @Test
    @DisplayName("toDocument should apply defaults for omitted optional fields")
    void toDocument_shouldApplyDefaults_whenOptionalFieldsOmitted() {
        Document doc = Header.builder().startTime(T0).scanId(42).owner("alice").build().toDocument();

        assertThat(doc.get("start_time")).isEqualTo(Date.from(T0));
        assertThat(doc.get("end_time")).isNull();
        assertThat(doc.containsKey("end_time")).isTrue();
        assertThat(doc.getString("owner")).isEqualTo("alice");
        assertThat(doc.get("scan_id")).isEqualTo(42);
        assertThat(doc.getString("status")).isEqualTo("In Progress");
        assertThat(doc.get("beamline_id")).isNull();
        assertThat(doc.getList("header_versions", Object.class)).isEmpty();
        assertThat(doc.getList("tags", Object.class)).isEmpty();
        assertThat(doc.get("custom", Map.class)).isEmpty();
    }

    @Test
    @DisplayName("owner should default to the current user at construction time")
    void owner_shouldDefaultToCurrentUser_whenOmitted() {
        Header header = Header.of(T0, 1);

        assertThat(header.owner()).isEqualTo(CurrentUser.name());
    }

    @Test
    @DisplayName("each header should get its own default containers")
    void defaults_shouldNotBeShared_betweenInstances() {
        Header first = Header.of(T0, 1);
        Header second = Header.of(T0, 2);

        assertThat(first.tags()).isNotSameAs(second.tags());
        assertThat(first.headerVersions()).isNotSameAs(second.headerVersions());
        assertThat(first.custom()).isNotSameAs(second.custom());
    }

    @Test
    @DisplayName("header should not be affected by later changes to the caller's containers")
    void containers_shouldBeCopied_whenCallerMutatesAfterConstruction() {
        List<Object> tags = new ArrayList<>(List.of("calibration"));
        Map<String, Object> custom = new HashMap<>(Map.of("sample", "LaB6"));

        Header header = Header.builder().startTime(T0).scanId(7).tags(tags).custom(custom).build();
        tags.add("late");
        custom.put("late", true);

        assertThat(header.tags()).containsExactly("calibration");
        assertThat(header.custom()).containsOnlyKeys("sample");
    }

    @Test
    @DisplayName("constructor should reject a missing start time")
    void constructor_shouldThrow_whenStartTimeMissing() {
        assertThatThrownBy(() -> Header.builder().scanId(42).build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("start_time is required");
    }

    @Test
    @DisplayName("constructor should reject a missing scan id")
    void constructor_shouldThrow_whenScanIdMissing() {
        assertThatThrownBy(() -> Header.builder().startTime(T0).build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("scan_id is required");
    }

    @Test
    @DisplayName("constructor should reject an end time before the start time")
    void constructor_shouldThrow_whenEndBeforeStart() {
        assertThatThrownBy(() -> Header.builder()
                .startTime(T0)
                .endTime(T0.minusSeconds(1))
                .scanId(42)
                .build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("before start_time");
    }

    @Test
    @DisplayName("constructor should reject an empty owner")
    void constructor_shouldThrow_whenOwnerEmpty() {
        assertThatThrownBy(() -> Header.builder().startTime(T0).scanId(42).owner("").build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("owner must not be empty");
    }

    @Test
    @DisplayName("fromFields should build a header from loosely typed input")
    void fromFields_shouldBuildHeader_whenValid() {
        Header header = Header.fromFields(Map.of(
            "start_time", "2014-04-10T18:34:23Z",
            "end_time", T0.getEpochSecond() + 60,
            "scan_id", "scan-7",
            "owner", "arkilic",
            "beamline_id", "xyzaag",
            "tags", List.of("dark"),
            "custom", Map.of("energy", 17.5)));

        assertThat(header.startTime()).isEqualTo(T0);
        assertThat(header.endTime()).isEqualTo(T0.plusSeconds(60));
        assertThat(header.scanId()).isEqualTo("scan-7");
        assertThat(header.beamlineId()).isEqualTo("xyzaag");
        assertThat(header.tags()).containsExactly("dark");
        assertThat(header.custom()).containsEntry("energy", 17.5);
        assertThat(header.status()).isEqualTo(Header.DEFAULT_STATUS);
    }

    @Test
    @DisplayName("fromFields should reject a non-string owner")
    void fromFields_shouldThrow_whenOwnerNotString() {
        assertThatThrownBy(() -> Header.fromFields(Map.of("start_time", T0, "scan_id", 1, "owner", 99)))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getField()).isEqualTo("owner"));
    }

    @Test
    @DisplayName("fromFields should reject a non-mapping custom field")
    void fromFields_shouldThrow_whenCustomNotMapping() {
        assertThatThrownBy(() -> Header.fromFields(Map.of("start_time", T0, "scan_id", 1, "custom", "x")))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getField()).isEqualTo("custom"));
    }

    @Test
    @DisplayName("fromFields should reject unknown field names")
    void fromFields_shouldThrow_whenFieldUnknown() {
        assertThatThrownBy(() -> Header.fromFields(Map.of("start_time", T0, "scan_id", 1, "run_owner", "x")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("run_owner");
    }

    @Test
    @DisplayName("header should be stored in the header collection")
    void metadataCollection_shouldBeHeader() {
        assertThat(Header.of(T0, 1).metadataCollection()).isEqualTo(MetadataCollection.HEADER);
    }
}
