package tech.metadatastore.database.model;

import lombok.Builder;
import org.bson.Document;
import tech.metadatastore.database.exception.ValidationException;
import tech.metadatastore.database.schema.MetadataCollection;
import tech.metadatastore.database.storage.MetadataDatabase;
import tech.metadatastore.database.storage.RecordCollection;
import tech.metadatastore.database.support.CurrentUser;
import tech.metadatastore.database.validation.Validators;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Run header: the top-level record of one experiment run.
 *
 * <p>{@code scanId} identifies the run and is unique across all headers. The
 * uniqueness is enforced by a unique index on the collection, not here.
 *
 * <p>Omitted optional values get their defaults at construction time: the
 * owner is the user running the process, the status is {@value #DEFAULT_STATUS}
 * and the containers are new empty instances.
 */
@Builder(toBuilder = true)
public record Header(
    Instant startTime,
    Instant endTime,
    String owner,
    Object scanId,
    String beamlineId,
    List<Object> headerVersions,
    String status,
    List<Object> tags,
    Map<String, Object> custom
) implements MetadataRecord {

    public static final String DEFAULT_STATUS = "In Progress";

    private static final Set<String> FIELDS = Set.of(
        "start_time", "end_time", "owner", "scan_id", "status",
        "beamline_id", "header_versions", "custom", "tags");

    public Header {
        startTime = Validators.startTime(startTime);
        endTime = Validators.endTime(endTime);
        if (endTime != null && endTime.isBefore(startTime)) {
            throw ValidationException.endBeforeStart(startTime, endTime);
        }
        owner = owner == null ? CurrentUser.name() : Validators.requiredString(owner, "owner");
        scanId = Validators.scalar(scanId, "scan_id");
        beamlineId = Validators.optionalString(beamlineId, "beamline_id");
        headerVersions = Validators.list(headerVersions, "header_versions");
        status = status == null ? DEFAULT_STATUS : Validators.optionalString(status, "status");
        tags = Validators.list(tags, "tags");
        custom = Validators.dict(custom, "custom");
    }

    /**
     * Create a header with only the required fields.
     */
    public static Header of(Instant startTime, Object scanId) {
        return Header.builder().startTime(startTime).scanId(scanId).build();
    }

    /**
     * Build a header from loosely typed input keyed by stored field name
     * (e.g. values decoded from an acquisition system's JSON).
     */
    public static Header fromFields(Map<String, ?> fields) {
        Validators.knownFields(fields, FIELDS);
        return new Header(
            Validators.startTime(fields.get("start_time")),
            Validators.endTime(fields.get("end_time")),
            Validators.optionalString(fields.get("owner"), "owner"),
            fields.get("scan_id"),
            Validators.optionalString(fields.get("beamline_id"), "beamline_id"),
            Validators.list(fields.get("header_versions"), "header_versions"),
            Validators.optionalString(fields.get("status"), "status"),
            Validators.list(fields.get("tags"), "tags"),
            Validators.dict(fields.get("custom"), "custom")
        );
    }

    @Override
    public MetadataCollection metadataCollection() {
        return MetadataCollection.HEADER;
    }

    @Override
    public Document toDocument() {
        return new Document()
            .append("start_time", Date.from(startTime))
            .append("end_time", endTime != null ? Date.from(endTime) : null)
            .append("owner", owner)
            .append("scan_id", scanId)
            .append("status", status)
            .append("beamline_id", beamlineId)
            .append("header_versions", headerVersions)
            .append("custom", custom)
            .append("tags", tags);
    }

    /**
     * Handle to the header collection for ad-hoc access.
     */
    public static RecordCollection getCollection(MetadataDatabase database) {
        return database.collection(MetadataCollection.HEADER);
    }
}
