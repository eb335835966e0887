// file: storage/src/main/java/io/budgetsync/storage/WriterMetadataCodec.java
package io.budgetsync.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.budgetsync.core.WriterRecord;

import java.io.IOException;
import java.nio.file.Path;

/**
 * JSON form of a writer's ".meta" record:
 * <pre>
 *   {
 *     "deviceGuid": "6F1E...", "shortDeviceId": "A", "friendlyName": "laptop",
 *     "hasFullKnowledge": false, "knowledge": 40, "formatVersion": "1.0"
 *   }
 * </pre>
 */
final class WriterMetadataCodec {

    private WriterMetadataCodec() {
        // utility
    }

    static byte[] encode(WriterRecord writer) {
        var dto = new MetadataDto(
                writer.writerGuid(),
                writer.writerTag(),
                writer.friendlyName(),
                writer.hasFullKnowledge(),
                writer.knowledge(),
                writer.formatVersion()
        );
        try {
            return JsonSupport.mapper().writeValueAsBytes(dto);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode metadata for " + writer.writerGuid(), e);
        }
    }

    /**
     * @throws DeviceMetadataCorruptException if the bytes are not a complete metadata record
     */
    static WriterRecord decode(Path source, byte[] bytes) {
        MetadataDto dto;
        try {
            dto = JsonSupport.mapper().readValue(bytes, MetadataDto.class);
        } catch (IOException e) {
            throw new DeviceMetadataCorruptException(source, "unreadable JSON", e);
        }
        if (dto == null) throw new DeviceMetadataCorruptException(source, "empty document", null);
        if (dto.deviceGuid == null || dto.deviceGuid.isBlank())
            throw new DeviceMetadataCorruptException(source, "missing deviceGuid", null);
        if (dto.shortDeviceId == null || dto.shortDeviceId.isBlank())
            throw new DeviceMetadataCorruptException(source, "missing shortDeviceId", null);
        if (dto.knowledge == null || dto.knowledge < 0)
            throw new DeviceMetadataCorruptException(source, "missing or negative knowledge", null);
        try {
            return new WriterRecord(
                    dto.deviceGuid,
                    dto.shortDeviceId,
                    dto.friendlyName,
                    dto.knowledge,
                    Boolean.TRUE.equals(dto.hasFullKnowledge),
                    dto.formatVersion
            );
        } catch (IllegalArgumentException e) {
            throw new DeviceMetadataCorruptException(source, e.getMessage(), e);
        }
    }

    // ---------- JSON DTO ----------

    static final class MetadataDto {
        @JsonProperty("deviceGuid") final String deviceGuid;
        @JsonProperty("shortDeviceId") final String shortDeviceId;
        @JsonProperty("friendlyName") final String friendlyName;
        @JsonProperty("hasFullKnowledge") final Boolean hasFullKnowledge;
        @JsonProperty("knowledge") final Long knowledge;
        @JsonProperty("formatVersion") final String formatVersion;

        @JsonCreator
        MetadataDto(
                @JsonProperty("deviceGuid") String deviceGuid,
                @JsonProperty("shortDeviceId") String shortDeviceId,
                @JsonProperty("friendlyName") String friendlyName,
                @JsonProperty("hasFullKnowledge") Boolean hasFullKnowledge,
                @JsonProperty("knowledge") Long knowledge,
                @JsonProperty("formatVersion") String formatVersion
        ) {
            this.deviceGuid = deviceGuid;
            this.shortDeviceId = shortDeviceId;
            this.friendlyName = friendlyName;
            this.hasFullKnowledge = hasFullKnowledge;
            this.knowledge = knowledge;
            this.formatVersion = formatVersion;
        }
    }
}
