package com.nilsson.soeji.service.derivative;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.service.reader.MetadataReadResult;

import java.io.IOException;
import java.time.Instant;

/**
 <h2>MetadataSidecar</h2>
 <p>
 The {@code {hash}.metadata.json} object stored next to every original. It is an audit and
 recovery copy of what was read from the file at upload time, independent of the relational
 record:
 </p>
 <pre>{"format":"nai","metadata":{...},"uploadedAt":"2024-05-01T12:00:00Z","filename":"a.png"}</pre>
 */
@JsonPropertyOrder({"format", "metadata", "uploadedAt", "filename"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public class MetadataSidecar {

    private final String format;
    private final GenerationMetadata metadata;
    private final Instant uploadedAt;
    private final String filename;

    @JsonCreator
    public MetadataSidecar(@JsonProperty("format") String format,
                           @JsonProperty("metadata") GenerationMetadata metadata,
                           @JsonProperty("uploadedAt") Instant uploadedAt,
                           @JsonProperty("filename") String filename) {
        this.format = format;
        this.metadata = metadata;
        this.uploadedAt = uploadedAt;
        this.filename = filename;
    }

    public static MetadataSidecar of(MetadataReadResult result, Instant uploadedAt, String filename) {
        return new MetadataSidecar(result.getFormat(), result.getMetadata(), uploadedAt, filename);
    }

    @JsonProperty("format")
    public String getFormat() {
        return format;
    }

    @JsonProperty("metadata")
    public GenerationMetadata getMetadata() {
        return metadata;
    }

    @JsonProperty("uploadedAt")
    public Instant getUploadedAt() {
        return uploadedAt;
    }

    @JsonProperty("filename")
    public String getFilename() {
        return filename;
    }

    /**
     Compact UTF-8 JSON. The mapper must have the Java time module registered and write dates as
     ISO-8601 text.
     */
    public byte[] toJson(ObjectMapper mapper) throws JsonProcessingException {
        return mapper.writeValueAsBytes(this);
    }

    public static MetadataSidecar fromJson(ObjectMapper mapper, byte[] json) throws IOException {
        return mapper.readValue(json, MetadataSidecar.class);
    }
}
