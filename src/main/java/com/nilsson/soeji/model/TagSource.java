package com.nilsson.soeji.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 Identifies which part of a generation record produced a tag association.
 <p>
 The wire names are the values stored in the {@code image_tags.source} column, written
 to the metadata sidecar and exposed in the {@code weightedTags} search field.
 </p>
 */
public enum TagSource {

    PROMPT("prompt"),
    V4_BASE("v4_base"),
    V4_CHAR("v4_char"),
    NEGATIVE("negative"),
    USER("user");

    private final String wireName;

    TagSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isUser() {
        return this == USER;
    }

    /**
     Resolves a stored source name. Rows written before sources were recorded carry no value;
     those are treated as prompt metadata so they keep counting toward popularity.
     */
    @JsonCreator
    public static TagSource fromWire(String value) {
        if (value == null) return PROMPT;
        for (TagSource source : values()) {
            if (source.wireName.equals(value)) return source;
        }
        return PROMPT;
    }
}
