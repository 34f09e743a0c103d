package com.nilsson.soeji.data;

import java.sql.SQLException;

/**
 Thrown when a tag could neither be found nor created within the allowed number of attempts.
 */
public class TagConflictException extends SQLException {

    private final String tagName;

    public TagConflictException(String tagName, int attempts, SQLException lastConflict) {
        super("Could not resolve tag '" + tagName + "' after " + attempts + " attempts", lastConflict);
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }
}
