package com.nilsson.soeji.service.reader;

import java.util.List;

public interface MetadataReader {

    /**
     Short format identifier recorded in the sidecar (e.g. {@code "nai"}).
     */
    String formatName();

    /**
     Lower-case file extensions including the dot (e.g. {@code ".png"}).
     */
    List<String> supportedExtensions();

    /**
     Cheap structural check; must not decode the whole buffer.
     */
    boolean canRead(byte[] buffer);

    /**
     Extracts metadata. Called only after {@link #canRead(byte[])} returned true and never
     throws for malformed metadata.
     */
    MetadataReadResult read(byte[] buffer);
}
