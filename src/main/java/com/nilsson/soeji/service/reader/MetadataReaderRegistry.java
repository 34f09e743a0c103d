package com.nilsson.soeji.service.reader;

import javax.inject.Inject;
import java.util.List;
import java.util.Locale;

/**
 <h2>MetadataReaderRegistry</h2>
 <p>
 Holds the format-specific readers in priority order and hands a buffer to the first one that
 claims it. A buffer no reader claims resolves to {@link MetadataReadResult#unknown()} instead
 of {@code null}.
 </p>
 */
public class MetadataReaderRegistry {

    private final List<MetadataReader> readers;

    @Inject
    public MetadataReaderRegistry(NovelAIPngReader novelAIReader) {
        this(List.of(novelAIReader));
    }

    public MetadataReaderRegistry(List<MetadataReader> readers) {
        this.readers = List.copyOf(readers);
    }

    public MetadataReadResult detectAndRead(byte[] buffer, String filename) {
        String extension = extensionOf(filename);
        for (MetadataReader reader : readers) {
            if (reader.supportedExtensions().contains(extension) && reader.canRead(buffer)) {
                return reader.read(buffer);
            }
        }
        return MetadataReadResult.unknown();
    }

    public List<MetadataReader> getReaders() {
        return readers;
    }

    static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        int separator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot <= separator) return "";
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
