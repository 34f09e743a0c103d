package com.nilsson.soeji.service.reader;

import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.service.parser.PromptParser;
import com.nilsson.soeji.service.png.NotAPngException;
import com.nilsson.soeji.service.png.PngChunkReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.List;

/**
 Reads the NovelAI generation record from the {@code Comment} text chunk of a PNG.
 <p>
 A PNG without a comment is still claimed by this reader; it simply yields an empty record so
 the image can be ingested without tags.
 </p>
 */
public class NovelAIPngReader implements MetadataReader {

    private static final Logger logger = LoggerFactory.getLogger(NovelAIPngReader.class);

    public static final String FORMAT_NAME = "nai";

    private final PngChunkReader chunkReader;
    private final PromptParser promptParser;

    @Inject
    public NovelAIPngReader(PngChunkReader chunkReader, PromptParser promptParser) {
        this.chunkReader = chunkReader;
        this.promptParser = promptParser;
    }

    @Override
    public String formatName() {
        return FORMAT_NAME;
    }

    @Override
    public List<String> supportedExtensions() {
        return List.of(".png");
    }

    @Override
    public boolean canRead(byte[] buffer) {
        return PngChunkReader.hasSignature(buffer);
    }

    @Override
    public MetadataReadResult read(byte[] buffer) {
        String comment;
        try {
            comment = chunkReader.readComment(buffer);
        } catch (NotAPngException e) {
            logger.debug("Buffer rejected after canRead: {}", e.getMessage());
            return MetadataReadResult.unknown();
        }
        if (comment == null) {
            return new MetadataReadResult(FORMAT_NAME, GenerationMetadata.empty(""));
        }
        return new MetadataReadResult(FORMAT_NAME, promptParser.parse(comment));
    }
}
