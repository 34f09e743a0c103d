package com.nilsson.soeji.service.png;

import com.drew.imaging.png.PngChunk;
import com.drew.imaging.png.PngChunkType;
import com.drew.imaging.png.PngHeader;
import com.drew.imaging.png.PngMetadataReader;
import com.drew.imaging.png.PngProcessingException;
import com.drew.lang.KeyValuePair;
import com.drew.lang.SequentialByteArrayReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.png.PngDirectory;
import com.nilsson.soeji.model.ImageDimensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 <h2>PngChunkReader</h2>
 <p>
 Reads textual metadata and header dimensions out of a PNG through metadata-extractor, without
 decoding any pixels.
 </p>
 <ul>
 <li><b>tEXt:</b> latin1 text.</li>
 <li><b>zTXt:</b> deflated text, read as utf8 since that is what NovelAI writes.</li>
 <li><b>iTXt:</b> utf8 text, deflated or not.</li>
 </ul>
 <p>
 A buffer without the PNG signature is rejected. A stream that ends inside a chunk is cut after
 the last complete chunk, so text read before the damage survives. Any other broken chunk stream
 is treated as carrying no metadata. Compressed chunks are only inflated while their combined
 compressed size stays under {@link #MAX_COMPRESSED_BYTES}.
 </p>
 <p>
 The reader holds no state and is safe to share between threads.
 </p>
 */
public class PngChunkReader {

    private static final Logger logger = LoggerFactory.getLogger(PngChunkReader.class);

    public static final String COMMENT_KEYWORD = "Comment";

    /**
     Deflate expands at most about a thousandfold, so this bounds inflated text to tens of megabytes.
     */
    public static final int MAX_COMPRESSED_BYTES = 32 * 1024;

    private static final byte[] SIGNATURE = {
            (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };

    private static final byte[] IEND_CHUNK = {
            0, 0, 0, 0, 0x49, 0x45, 0x4E, 0x44, (byte) 0xAE, 0x42, 0x60, (byte) 0x82
    };

    private static final Set<PngChunkType> HEADER = Set.of(PngChunkType.IHDR);
    private static final Set<PngChunkType> COMPRESSED = Set.of(PngChunkType.zTXt, PngChunkType.iTXt, PngChunkType.iCCP);

    // --- Public API ---

    public static boolean hasSignature(byte[] buffer) {
        if (buffer == null || buffer.length < SIGNATURE.length) return false;
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (buffer[i] != SIGNATURE[i]) return false;
        }
        return true;
    }

    /**
     Returns the text of the first textual chunk whose keyword is {@code Comment}.

     @return the decoded text, or {@code null} when the image carries no readable such chunk
     @throws NotAPngException if the buffer lacks the PNG signature
     */
    public String readComment(byte[] buffer) throws NotAPngException {
        for (TextEntry entry : readTextEntries(buffer)) {
            if (COMMENT_KEYWORD.equals(entry.keyword)) {
                return entry.text;
            }
        }
        return null;
    }

    /**
     Collects every decodable keyword/text pair. When a keyword repeats the first one wins.
     */
    public Map<String, String> readTextChunks(byte[] buffer) throws NotAPngException {
        Map<String, String> texts = new LinkedHashMap<>();
        for (TextEntry entry : readTextEntries(buffer)) {
            texts.putIfAbsent(entry.keyword, entry.text);
        }
        return texts;
    }

    /**
     Reads width and height from the {@code IHDR} chunk.

     @return the dimensions, or {@code null} when the buffer is not a PNG or the header is unusable
     */
    public ImageDimensions readDimensions(byte[] buffer) {
        if (!hasSignature(buffer)) return null;
        try {
            for (PngChunk chunk : extract(completeChunks(buffer), HEADER)) {
                PngHeader header = new PngHeader(chunk.getBytes());
                if (header.getImageWidth() <= 0 || header.getImageHeight() <= 0) return null;
                return new ImageDimensions(header.getImageWidth(), header.getImageHeight());
            }
        } catch (PngProcessingException | IOException e) {
            logger.debug("No usable IHDR: {}", e.getMessage());
        }
        return null;
    }

    // --- Decoding ---

    private List<TextEntry> readTextEntries(byte[] buffer) throws NotAPngException {
        if (!hasSignature(buffer)) {
            throw new NotAPngException("Not a valid PNG file");
        }

        byte[] complete = completeChunks(buffer);
        Metadata metadata;
        try {
            if (!compressedChunksWithinLimit(complete)) return List.of();
            metadata = PngMetadataReader.readMetadata(new ByteArrayInputStream(complete));
        } catch (PngProcessingException | IOException e) {
            logger.debug("Unreadable PNG chunk stream: {}", e.getMessage());
            return List.of();
        }

        List<TextEntry> entries = new ArrayList<>();
        for (PngDirectory directory : metadata.getDirectoriesOfType(PngDirectory.class)) {
            Object textual = directory.getObject(PngDirectory.TAG_TEXTUAL_DATA);
            if (!(textual instanceof List)) continue;

            Charset charset = PngChunkType.tEXt.equals(directory.getPngChunkType())
                    ? StandardCharsets.ISO_8859_1
                    : StandardCharsets.UTF_8;
            for (Object item : (List<?>) textual) {
                if (item instanceof KeyValuePair) {
                    KeyValuePair pair = (KeyValuePair) item;
                    entries.add(new TextEntry(pair.getKey(), new String(pair.getValue().getBytes(), charset)));
                }
            }
        }
        return entries;
    }

    private boolean compressedChunksWithinLimit(byte[] buffer) throws PngProcessingException, IOException {
        long compressed = 0;
        for (PngChunk chunk : extract(buffer, COMPRESSED)) {
            if (isCompressed(chunk)) compressed += chunk.getBytes().length;
        }
        if (compressed > MAX_COMPRESSED_BYTES) {
            logger.warn("Skipping PNG metadata: {} compressed bytes exceed the {} byte limit",
                    compressed, MAX_COMPRESSED_BYTES);
            return false;
        }
        return true;
    }

    /**
     Returns the buffer up to the end of its last whole chunk, closed with an {@code IEND} when the
     original stream stops before one. Only chunk lengths are inspected.
     */
    static byte[] completeChunks(byte[] buffer) {
        int offset = SIGNATURE.length;
        while (buffer.length - offset >= 12) {
            long length = ((buffer[offset] & 0xFFL) << 24) | ((buffer[offset + 1] & 0xFF) << 16)
                    | ((buffer[offset + 2] & 0xFF) << 8) | (buffer[offset + 3] & 0xFF);
            long end = offset + 12L + length;
            if (end > buffer.length) break;
            boolean imageEnd = buffer[offset + 4] == 'I' && buffer[offset + 5] == 'E'
                    && buffer[offset + 6] == 'N' && buffer[offset + 7] == 'D';
            offset = (int) end;
            if (imageEnd) return buffer;
        }
        byte[] closed = Arrays.copyOf(buffer, offset + IEND_CHUNK.length);
        System.arraycopy(IEND_CHUNK, 0, closed, offset, IEND_CHUNK.length);
        return closed;
    }

    // iTXt carries a compression flag right after the keyword terminator.
    private static boolean isCompressed(PngChunk chunk) {
        if (!PngChunkType.iTXt.equals(chunk.getType())) return true;
        byte[] data = chunk.getBytes();
        for (int i = 0; i < data.length - 1; i++) {
            if (data[i] == 0) return data[i + 1] == 1;
        }
        return false;
    }

    private static Iterable<PngChunk> extract(byte[] buffer, Set<PngChunkType> types)
            throws PngProcessingException, IOException {
        return new com.drew.imaging.png.PngChunkReader().extract(new SequentialByteArrayReader(buffer), types);
    }

    private static final class TextEntry {
        final String keyword;
        final String text;

        TextEntry(String keyword, String text) {
            this.keyword = keyword;
            this.text = text;
        }
    }
}
