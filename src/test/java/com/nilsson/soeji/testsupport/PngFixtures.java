package com.nilsson.soeji.testsupport;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;
import java.util.zip.DeflaterOutputStream;

/**
 Builds PNG buffers in memory: a real ImageIO-encoded image with hand-assembled text chunks
 spliced in right after IHDR.
 */
public final class PngFixtures {

    public static final byte[] SIGNATURE = {
            (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };

    // signature + IHDR (length, type, 13 data bytes, crc)
    private static final int AFTER_IHDR = 8 + 4 + 4 + 13 + 4;

    private PngFixtures() {
    }

    /**
     A decodable PNG filled with one colour. Different colours give different content hashes.
     */
    public static byte[] png(int width, int height, int rgb, byte[]... extraChunks) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        ByteArrayOutputStream encoded = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", encoded);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return splice(encoded.toByteArray(), extraChunks);
    }

    /**
     An 8x8 PNG carrying the given text as its NovelAI {@code Comment}.
     */
    public static byte[] withComment(String comment, int rgb) {
        return png(8, 8, rgb, tEXt("Comment", comment));
    }

    public static byte[] splice(byte[] png, byte[]... extraChunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(png, 0, AFTER_IHDR);
        for (byte[] chunk : extraChunks) {
            out.writeBytes(chunk);
        }
        out.write(png, AFTER_IHDR, png.length - AFTER_IHDR);
        return out.toByteArray();
    }

    /**
     Signature followed by the given chunks only, without IHDR or image data.
     */
    public static byte[] rawPng(byte[]... chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(SIGNATURE);
        for (byte[] chunk : chunks) {
            out.writeBytes(chunk);
        }
        return out.toByteArray();
    }

    // --- Chunks ---

    public static byte[] tEXt(String keyword, String text) {
        return chunk("tEXt", concat(latin1(keyword), new byte[]{0}, latin1(text)));
    }

    public static byte[] zTXt(String keyword, String text) {
        return zTXt(keyword, text, 0);
    }

    public static byte[] zTXt(String keyword, String text, int method) {
        return chunk("zTXt", concat(latin1(keyword), new byte[]{0, (byte) method},
                deflate(text.getBytes(StandardCharsets.UTF_8))));
    }

    public static byte[] iTXt(String keyword, String text, boolean compressed) {
        byte[] body = compressed ? deflate(text.getBytes(StandardCharsets.UTF_8)) : text.getBytes(StandardCharsets.UTF_8);
        return chunk("iTXt", concat(keyword.getBytes(StandardCharsets.UTF_8),
                new byte[]{0, (byte) (compressed ? 1 : 0), 0},
                latin1("en"), new byte[]{0},
                new byte[]{0},
                body));
    }

    public static byte[] ihdr(int width, int height) {
        ByteBuffer data = ByteBuffer.allocate(13);
        data.putInt(width).putInt(height).put((byte) 8).put((byte) 2).put((byte) 0).put((byte) 0).put((byte) 0);
        return chunk("IHDR", data.array());
    }

    public static byte[] iend() {
        return chunk("IEND", new byte[0]);
    }

    /**
     A chunk header that claims more data than follows it.
     */
    public static byte[] truncatedChunk(String type, int claimedLength) {
        ByteBuffer header = ByteBuffer.allocate(8 + 3);
        header.putInt(claimedLength).put(type.getBytes(StandardCharsets.US_ASCII)).put(new byte[3]);
        return header.array();
    }

    public static byte[] chunk(String type, byte[] data) {
        byte[] typeBytes = type.getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(typeBytes);
        crc.update(data);

        ByteBuffer buffer = ByteBuffer.allocate(4 + 4 + data.length + 4);
        buffer.putInt(data.length).put(typeBytes).put(data).putInt((int) crc.getValue());
        return buffer.array();
    }

    // --- Helpers ---

    private static byte[] latin1(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static byte[] deflate(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream deflater = new DeflaterOutputStream(out)) {
            deflater.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
