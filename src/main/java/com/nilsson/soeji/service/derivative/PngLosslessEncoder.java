package com.nilsson.soeji.service.derivative;

import com.nilsson.soeji.service.storage.StorageKeys;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 Re-encodes the decoded pixels as a fresh PNG through ImageIO. The copy carries no text chunks,
 so it is the metadata-free variant served to viewers.
 */
public class PngLosslessEncoder implements LosslessEncoder {

    static {
        ImageIO.setUseCache(false);
    }

    @Override
    public String keySuffix() {
        return StorageKeys.LOSSLESS_SUFFIX;
    }

    @Override
    public String contentType() {
        return StorageKeys.PNG_CONTENT_TYPE;
    }

    @Override
    public byte[] encode(byte[] original) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(original));
        if (image == null) {
            throw new IOException("No ImageIO reader could decode the image");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(original.length);
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No ImageIO writer available for png");
        }
        return out.toByteArray();
    }
}
