package com.nilsson.soeji.service.derivative;

import java.io.IOException;

/**
 Produces the lossless re-encoded copy of an original image.
 */
public interface LosslessEncoder {

    /**
     Suffix appended to the content hash to build the derivative's storage key.
     */
    String keySuffix();

    String contentType();

    byte[] encode(byte[] original) throws IOException;
}
