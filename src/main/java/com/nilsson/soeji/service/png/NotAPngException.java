package com.nilsson.soeji.service.png;

import java.io.IOException;

/**
 Thrown when a buffer does not start with the 8-byte PNG signature.
 */
public class NotAPngException extends IOException {

    public NotAPngException(String message) {
        super(message);
    }
}
