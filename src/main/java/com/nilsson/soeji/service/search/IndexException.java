package com.nilsson.soeji.service.search;

/**
 A document index operation failed. Unchecked, like the API errors of a search client.
 */
public class IndexException extends RuntimeException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
