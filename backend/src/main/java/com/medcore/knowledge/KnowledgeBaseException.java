package com.medcore.knowledge;

/**
 * A knowledge-base artifact could not be read or parsed at startup.
 */
public class KnowledgeBaseException extends RuntimeException {

    public KnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
