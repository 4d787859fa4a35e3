package org.fairway.search;

/**
 * Thrown when attempting to extract from an empty {@link SearchQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
