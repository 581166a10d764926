package com.edwardjones.adtree.exception;

/**
 * Raised when the thread running a traversal is interrupted. Never reported as a
 * per-node diagnostic; it always unwinds the whole traversal.
 */
public class TraversalCancelledException extends RuntimeException {

    public TraversalCancelledException(String message) {
        super(message);
    }

    public TraversalCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
