package com.edwardjones.adtree.exception;

/**
 * Base type for failures raised while talking to the directory.
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
