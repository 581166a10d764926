package com.edwardjones.adtree.exception;

/**
 * The directory could not be reached while setting up a connection.
 * Fatal for the invocation that requested it.
 */
public class DirectoryConnectionException extends DirectoryException {

    public DirectoryConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
