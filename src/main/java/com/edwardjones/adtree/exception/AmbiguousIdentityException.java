package com.edwardjones.adtree.exception;

public class AmbiguousIdentityException extends DirectoryException {

    public AmbiguousIdentityException(String identity, int matches) {
        super("Identity '" + identity + "' matched " + matches + " groups.");
    }
}
