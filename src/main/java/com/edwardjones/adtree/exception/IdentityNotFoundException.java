package com.edwardjones.adtree.exception;

public class IdentityNotFoundException extends DirectoryException {

    public IdentityNotFoundException(String identity) {
        super("Cannot find an object with identity: '" + identity + "'.");
    }
}
