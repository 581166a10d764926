package com.edwardjones.adtree.client;

import com.edwardjones.adtree.exception.DirectoryConnectionException;

public interface DirectoryConnector {

    /**
     * Opens a membership source against {@code server}, or against the configured default
     * directory when {@code server} is null or blank.
     *
     * @throws DirectoryConnectionException if the directory cannot be reached
     */
    DirectoryMembershipSource connect(String server);
}
