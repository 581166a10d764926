package com.edwardjones.adtree.client;

/**
 * Direct members of one group, in the order the directory returned them. Entries are produced
 * lazily while iterating; the search itself must be closed when enumeration ends.
 */
public interface MemberSearch extends Iterable<DirectoryPrincipal>, AutoCloseable {

    @Override
    void close();
}
