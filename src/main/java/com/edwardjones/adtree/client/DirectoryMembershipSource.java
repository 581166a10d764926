package com.edwardjones.adtree.client;

import com.edwardjones.adtree.exception.AmbiguousIdentityException;
import com.edwardjones.adtree.exception.DirectoryException;
import com.edwardjones.adtree.exception.IdentityNotFoundException;

/**
 * Read access to group membership in a directory.
 * Allows swapping between mock and production implementations.
 */
public interface DirectoryMembershipSource extends AutoCloseable {

    /**
     * Resolves a group by distinguished name, sAMAccountName, name or userPrincipalName.
     *
     * @throws IdentityNotFoundException if no group matches
     * @throws AmbiguousIdentityException if more than one group matches
     * @throws DirectoryException for any other lookup failure
     */
    DirectoryPrincipal findGroup(String identity);

    /**
     * Lists the direct members of {@code group}.
     *
     * @throws DirectoryException if the members cannot be read
     */
    MemberSearch getMembers(DirectoryPrincipal group);

    @Override
    default void close() {
    }
}
