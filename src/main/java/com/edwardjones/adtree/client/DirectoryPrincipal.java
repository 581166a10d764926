package com.edwardjones.adtree.client;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * A single entry yielded by the directory: a group, user, computer or anything else that can be
 * a member of a group. Each instance is a scoped handle and must be closed once its attributes
 * have been copied out. Closing is idempotent.
 */
@Getter
public class DirectoryPrincipal implements AutoCloseable {

    /** May be null when the directory could not resolve the member. */
    private final String distinguishedName;
    private final PrincipalKind kind;
    private final String name;
    private final String samAccountName;
    private final String displayName;
    private final String userPrincipalName;
    private final String description;
    private final String objectGuid;

    @Getter(AccessLevel.NONE)
    private final Runnable onClose;

    private boolean closed;

    @Builder
    private DirectoryPrincipal(String distinguishedName,
                               PrincipalKind kind,
                               String name,
                               String samAccountName,
                               String displayName,
                               String userPrincipalName,
                               String description,
                               String objectGuid,
                               Runnable onClose) {
        this.distinguishedName = distinguishedName;
        this.kind = kind != null ? kind : PrincipalKind.OTHER;
        this.name = name;
        this.samAccountName = samAccountName;
        this.displayName = displayName;
        this.userPrincipalName = userPrincipalName;
        this.description = description;
        this.objectGuid = objectGuid;
        this.onClose = onClose != null ? onClose : () -> { };
    }

    /**
     * A member entry the directory returned but could not resolve, e.g. an orphaned reference.
     */
    public static DirectoryPrincipal unresolved(Runnable onClose) {
        return DirectoryPrincipal.builder().kind(PrincipalKind.OTHER).onClose(onClose).build();
    }

    public boolean isGroup() {
        return kind == PrincipalKind.GROUP;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.run();
    }

    @Override
    public String toString() {
        return distinguishedName != null ? distinguishedName : "<unresolved>";
    }
}
