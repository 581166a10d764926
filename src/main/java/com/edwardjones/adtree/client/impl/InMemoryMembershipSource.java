package com.edwardjones.adtree.client.impl;

import com.edwardjones.adtree.client.DirectoryMembershipSource;
import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.client.MemberSearch;
import com.edwardjones.adtree.client.PrincipalKind;
import com.edwardjones.adtree.exception.AmbiguousIdentityException;
import com.edwardjones.adtree.exception.DirectoryException;
import com.edwardjones.adtree.exception.IdentityNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Membership source backed by a fixed set of entries held in memory.
 */
@Slf4j
public class InMemoryMembershipSource implements DirectoryMembershipSource {

    private final Map<String, Entry> entries = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Set<String> unreadable = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    public InMemoryMembershipSource add(Entry entry) {
        entries.put(entry.distinguishedName(), entry);
        return this;
    }

    public InMemoryMembershipSource group(String dn, String... members) {
        return add(new Entry(dn, PrincipalKind.GROUP, null, null, null, null, List.of(members)));
    }

    public InMemoryMembershipSource user(String dn) {
        return add(new Entry(dn, PrincipalKind.USER, null, null, null, null, List.of()));
    }

    public InMemoryMembershipSource computer(String dn) {
        return add(new Entry(dn, PrincipalKind.COMPUTER, null, null, null, null, List.of()));
    }

    /**
     * Makes member queries against {@code dn} fail.
     */
    public InMemoryMembershipSource markUnreadable(String dn) {
        unreadable.add(dn);
        return this;
    }

    @Override
    public DirectoryPrincipal findGroup(String identity) {
        List<Entry> matches = entries.values().stream()
                .filter(entry -> entry.kind() == PrincipalKind.GROUP)
                .filter(entry -> entry.matches(identity))
                .toList();

        if (matches.isEmpty()) {
            throw new IdentityNotFoundException(identity);
        }
        if (matches.size() > 1) {
            throw new AmbiguousIdentityException(identity, matches.size());
        }
        return open(matches.get(0));
    }

    @Override
    public MemberSearch getMembers(DirectoryPrincipal group) {
        String dn = group.getDistinguishedName();
        Entry entry = entries.get(dn);
        if (entry == null) {
            throw new DirectoryException("No such object: " + dn);
        }
        if (unreadable.contains(dn)) {
            throw new DirectoryException("Insufficient access rights to read members of " + dn);
        }

        List<String> members = new ArrayList<>(entry.members());
        return new MemberSearch() {
            @Override
            public Iterator<DirectoryPrincipal> iterator() {
                return members.stream().map(InMemoryMembershipSource.this::resolve).iterator();
            }

            @Override
            public void close() {
            }
        };
    }

    /**
     * Called once for every handle given out. The returned action, if any, runs when that
     * handle is closed.
     */
    protected Runnable handleIssued() {
        return null;
    }

    private DirectoryPrincipal resolve(String dn) {
        Entry entry = entries.get(dn);
        if (entry == null) {
            log.debug("Member '{}' is not present in the directory", dn);
            return DirectoryPrincipal.unresolved(handleIssued());
        }
        return open(entry);
    }

    private DirectoryPrincipal open(Entry entry) {
        return DirectoryPrincipal.builder()
                .distinguishedName(entry.distinguishedName())
                .kind(entry.kind())
                .name(entry.name())
                .samAccountName(entry.samAccountName())
                .displayName(entry.displayName())
                .userPrincipalName(entry.userPrincipalName())
                .onClose(handleIssued())
                .build();
    }

    /**
     * A directory object and, for groups, the distinguished names of its direct members.
     */
    public record Entry(
        String distinguishedName,
        PrincipalKind kind,
        String samAccountName,
        String name,
        String displayName,
        String userPrincipalName,
        List<String> members
    ) {

        public Entry {
            members = members != null ? List.copyOf(members) : List.of();
        }

        boolean matches(String identity) {
            return identity.equalsIgnoreCase(distinguishedName)
                    || identity.equalsIgnoreCase(samAccountName)
                    || identity.equalsIgnoreCase(name)
                    || identity.equalsIgnoreCase(userPrincipalName);
        }
    }
}
