package com.edwardjones.adtree.client.impl.production;

import com.edwardjones.adtree.client.DirectoryMembershipSource;
import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.client.MemberSearch;
import com.edwardjones.adtree.exception.AmbiguousIdentityException;
import com.edwardjones.adtree.exception.DirectoryException;
import com.edwardjones.adtree.exception.IdentityNotFoundException;
import com.edwardjones.adtree.util.LdapUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ldap.NameNotFoundException;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.DefaultIncrementalAttributesMapper;
import org.springframework.ldap.query.LdapQuery;

import javax.naming.Name;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.ldap.LdapName;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import static org.springframework.ldap.query.LdapQueryBuilder.query;
import static org.springframework.ldap.support.LdapUtils.newLdapName;
import static org.springframework.ldap.support.LdapUtils.removeFirst;

/**
 * Reads group membership from Active Directory through Spring LDAP.
 *
 * Members are read from the group's {@code member} attribute using ranged retrieval, so groups
 * larger than the server's value limit are returned in full, and each member entry is looked up
 * only when the enumeration reaches it.
 */
@Slf4j
@RequiredArgsConstructor
public class LdapMembershipSource implements DirectoryMembershipSource {

    // Two is enough to tell a unique match from an ambiguous one.
    private static final int IDENTITY_COUNT_LIMIT = 2;

    private static final String[] REQUESTED_ATTRIBUTES = {
            "distinguishedName", "objectClass", "sAMAccountName", "name",
            "displayName", "userPrincipalName", "description", "objectGUID"
    };

    private final LdapTemplate ldapTemplate;
    private final LdapName baseName;
    private final int timeLimitMillis;

    private final AttributesMapper<DirectoryPrincipal> mapper = new PrincipalAttributesMapper();

    @Override
    public DirectoryPrincipal findGroup(String identity) {
        LdapQuery query = query()
                .countLimit(IDENTITY_COUNT_LIMIT)
                .timeLimit(timeLimitMillis)
                .attributes(REQUESTED_ATTRIBUTES)
                .where("objectClass").is("group")
                .and(query()
                        .where("distinguishedName").is(identity)
                        .or("sAMAccountName").is(identity)
                        .or("name").is(identity)
                        .or("userPrincipalName").is(identity));

        List<DirectoryPrincipal> matches;
        try {
            matches = ldapTemplate.search(query, mapper).stream()
                    .filter(Objects::nonNull)
                    .toList();
        } catch (org.springframework.ldap.NamingException e) {
            throw new DirectoryException("Failed to resolve identity '" + identity + "'", e);
        }

        log.debug("Identity '{}' matched {} group(s)", identity, matches.size());
        if (matches.isEmpty()) {
            throw new IdentityNotFoundException(identity);
        }
        if (matches.size() > 1) {
            matches.forEach(DirectoryPrincipal::close);
            throw new AmbiguousIdentityException(identity, matches.size());
        }
        return matches.get(0);
    }

    @Override
    public MemberSearch getMembers(DirectoryPrincipal group) {
        List<Object> memberValues;
        try {
            memberValues = DefaultIncrementalAttributesMapper.lookupAttributeValues(
                    ldapTemplate, relativeName(group.getDistinguishedName()), "member");
        } catch (org.springframework.ldap.NamingException e) {
            throw new DirectoryException("Failed to read members of '" + group.getDistinguishedName() + "'", e);
        }

        List<String> memberDns = new ArrayList<>(memberValues.size());
        for (Object value : memberValues) {
            memberDns.add(String.valueOf(value));
        }
        log.debug("Group '{}' has {} direct member(s)", group.getDistinguishedName(), memberDns.size());

        return new MemberSearch() {
            @Override
            public Iterator<DirectoryPrincipal> iterator() {
                return memberDns.stream().map(LdapMembershipSource.this::lookupMember).iterator();
            }

            @Override
            public void close() {
                memberDns.clear();
            }
        };
    }

    private DirectoryPrincipal lookupMember(String dn) {
        try {
            return ldapTemplate.lookup(relativeName(dn), REQUESTED_ATTRIBUTES, mapper);
        } catch (NameNotFoundException e) {
            log.debug("Member '{}' could not be resolved: {}", dn, e.getMessage());
            return DirectoryPrincipal.unresolved(null);
        } catch (org.springframework.ldap.NamingException e) {
            throw new DirectoryException("Failed to look up member '" + dn + "'", e);
        }
    }

    private Name relativeName(String dn) {
        return removeFirst(newLdapName(dn), baseName);
    }

    private static class PrincipalAttributesMapper implements AttributesMapper<DirectoryPrincipal> {
        @Override
        public DirectoryPrincipal mapFromAttributes(Attributes attrs) throws NamingException {
            return DirectoryPrincipal.builder()
                    .distinguishedName(getAttribute(attrs, "distinguishedName"))
                    .kind(LdapUtils.principalKindOf(getAttributes(attrs, "objectClass")))
                    .name(getAttribute(attrs, "name"))
                    .samAccountName(getAttribute(attrs, "sAMAccountName"))
                    .displayName(getAttribute(attrs, "displayName"))
                    .userPrincipalName(getAttribute(attrs, "userPrincipalName"))
                    .description(getAttribute(attrs, "description"))
                    .objectGuid(getObjectGuid(attrs))
                    .build();
        }

        private String getAttribute(Attributes attrs, String attrId) throws NamingException {
            return attrs.get(attrId) != null ? (String) attrs.get(attrId).get() : null;
        }

        private List<String> getAttributes(Attributes attrs, String attrId) throws NamingException {
            Attribute attribute = attrs.get(attrId);
            List<String> values = new ArrayList<>();
            if (attribute == null) {
                return values;
            }
            NamingEnumeration<?> all = attribute.getAll();
            try {
                while (all.hasMore()) {
                    values.add(String.valueOf(all.next()));
                }
            } finally {
                all.close();
            }
            return values;
        }

        private String getObjectGuid(Attributes attrs) throws NamingException {
            Attribute attribute = attrs.get("objectGUID");
            if (attribute == null) {
                return null;
            }
            Object value = attribute.get();
            return value instanceof byte[] bytes ? LdapUtils.objectGuidToString(bytes) : null;
        }
    }
}
