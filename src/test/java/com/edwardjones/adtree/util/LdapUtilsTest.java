package com.edwardjones.adtree.util;

import com.edwardjones.adtree.client.PrincipalKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LdapUtilsTest {

    @Test
    void testDomainFromDn() {
        assertEquals("corp.example.com", LdapUtils.domainFromDn("CN=Engineering,OU=Groups,DC=corp,DC=example,DC=com"));
        assertEquals("corp.example.com", LdapUtils.domainFromDn("cn=x, dc=corp, dc=example, dc=com"));
        assertNull(LdapUtils.domainFromDn("CN=Engineering,OU=Groups"));
        assertNull(LdapUtils.domainFromDn(null));
        assertNull(LdapUtils.domainFromDn(""));
    }

    @Test
    void testCommonNameFromDn() {
        assertEquals("Engineering", LdapUtils.commonNameFromDn("CN=Engineering,OU=Groups,DC=corp,DC=com"));
        assertEquals("Stone, Bob", LdapUtils.commonNameFromDn("CN=Stone\\, Bob,OU=People,DC=corp,DC=com"));
        assertNull(LdapUtils.commonNameFromDn("OU=Groups,DC=corp,DC=com"));
        assertNull(LdapUtils.commonNameFromDn(null));
    }

    @Test
    void testPrincipalKindOf() {
        assertEquals(PrincipalKind.GROUP, LdapUtils.principalKindOf(List.of("top", "group")));
        assertEquals(PrincipalKind.USER, LdapUtils.principalKindOf(List.of("top", "person", "organizationalPerson", "user")));
        assertEquals(PrincipalKind.COMPUTER, LdapUtils.principalKindOf(List.of("top", "person", "organizationalPerson", "user", "computer")));
        assertEquals(PrincipalKind.OTHER, LdapUtils.principalKindOf(List.of("top", "person", "organizationalPerson", "contact")));
        assertEquals(PrincipalKind.OTHER, LdapUtils.principalKindOf(List.of()));
        assertEquals(PrincipalKind.OTHER, LdapUtils.principalKindOf(null));
    }

    @Test
    void testObjectGuidToString() {
        byte[] guid = {
                0x67, 0x45, 0x23, 0x01, (byte) 0xab, (byte) 0x89, (byte) 0xef, (byte) 0xcd,
                0x01, 0x23, 0x45, 0x67, (byte) 0x89, (byte) 0xab, (byte) 0xcd, (byte) 0xef
        };

        assertEquals("01234567-89ab-cdef-0123-456789abcdef", LdapUtils.objectGuidToString(guid));
        assertNull(LdapUtils.objectGuidToString(new byte[4]));
        assertNull(LdapUtils.objectGuidToString(null));
    }

    @Test
    void testToLdapUrl() {
        assertEquals("ldap://dc01.corp.example.com", LdapUtils.toLdapUrl("dc01.corp.example.com"));
        assertEquals("ldaps://dc01:636", LdapUtils.toLdapUrl("ldaps://dc01:636"));
        assertNull(LdapUtils.toLdapUrl("  "));
        assertNull(LdapUtils.toLdapUrl(null));
    }
}
