package com.edwardjones.adtree.config;

import org.springframework.ldap.core.support.LdapContextSource;

import java.util.Map;

/**
 * Connection settings shared by the default context source and by per-server connections.
 */
public record LdapSettings(
    String url,
    String base,
    String username,
    String password,
    int timeLimitSeconds
) {

    // Returned as byte[] rather than a garbled string.
    private static final String BINARY_ATTRIBUTES = "objectGUID objectSid";

    public LdapContextSource newContextSource(String ldapUrl) {
        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(ldapUrl != null ? ldapUrl : url);
        contextSource.setBase(base);
        if (username == null || username.isBlank()) {
            contextSource.setAnonymousReadOnly(true);
        } else {
            contextSource.setUserDn(username);
            contextSource.setPassword(password);
        }
        contextSource.setReferral("follow");
        contextSource.setBaseEnvironmentProperties(Map.<String, Object>of("java.naming.ldap.attributes.binary", BINARY_ATTRIBUTES));
        contextSource.afterPropertiesSet();
        return contextSource;
    }

    public int timeLimitMillis() {
        return timeLimitSeconds * 1000;
    }
}
