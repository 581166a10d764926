package com.edwardjones.adtree.client.impl.production;

import com.edwardjones.adtree.client.DirectoryConnector;
import com.edwardjones.adtree.client.DirectoryMembershipSource;
import com.edwardjones.adtree.config.LdapSettings;
import com.edwardjones.adtree.exception.DirectoryConnectionException;
import com.edwardjones.adtree.util.LdapUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.ldap.NamingException;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.stereotype.Service;

import javax.naming.directory.DirContext;
import java.util.Arrays;

import static org.springframework.ldap.support.LdapUtils.closeContext;

/**
 * Connects to Active Directory over LDAP, either the configured default directory or a
 * server named by the caller.
 */
@Slf4j
@Service
@Profile("!test")
@RequiredArgsConstructor
public class LdapDirectoryConnector implements DirectoryConnector {

    private final LdapSettings ldapSettings;
    private final LdapContextSource contextSource;
    private final LdapTemplate ldapTemplate;

    @Override
    public DirectoryMembershipSource connect(String server) {
        String serverUrl = LdapUtils.toLdapUrl(server);

        LdapContextSource source;
        LdapTemplate template;
        try {
            source = serverUrl == null ? contextSource : ldapSettings.newContextSource(serverUrl);
            template = serverUrl == null ? ldapTemplate : new LdapTemplate(source);
        } catch (RuntimeException e) {
            throw new DirectoryConnectionException("Invalid directory server '" + server + "'", e);
        }

        verifyConnection(source);
        return new LdapMembershipSource(template, source.getBaseLdapName(), ldapSettings.timeLimitMillis());
    }

    private void verifyConnection(LdapContextSource source) {
        String urls = Arrays.toString(source.getUrls());
        log.info("Connecting to directory at {}", urls);

        DirContext context = null;
        try {
            context = source.getReadOnlyContext();
        } catch (NamingException e) {
            log.error("Unable to connect to directory at {}: {}", urls, e.getMessage());
            throw new DirectoryConnectionException("Unable to connect to directory at " + urls, e);
        } finally {
            closeContext(context);
        }
    }
}
