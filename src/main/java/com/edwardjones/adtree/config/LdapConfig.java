package com.edwardjones.adtree.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.LdapContextSource;

@Configuration
@Profile("!test")
public class LdapConfig {

    @Value("${app.client.ldap.url}")
    private String ldapUrl;

    @Value("${app.client.ldap.base:}")
    private String ldapBase;

    @Value("${app.client.ldap.username:}")
    private String ldapUsername;

    @Value("${app.client.ldap.password:}")
    private String ldapPassword;

    @Value("${app.client.ldap.time-limit-seconds:30}")
    private int timeLimitSeconds;

    @Bean
    public LdapSettings ldapSettings() {
        return new LdapSettings(ldapUrl, ldapBase, ldapUsername, ldapPassword, timeLimitSeconds);
    }

    @Bean
    public LdapContextSource contextSource() {
        return ldapSettings().newContextSource(null);
    }

    @Bean
    public LdapTemplate ldapTemplate() {
        return new LdapTemplate(contextSource());
    }
}
