package com.edwardjones.adtree.util;

import com.edwardjones.adtree.client.PrincipalKind;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Collection;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for Active Directory distinguished names and attribute values.
 * Centralizes DN parsing logic to ensure consistency across the application.
 */
@Slf4j
public final class LdapUtils {

    private static final Pattern DOMAIN_COMPONENT_PATTERN = Pattern.compile("(?:^|,)\\s*DC=([^,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMON_NAME_PATTERN = Pattern.compile("^CN=((?:\\\\.|[^,])+)", Pattern.CASE_INSENSITIVE);

    private LdapUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the DNS domain name from the DC components of a distinguished name.
     *
     * @param dn the distinguished name string
     * @return e.g. {@code corp.example.com}, or null if the DN carries no DC components
     */
    public static String domainFromDn(String dn) {
        if (dn == null || dn.isEmpty()) {
            return null;
        }

        StringJoiner domain = new StringJoiner(".");
        Matcher matcher = DOMAIN_COMPONENT_PATTERN.matcher(dn);
        while (matcher.find()) {
            domain.add(matcher.group(1).trim());
        }
        return domain.length() > 0 ? domain.toString() : null;
    }

    /**
     * Parse the leading CN value from a distinguished name, unescaping it.
     *
     * @param dn the distinguished name string
     * @return the common name, or null if the DN does not start with CN=
     */
    public static String commonNameFromDn(String dn) {
        if (dn == null || dn.isEmpty()) {
            return null;
        }

        Matcher matcher = COMMON_NAME_PATTERN.matcher(dn);
        if (matcher.find()) {
            return matcher.group(1).replaceAll("\\\\(.)", "$1");
        }

        log.debug("Could not parse CN from DN: {}", dn);
        return null;
    }

    /**
     * Maps the objectClass values of an entry to the kind of principal it represents.
     * Computer objects also carry the user class, so computer is checked first.
     */
    public static PrincipalKind principalKindOf(Collection<String> objectClasses) {
        if (objectClasses == null || objectClasses.isEmpty()) {
            return PrincipalKind.OTHER;
        }

        boolean user = false;
        boolean group = false;
        for (String objectClass : objectClasses) {
            switch (objectClass.toLowerCase(Locale.ROOT)) {
                case "computer" -> {
                    return PrincipalKind.COMPUTER;
                }
                case "group" -> group = true;
                case "user" -> user = true;
                default -> { }
            }
        }

        if (group) return PrincipalKind.GROUP;
        if (user) return PrincipalKind.USER;
        return PrincipalKind.OTHER;
    }

    /**
     * Converts the binary objectGUID attribute to its canonical string form.
     * AD stores the first three fields little-endian.
     */
    public static String objectGuidToString(byte[] guid) {
        if (guid == null || guid.length != 16) {
            return null;
        }

        ByteBuffer buffer = ByteBuffer.wrap(guid).order(ByteOrder.LITTLE_ENDIAN);
        long timeLow = buffer.getInt() & 0xFFFFFFFFL;
        long timeMid = buffer.getShort() & 0xFFFFL;
        long timeHigh = buffer.getShort() & 0xFFFFL;
        buffer.order(ByteOrder.BIG_ENDIAN);
        long low = buffer.getLong();

        long high = (timeLow << 32) | (timeMid << 16) | timeHigh;
        return new UUID(high, low).toString();
    }

    /**
     * Turns a server argument into an LDAP URL. Values that already carry a scheme are kept.
     */
    public static String toLdapUrl(String server) {
        if (server == null || server.isBlank()) {
            return null;
        }
        String trimmed = server.trim();
        return trimmed.contains("://") ? trimmed : "ldap://" + trimmed;
    }
}
