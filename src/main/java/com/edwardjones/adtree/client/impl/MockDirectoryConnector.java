package com.edwardjones.adtree.client.impl;

import com.edwardjones.adtree.client.DirectoryConnector;
import com.edwardjones.adtree.client.DirectoryMembershipSource;
import com.edwardjones.adtree.client.PrincipalKind;
import com.edwardjones.adtree.exception.DirectoryConnectionException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@Profile("test")
public class MockDirectoryConnector implements DirectoryConnector {

    private static final String DIRECTORY_FILE = "test-data/test-ad-directory.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public DirectoryMembershipSource connect(String server) {
        log.info("MOCK - Connecting to directory{}", server != null ? " on " + server : "");

        try {
            return loadDirectoryFromJsonFile();
        } catch (IOException e) {
            throw new DirectoryConnectionException("Could not load mock directory from " + DIRECTORY_FILE, e);
        }
    }

    private InMemoryMembershipSource loadDirectoryFromJsonFile() throws IOException {
        ClassPathResource resource = new ClassPathResource(DIRECTORY_FILE);
        List<Map<String, Object>> adObjects = objectMapper.readValue(
            resource.getInputStream(),
            new TypeReference<List<Map<String, Object>>>() {}
        );

        InMemoryMembershipSource directory = new InMemoryMembershipSource();
        for (Map<String, Object> adObject : adObjects) {
            InMemoryMembershipSource.Entry entry = convertAdDataToEntry(adObject);
            directory.add(entry);
            if (Boolean.TRUE.equals(adObject.get("Unreadable"))) {
                directory.markUnreadable(entry.distinguishedName());
            }
        }

        log.info("MOCK - Loaded {} directory objects from JSON file", adObjects.size());
        return directory;
    }

    private InMemoryMembershipSource.Entry convertAdDataToEntry(Map<String, Object> adObject) {
        String objectClass = (String) adObject.getOrDefault("ObjectClass", "");
        List<String> members = objectMapper.convertValue(adObject.get("Members"), new TypeReference<List<String>>() {});
        return new InMemoryMembershipSource.Entry(
            (String) adObject.get("DistinguishedName"),
            toKind(objectClass),
            (String) adObject.get("SamAccountName"),
            (String) adObject.get("Name"),
            (String) adObject.get("DisplayName"),
            (String) adObject.get("UserPrincipalName"),
            members
        );
    }

    private PrincipalKind toKind(String objectClass) {
        return switch (objectClass.toLowerCase(Locale.ROOT)) {
            case "group" -> PrincipalKind.GROUP;
            case "user" -> PrincipalKind.USER;
            case "computer" -> PrincipalKind.COMPUTER;
            default -> PrincipalKind.OTHER;
        };
    }
}
