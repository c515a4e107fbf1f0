package com.pharmafinder.matcher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmafinder.matcher.model.CommuneRecord;
import com.pharmafinder.matcher.model.CommuneReferenceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the commune reference file (a JSON array of {@link CommuneReferenceEntry}) from any
 * Spring resource location.
 */
@Service
public class ReferenceDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ContentHashingService hashingService;
    private final String location;

    /**
     * Records parsed from one read of the source, with the SHA-256 of the raw bytes.
     */
    public record Snapshot(List<CommuneRecord> records, String contentHash) {
    }

    public ReferenceDataLoader(ResourceLoader resourceLoader,
                               ObjectMapper objectMapper,
                               ContentHashingService hashingService,
                               @Value("${matcher.reference-data.location:classpath:data/communes.json}") String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.hashingService = hashingService;
        this.location = location;
    }

    public String location() {
        return location;
    }

    /**
     * @throws DataUnavailableException when the source is missing, unreadable, malformed or empty
     */
    public Snapshot load() {
        byte[] raw = readRaw();
        return new Snapshot(parse(raw), hashingService.hash(raw));
    }

    byte[] readRaw() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DataUnavailableException("Commune reference data not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new DataUnavailableException("Failed to read commune reference data from " + location, e);
        }
    }

    List<CommuneRecord> parse(byte[] raw) {
        CommuneReferenceEntry[] entries;
        try {
            entries = objectMapper.readValue(raw, CommuneReferenceEntry[].class);
        } catch (IOException e) {
            throw new DataUnavailableException("Commune reference data at " + location + " is not valid JSON", e);
        }
        List<CommuneRecord> records = new ArrayList<>();
        if (entries != null) {
            for (CommuneReferenceEntry entry : entries) {
                if (entry == null || entry.getName() == null || entry.getName().isBlank()) {
                    logger.warn("Skipping reference entry without a name: {}", entry);
                    continue;
                }
                records.add(entry.toRecord());
            }
        }
        if (records.isEmpty()) {
            throw new DataUnavailableException("Commune reference data at " + location + " has no communes");
        }
        logger.info("Loaded {} communes from {}", records.size(), location);
        return List.copyOf(records);
    }
}
