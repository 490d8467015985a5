package org.moviegraph.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.models.dto.EquivalencePair;
import org.moviegraph.models.dto.ReferenceData;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the versioned reference inputs named in {@link BuildProperties}: catalogs
 * ({@code id,name[,extra...]}) and equivalence maps ({@code superseded_id,canonical_id}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceDataLoader {

    static final String ID = "id";
    static final String NAME = "name";
    static final String SUPERSEDED_ID = "superseded_id";
    static final String CANONICAL_ID = "canonical_id";

    private final ResourceLoader resourceLoader;
    private final BuildProperties properties;

    public ReferenceData load() {
        Map<String, List<ReferenceData.CatalogEntry>> catalogs = new LinkedHashMap<>();
        properties.getCatalogs().forEach((table, location) -> catalogs.put(table, readCatalog(table, location)));

        Map<String, List<EquivalencePair>> equivalences = new LinkedHashMap<>();
        properties.getEquivalences().forEach((table, location) -> equivalences.put(table, readEquivalences(table, location)));
        return new ReferenceData(catalogs, equivalences);
    }

    private List<ReferenceData.CatalogEntry> readCatalog(String table, String location) {
        List<ReferenceData.CatalogEntry> entries = new ArrayList<>();
        for (CSVRecord record : read(location, ID, NAME)) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            record.toMap().forEach((column, value) -> {
                if (!ID.equals(column) && !NAME.equals(column)) {
                    attributes.put(column, StringUtils.hasText(value) ? value.trim() : null);
                }
            });
            entries.add(new ReferenceData.CatalogEntry(record.get(ID).trim(), record.get(NAME).trim(), attributes));
        }
        log.info("[reference] catalog for {}: {} entries from {}", table, entries.size(), location);
        return entries;
    }

    private List<EquivalencePair> readEquivalences(String table, String location) {
        List<EquivalencePair> pairs = new ArrayList<>();
        for (CSVRecord record : read(location, SUPERSEDED_ID, CANONICAL_ID)) {
            try {
                pairs.add(new EquivalencePair(record.get(SUPERSEDED_ID).trim(), record.get(CANONICAL_ID).trim()));
            } catch (IllegalArgumentException exception) {
                throw new IllegalStateException("Line " + record.getRecordNumber() + " of " + location
                        + ": " + exception.getMessage(), exception);
            }
        }
        log.info("[reference] equivalence map for {}: {} pairs from {}", table, pairs.size(), location);
        return pairs;
    }

    private List<CSVRecord> read(String location, String... requiredColumns) {
        Resource resource = resourceLoader.getResource(location);
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {
            for (String column : requiredColumns) {
                if (!parser.getHeaderMap().containsKey(column)) {
                    throw new IllegalStateException("Reference file " + location + " has no column " + column);
                }
            }
            return parser.getRecords();
        } catch (IOException exception) {
            throw new IllegalStateException("Failed to read reference file " + location + ": " + exception.getMessage(), exception);
        }
    }
}
