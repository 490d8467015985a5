package org.moviegraph.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.moviegraph.configuration.SourceSpec;
import org.moviegraph.models.dto.RawRow;
import org.moviegraph.models.enums.KeyType;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a headed CSV extract into raw rows. Cell values are kept as strings; only the id column
 * is parsed, since every later stage keys on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvRawRowExtractor implements RawRowExtractor {

    private final ResourceLoader resourceLoader;

    @Override
    public boolean supports(String format) {
        return "csv".equalsIgnoreCase(format);
    }

    @Override
    public List<RawRow> extract(String relation, SourceSpec source) {
        if (!StringUtils.hasText(source.getLocation()) || !StringUtils.hasText(source.getIdColumn())) {
            throw new IllegalStateException("CSV source " + relation + " requires a location and an id column");
        }
        Resource resource = resourceLoader.getResource(source.getLocation());
        Charset charset = Charset.forName(source.getEncoding());

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(source.getDelimiter())
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .build();

        try (Reader reader = new InputStreamReader(resource.getInputStream(), charset);
             CSVParser parser = new CSVParser(reader, format)) {
            if (!parser.getHeaderMap().containsKey(source.getIdColumn())) {
                throw new IllegalStateException("CSV source " + relation + " has no column " + source.getIdColumn());
            }
            List<RawRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(new RawRow(relation, naturalId(relation, source, record), record.toMap()));
            }
            log.info("[extract] {}: {} rows from {}", relation, rows.size(), source.getLocation());
            return rows;
        } catch (IOException exception) {
            throw new IllegalStateException("Failed to read CSV source " + relation + ": " + exception.getMessage(), exception);
        }
    }

    private Object naturalId(String relation, SourceSpec source, CSVRecord record) {
        String value = record.isMapped(source.getIdColumn()) ? record.get(source.getIdColumn()) : null;
        Object id;
        try {
            id = KeyType.INTEGER.normalize(value);
        } catch (IllegalArgumentException exception) {
            throw new IllegalStateException("Line " + record.getRecordNumber() + " of " + relation
                    + " has a non-numeric " + source.getIdColumn() + " '" + value + "'", exception);
        }
        if (id == null) {
            throw new IllegalStateException("Line " + record.getRecordNumber() + " of " + relation
                    + " has no " + source.getIdColumn());
        }
        return id;
    }
}
