package org.moviegraph.service.ingestion;

import lombok.RequiredArgsConstructor;
import org.moviegraph.configuration.SourceSpec;
import org.moviegraph.models.dto.RawRow;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RawDataService {

    public static final String INFOS = "infos";
    public static final String CREDITS = "credits";

    private final List<RawRowExtractor> extractors;

    public List<RawRow> read(String relation, SourceSpec source) {
        return resolveExtractor(source.getFormat()).extract(relation, source);
    }

    private RawRowExtractor resolveExtractor(String format) {
        return extractors.stream()
                .filter(extractor -> extractor.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported format: " + format));
    }
}
