package org.moviegraph.service.ingestion;

import org.moviegraph.configuration.SourceSpec;
import org.moviegraph.models.dto.RawRow;

import java.util.List;

public interface RawRowExtractor {

    boolean supports(String format);

    List<RawRow> extract(String relation, SourceSpec source);
}
