package org.moviegraph.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.models.dto.RawRow;
import org.moviegraph.models.enums.ProductionStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scalar cleanup of raw values. Zeros that stand for "unknown" become null, blank text becomes
 * null, and deprecated language codes are replaced.
 */
@Slf4j
@Component
public class RawValueCleaner {

    public static final String NO_CHARACTER_NAME = "no character name";

    private static final String ZERO_DATE = "0000-00-00";

    private final Map<String, String> languageCodeAliases;

    public RawValueCleaner(BuildProperties properties) {
        this.languageCodeAliases = Map.copyOf(properties.getLanguageCodeAliases());
    }

    /**
     * Column values of movie_infos for one raw movie row, the title included.
     */
    public Map<String, Object> movieInfo(RawRow row) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("title", text(row.value("title")));
        values.put("release_date", releaseDate(row));
        values.put("runtime", zeroToNull(toInteger(row, "runtime")));
        values.put("overview", text(row.value("overview")));
        values.put("tagline", text(row.value("tagline")));
        values.put("budget", zeroToNull(toLong(row, "budget")));
        values.put("revenue", zeroToNull(toLong(row, "revenue")));
        values.put("homepage", text(row.value("homepage")));
        values.put("original_language_id", languageCode(row.value("original_language")));
        values.put("original_title", text(row.value("original_title")));
        values.put("prod_status_id", productionStatus(row));
        return values;
    }

    public Map<String, Object> movieRating(RawRow row) {
        Integer voteCount = toInteger(row, "vote_count");
        Double voteAverage = toDouble(row, "vote_average");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("popularity", toDouble(row, "popularity"));
        // an average over zero votes is a placeholder, not a rating
        values.put("vote_average", voteCount != null && voteCount == 0 ? null : voteAverage);
        values.put("vote_count", voteCount);
        return values;
    }

    public String languageCode(String code) {
        String trimmed = text(code);
        if (trimmed == null) {
            return null;
        }
        return languageCodeAliases.getOrDefault(trimmed, trimmed);
    }

    public String characterName(String character) {
        String trimmed = text(character);
        return trimmed == null ? NO_CHARACTER_NAME : character;
    }

    /**
     * Trimmed text, or {@code null} when blank.
     */
    public String text(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return value.trim();
    }

    private LocalDate releaseDate(RawRow row) {
        String value = text(row.value("release_date"));
        if (value == null || ZERO_DATE.equals(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException exception) {
            log.warn("Movie {} has unreadable release_date '{}', storing null", row.naturalId(), value);
            return null;
        }
    }

    private Integer productionStatus(RawRow row) {
        String status = text(row.value("status"));
        if (status == null) {
            return null;
        }
        return ProductionStatus.fromLabel(status)
                .map(ProductionStatus::getId)
                .orElseGet(() -> {
                    log.warn("Movie {} has unknown status '{}', storing null", row.naturalId(), status);
                    return null;
                });
    }

    private Integer toInteger(RawRow row, String column) {
        BigDecimal number = toNumber(row, column);
        return number == null ? null : number.intValue();
    }

    private Long toLong(RawRow row, String column) {
        BigDecimal number = toNumber(row, column);
        return number == null ? null : number.longValue();
    }

    private Double toDouble(RawRow row, String column) {
        BigDecimal number = toNumber(row, column);
        return number == null ? null : number.doubleValue();
    }

    private BigDecimal toNumber(RawRow row, String column) {
        String value = text(row.value(column));
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException exception) {
            log.warn("Row {} of {} has non-numeric {} '{}', storing null", row.naturalId(), row.relation(), column, value);
            return null;
        }
    }

    private static <N extends Number> N zeroToNull(N value) {
        return value == null || value.longValue() == 0L ? null : value;
    }
}
