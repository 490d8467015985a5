package org.moviegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "moviegraph.build")
public class BuildProperties {

    @Valid
    @NotNull
    private SourceSpec infos = SourceSpec.builder()
            .location("file:data/tmdb_5000_movies.csv")
            .idColumn("id")
            .build();

    @Valid
    @NotNull
    private SourceSpec credits = SourceSpec.builder()
            .location("file:data/tmdb_5000_credits.csv")
            .idColumn("movie_id")
            .build();

    /** Entity table -> resource of a catalog (id,name,extra...) that replaces names seen in the raw data. */
    private Map<String, String> catalogs = new LinkedHashMap<>();

    /** Entity table -> resource of an equivalence map (superseded_id,canonical_id). */
    private Map<String, String> equivalences = new LinkedHashMap<>();

    /** Deprecated or non-standard language codes and their replacement. */
    private Map<String, String> languageCodeAliases = new LinkedHashMap<>(Map.of("cn", "zh"));

    /** Entity table referenced by movie_infos.original_language_id; blank for no constraint. */
    private String originalLanguageTable = "languages";

    /** Optional schema qualifier for every output table. */
    private String targetSchema;

    @Valid
    private List<NestedEntitySpec> nestedEntities = new ArrayList<>();
}
