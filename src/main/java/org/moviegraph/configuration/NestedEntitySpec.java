package org.moviegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.moviegraph.models.enums.KeyType;

/**
 * One nested list field of the movie relation that becomes an entity table plus a movie link
 * table. Declared under {@code moviegraph.build.nested-entities} in YAML.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NestedEntitySpec {
    /** Column of the raw movie relation holding the nested list (e.g. production_companies). */
    @NotBlank
    private String sourceField;
    /** Output entity table (e.g. prod_companies). */
    @NotBlank
    private String entityTable;
    /** Output link table (e.g. movie_prod_companies). */
    @NotBlank
    private String linkTable;
    /** Prefix of the output columns: {prefix}_id, {prefix}_name. */
    @NotBlank
    private String columnPrefix;
    /** Sub-field of each nested element holding its natural id (e.g. id, iso_3166_1). */
    @NotBlank
    private String keyPath;
    /** How the natural id is typed and whether it is remapped to a surrogate. */
    @NotNull
    private KeyType keyType;
    /** Optional. Apply the language code aliases to the natural ids of this field. */
    private boolean languageCodes;
    /** Optional. Width of the name column, 255 when omitted. */
    private Integer nameLength;
}
