package org.moviegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location and shape of one raw extract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceSpec {
    /** Spring resource location (file:, classpath:). Required. */
    @NotBlank
    private String location;
    /** Column holding the natural id of each row. Required. */
    @NotBlank
    private String idColumn;
    @Builder.Default
    private String format = "csv";
    @Builder.Default
    private String delimiter = ",";
    @Builder.Default
    private String encoding = "UTF-8";
}
