package com.cgi.schemasense.pattern;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat pattern record as delivered by a pattern source.
 * Only {@code pattern}, {@code pii_type} and {@code confidence} are required; the remaining
 * fields refine how the record is interpreted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternRecord {
    private String pattern;

    @JsonProperty("pii_type")
    private String piiType;

    /**
     * Regulation id the pattern is specific to; blank for general patterns.
     */
    private String regulation;

    private Double confidence;

    /**
     * exact, alias, fuzzy, regex or context. Inferred from the pattern text when absent.
     */
    private String kind;

    private Double weight;

    private String risk;

    @JsonProperty("alias_of")
    private String aliasOf;

    /**
     * Table domain a context pattern applies to.
     */
    private String domain;
}
