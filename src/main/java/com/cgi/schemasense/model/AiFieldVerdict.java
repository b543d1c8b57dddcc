package com.cgi.schemasense.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field verdict returned by the AI collaborator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AiFieldVerdict {
    @JsonProperty("field_ref")
    private String fieldRef;

    @JsonProperty("pii_type")
    private String piiType;

    private double confidence;

    private String regulation;
}
