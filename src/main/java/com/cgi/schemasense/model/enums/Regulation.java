package com.cgi.schemasense.model.enums;

import com.cgi.schemasense.exception.ClassificationInputException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Compliance regimes a sensitive field can fall under.
 */
public enum Regulation {
    HIPAA("HIPAA"),
    GDPR("GDPR"),
    CCPA("CCPA"),
    PCI_DSS("PCI-DSS");

    private final String id;

    Regulation(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Resolves a regulation from its external identifier.
     * Accepts both "PCI-DSS" and "PCI_DSS", case-insensitive.
     *
     * @param id Regulation identifier
     * @return The matching regulation
     * @throws ClassificationInputException if the identifier is unknown
     */
    @JsonCreator
    public static Regulation fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new ClassificationInputException("Regulation id must not be blank");
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        for (Regulation regulation : values()) {
            if (regulation.id.equals(normalized)) {
                return regulation;
            }
        }
        throw new ClassificationInputException("Unknown regulation id: " + id);
    }
}
