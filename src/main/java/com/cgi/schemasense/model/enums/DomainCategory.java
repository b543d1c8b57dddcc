package com.cgi.schemasense.model.enums;

/**
 * Domain a table belongs to, inferred from its column vocabulary.
 * Declaration order goes from the narrowest domain to the broadest; ties are broken
 * in favor of the earlier constant.
 */
public enum DomainCategory {
    HEALTHCARE,
    FINANCIAL,
    EDUCATION,
    BUSINESS,
    GENERAL
}
