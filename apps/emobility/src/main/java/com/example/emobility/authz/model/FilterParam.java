package com.example.emobility.authz.model;

/**
 * Semantic query parameters produced by dynamic filters or supplied by callers.
 * Each resource type maps them onto its own storage fields.
 */
public enum FilterParam {
    IDS,
    SITE_IDS,
    COMPANY_IDS,
    USER_IDS,
    SITE_AREA_IDS,
    VISUAL_IDS,
    ISSUER
}
