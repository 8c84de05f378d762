package com.example.emobility.authz.resource;

import org.springframework.lang.Nullable;

/**
 * Where a {@link com.example.emobility.authz.model.FilterParam} lives in a resource's documents.
 *
 * <p>A mapping either targets a field of the document itself, or a field of a related
 * collection joined through a lookup (e.g. users filtered by the sites they are assigned to).
 */
public record FieldMapping(
        String field,
        @Nullable String lookupCollection,
        @Nullable String localField,
        @Nullable String foreignField
) {
    public static FieldMapping direct(String field) {
        return new FieldMapping(field, null, null, null);
    }

    public static FieldMapping viaLookup(String collection, String localField, String foreignField, String field) {
        return new FieldMapping(field, collection, localField, foreignField);
    }

    public boolean requiresLookup() {
        return lookupCollection != null;
    }

    /**
     * Path to match on once the lookup result is embedded under the related collection's name.
     */
    public String matchPath() {
        return requiresLookup() ? lookupCollection + "." + field : field;
    }
}
