package com.example.emobility.authz.filter;

import com.example.emobility.authz.model.FilterParams;

/**
 * Result of applying one dynamic filter.
 *
 * @param params      constraints to AND into the storage query
 * @param satisfiable false when the filter proves the user can reach nothing
 * @param reason      short explanation, logged when unsatisfiable
 */
public record FilterFragment(FilterParams params, boolean satisfiable, String reason) {

    public static FilterFragment of(FilterParams params) {
        return new FilterFragment(params, true, "");
    }

    public static FilterFragment unsatisfiable(String reason) {
        return new FilterFragment(FilterParams.none(), false, reason);
    }
}
