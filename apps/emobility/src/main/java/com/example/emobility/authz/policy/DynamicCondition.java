package com.example.emobility.authz.policy;

import com.example.emobility.authz.assertion.DynamicAssertName;
import com.example.emobility.authz.filter.DynamicFilterName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Data-dependent part of a grant.
 *
 * <p>Both lists are conjunctions of groups; each group is a disjunction of alternatives.
 * {@code [[A], [B, C]]} reads "A and (B or C)".
 */
public record DynamicCondition(
        List<List<DynamicFilterName>> filters,
        List<List<DynamicAssertName>> asserts
) {
    public DynamicCondition {
        filters = copyGroups(filters);
        asserts = copyGroups(asserts);
    }

    /**
     * Each filter becomes its own mandatory group.
     */
    public static DynamicCondition filters(DynamicFilterName... names) {
        return new DynamicCondition(singletonGroups(names), List.of());
    }

    public static DynamicCondition anyOfAsserts(DynamicAssertName... names) {
        return new DynamicCondition(List.of(), List.of(List.of(names)));
    }

    public DynamicCondition andAsserts(DynamicAssertName... names) {
        List<List<DynamicAssertName>> groups = new ArrayList<>(asserts);
        groups.addAll(singletonGroups(names));
        return new DynamicCondition(filters, groups);
    }

    public boolean isEmpty() {
        return filters.isEmpty() && asserts.isEmpty();
    }

    @SafeVarargs
    private static <T> List<List<T>> singletonGroups(T... names) {
        return Arrays.stream(names).map(List::of).toList();
    }

    private static <T> List<List<T>> copyGroups(List<List<T>> groups) {
        if (groups == null) {
            return List.of();
        }
        for (List<T> group : groups) {
            if (group == null || group.isEmpty()) {
                throw new IllegalArgumentException("Condition groups must not be empty");
            }
        }
        return groups.stream().map(List::copyOf).toList();
    }
}
