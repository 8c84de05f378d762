package com.example.emobility.authz.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable conjunction of query constraints.
 *
 * <p>Combining two instances with {@link #and(FilterParams)} can only narrow the result:
 * ID-set constraints on the same parameter are intersected, and conflicting boolean
 * constraints turn the whole filter into one that matches nothing.
 */
public final class FilterParams {

    private static final FilterParams NONE = new FilterParams(Map.of(), Map.of(), false);

    private final Map<FilterParam, Set<String>> idSets;
    private final Map<FilterParam, Boolean> flags;
    private final boolean contradiction;

    private FilterParams(Map<FilterParam, Set<String>> idSets, Map<FilterParam, Boolean> flags, boolean contradiction) {
        this.idSets = idSets;
        this.flags = flags;
        this.contradiction = contradiction;
    }

    public static FilterParams none() {
        return NONE;
    }

    public static FilterParams of(FilterParam param, Collection<String> values) {
        if (param == FilterParam.ISSUER) {
            throw new IllegalArgumentException("ISSUER is a boolean parameter");
        }
        Map<FilterParam, Set<String>> sets = new EnumMap<>(FilterParam.class);
        sets.put(param, Collections.unmodifiableSet(new LinkedHashSet<>(values)));
        return new FilterParams(Collections.unmodifiableMap(sets), Map.of(), false);
    }

    public static FilterParams of(FilterParam param, String value) {
        return of(param, Set.of(value));
    }

    public static FilterParams issuer(boolean issuer) {
        Map<FilterParam, Boolean> f = new EnumMap<>(FilterParam.class);
        f.put(FilterParam.ISSUER, issuer);
        return new FilterParams(Map.of(), Collections.unmodifiableMap(f), false);
    }

    public FilterParams and(FilterParams other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        Map<FilterParam, Set<String>> sets = new EnumMap<>(FilterParam.class);
        sets.putAll(idSets);
        other.idSets.forEach((param, values) -> sets.merge(param, values, FilterParams::intersect));

        Map<FilterParam, Boolean> mergedFlags = new EnumMap<>(FilterParam.class);
        mergedFlags.putAll(flags);
        boolean conflict = contradiction || other.contradiction;
        for (Map.Entry<FilterParam, Boolean> entry : other.flags.entrySet()) {
            Boolean existing = mergedFlags.putIfAbsent(entry.getKey(), entry.getValue());
            if (existing != null && !existing.equals(entry.getValue())) {
                conflict = true;
            }
        }
        return new FilterParams(Collections.unmodifiableMap(sets), Collections.unmodifiableMap(mergedFlags), conflict);
    }

    private static Set<String> intersect(Set<String> left, Set<String> right) {
        Set<String> result = new LinkedHashSet<>(left);
        result.retainAll(right);
        return Collections.unmodifiableSet(result);
    }

    public Optional<Set<String>> ids(FilterParam param) {
        return Optional.ofNullable(idSets.get(param));
    }

    public Optional<Boolean> flag(FilterParam param) {
        return Optional.ofNullable(flags.get(param));
    }

    public Map<FilterParam, Set<String>> idSets() {
        return idSets;
    }

    public Map<FilterParam, Boolean> flags() {
        return flags;
    }

    public Set<FilterParam> params() {
        Set<FilterParam> all = new LinkedHashSet<>(idSets.keySet());
        all.addAll(flags.keySet());
        return all;
    }

    /**
     * True when the constraints cannot match any document (empty ID set or conflicting flags).
     */
    public boolean matchesNothing() {
        return contradiction || idSets.values().stream().anyMatch(Set::isEmpty);
    }

    public boolean isEmpty() {
        return idSets.isEmpty() && flags.isEmpty() && !contradiction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterParams that)) {
            return false;
        }
        return contradiction == that.contradiction && idSets.equals(that.idSets) && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return 31 * idSets.hashCode() + flags.hashCode() + (contradiction ? 1 : 0);
    }

    @Override
    public String toString() {
        return "FilterParams{ids=" + idSets + ", flags=" + flags + (contradiction ? ", contradiction" : "") + "}";
    }
}
