package com.example.emobility.storage.mongo;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.resource.FieldMapping;
import com.example.emobility.authz.resource.ResourceType;
import com.example.emobility.security.context.Tenant;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.TypedAggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translates {@link FilterParams} into MongoDB queries for a given resource.
 *
 * <p>Every parameter becomes a constraint; a parameter the resource does not map is rejected
 * so that a filter can never silently widen a query.
 */
@Component
public class MongoQueryFactory {

    private static final String ID_FIELD = "_id";

    public Optional<Criteria> criteria(ResourceType<?> resource, FilterParams filters) {
        if (filters.matchesNothing()) {
            return Optional.of(Criteria.where(ID_FIELD).in(List.of()));
        }
        List<Criteria> parts = new ArrayList<>();
        for (Map.Entry<FilterParam, Set<String>> entry : filters.idSets().entrySet()) {
            FieldMapping mapping = mappingOf(resource, entry.getKey());
            parts.add(Criteria.where(mapping.matchPath()).in(values(resource, mapping, entry.getValue())));
        }
        for (Map.Entry<FilterParam, Boolean> entry : filters.flags().entrySet()) {
            FieldMapping mapping = mappingOf(resource, entry.getKey());
            parts.add(Criteria.where(mapping.matchPath()).is(entry.getValue()));
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        if (parts.size() == 1) {
            return Optional.of(parts.get(0));
        }
        return Optional.of(new Criteria().andOperator(parts));
    }

    public boolean requiresLookup(ResourceType<?> resource, FilterParams filters) {
        return filters.params().stream()
                .map(param -> mappingOf(resource, param))
                .anyMatch(FieldMapping::requiresLookup);
    }

    public Query query(ResourceType<?> resource, FilterParams filters, List<String> projection, int limit) {
        Query query = criteria(resource, filters).map(Query::new).orElseGet(Query::new);
        if (!projection.isEmpty()) {
            query.fields().include(toStorageFields(projection).toArray(String[]::new));
        }
        if (limit > 0) {
            query.limit(limit);
        }
        return query;
    }

    /**
     * Join pipeline for filters mapped through another collection. The aggregation is typed on the
     * entity class so that identifiers are converted the same way as in {@link #query}.
     */
    public <T extends AuthorizableEntity> TypedAggregation<T> aggregation(Tenant tenant, ResourceType<T> resource,
            FilterParams filters, List<String> projection, int limit) {
        List<AggregationOperation> operations = new ArrayList<>();

        Map<String, FieldMapping> lookups = new LinkedHashMap<>();
        filters.params().stream()
                .map(param -> mappingOf(resource, param))
                .filter(FieldMapping::requiresLookup)
                .forEach(mapping -> lookups.putIfAbsent(mapping.lookupCollection(), mapping));
        lookups.values().forEach(mapping -> operations.add(Aggregation.lookup(
                TenantCollections.name(tenant, mapping.lookupCollection()),
                mapping.localField(),
                mapping.foreignField(),
                mapping.lookupCollection())));

        criteria(resource, filters).ifPresent(criteria -> operations.add(Aggregation.match(criteria)));

        List<String> fields = toStorageFields(projection).stream()
                .filter(field -> !ID_FIELD.equals(field))
                .toList();
        if (!projection.isEmpty() && !fields.isEmpty()) {
            operations.add(Aggregation.project(fields.toArray(String[]::new)));
        }
        if (limit > 0) {
            operations.add(Aggregation.limit(limit));
        }
        return Aggregation.newAggregation(resource.getType(), operations);
    }

    private static FieldMapping mappingOf(ResourceType<?> resource, FilterParam param) {
        return resource.mapping(param).orElseThrow(() -> new IllegalArgumentException(
                "Filter parameter " + param + " is not supported for " + resource.getEntity()));
    }

    private static List<Object> values(ResourceType<?> resource, FieldMapping mapping, Set<String> raw) {
        boolean identifier = !mapping.requiresLookup() && ID_FIELD.equals(mapping.field());
        return raw.stream()
                .map(value -> identifier ? resource.convertId(value) : value)
                .toList();
    }

    private static List<String> toStorageFields(List<String> projection) {
        return projection.stream()
                .map(field -> "id".equals(field) ? ID_FIELD : field)
                .distinct()
                .toList();
    }
}
