package com.example.emobility.authz.resource;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.FilterParam;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Describes how one kind of entity is stored and authorized: its collection, how filter
 * parameters map onto its fields, which capability flags it exposes and which hints it
 * gives to dynamic filters.
 */
@Getter
@Builder
public final class ResourceType<T extends AuthorizableEntity> {

    private final Entity entity;
    private final Class<T> type;
    private final String displayName;
    private final String collection;
    @Builder.Default
    private final boolean tenantScoped = true;
    @Builder.Default
    private final boolean issuerChecked = true;
    @Builder.Default
    private final Function<String, Object> idConverter = id -> id;
    @Singular("field")
    private final Map<FilterParam, FieldMapping> fields;
    @Singular("flag")
    private final Set<Action> flaggedActions;
    @Singular
    private final List<String> requiredFields;
    @Builder.Default
    private final Function<T, AuthorizationContext> contextExtractor = e -> AuthorizationContext.empty();
    @Builder.Default
    private final Function<String, AuthorizationContext> idHint = id -> AuthorizationContext.empty();
    @Builder.Default
    private final Predicate<T> deletedCheck = e -> false;

    public Optional<FieldMapping> mapping(FilterParam param) {
        return Optional.ofNullable(fields.get(param));
    }

    /**
     * Convert a raw ID into the stored ID type.
     *
     * @throws IllegalArgumentException when the ID has the wrong shape for this resource
     */
    public Object convertId(String id) {
        return idConverter.apply(id);
    }

    public AuthorizationContext contextOf(T entity) {
        return contextExtractor.apply(entity);
    }

    /**
     * Hint known from the requested ID alone, before anything is fetched.
     */
    public AuthorizationContext hintForId(String id) {
        return idHint.apply(id);
    }

    public boolean isLogicallyDeleted(T entity) {
        return deletedCheck.test(entity);
    }

    /**
     * Fields to load for the given granted attributes. An empty result means "all fields".
     * The ID and the fields needed to compute flags are always included.
     */
    public List<String> projection(List<String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return List.of();
        }
        Set<String> fieldsToLoad = new LinkedHashSet<>();
        fieldsToLoad.add("id");
        fieldsToLoad.addAll(attributes);
        fieldsToLoad.addAll(requiredFields);
        return List.copyOf(fieldsToLoad);
    }

    @Override
    public String toString() {
        return "ResourceType{" + entity + "}";
    }
}
