package com.example.emobility.authz.policy;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static role to grant table.
 *
 * <p>Each role's own grants come first, then its inheritance chain. The first grant
 * covering the (resource, action) pair wins. The table is flattened once at construction,
 * so lookups never walk the chain. Unknown roles and uncovered pairs resolve to no grant,
 * which callers treat as deny.
 */
@Slf4j
public class AuthorizationDefinition {

    private final Map<Role, Map<Entity, Map<Action, Grant>>> resolved;

    public AuthorizationDefinition(Collection<RoleDefinition> definitions) {
        Map<Role, RoleDefinition> byRole = new EnumMap<>(Role.class);
        for (RoleDefinition definition : definitions) {
            if (byRole.put(definition.role(), definition) != null) {
                throw new IllegalArgumentException("Role " + definition.role() + " is defined twice");
            }
        }
        byRole.values().forEach(definition -> checkInheritance(definition, byRole));
        this.resolved = flatten(byRole);

        log.info("Authorization definition loaded with {} roles and {} grants",
                byRole.size(), byRole.values().stream().mapToInt(d -> d.grants().size()).sum());
    }

    public Optional<Grant> resolveGrant(Role role, Entity entity, Action action) {
        if (role == null || entity == null || action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(resolved.getOrDefault(role, Map.of())
                .getOrDefault(entity, Map.of())
                .get(action));
    }

    private static Map<Role, Map<Entity, Map<Action, Grant>>> flatten(Map<Role, RoleDefinition> byRole) {
        Map<Role, Map<Entity, Map<Action, Grant>>> table = new EnumMap<>(Role.class);
        for (Role role : byRole.keySet()) {
            Map<Entity, Map<Action, Grant>> byEntity = new EnumMap<>(Entity.class);
            RoleDefinition definition = byRole.get(role);
            while (definition != null) {
                for (Grant grant : definition.grants()) {
                    Map<Action, Grant> byAction = byEntity.computeIfAbsent(grant.resource(),
                            e -> new EnumMap<>(Action.class));
                    grant.actions().forEach(action -> byAction.putIfAbsent(action, grant));
                }
                definition = definition.inherits() == null ? null : byRole.get(definition.inherits());
            }
            table.put(role, byEntity);
        }
        return table;
    }

    private static void checkInheritance(RoleDefinition start, Map<Role, RoleDefinition> byRole) {
        Set<Role> seen = new HashSet<>();
        RoleDefinition current = start;
        while (current != null) {
            if (!seen.add(current.role())) {
                throw new IllegalArgumentException("Role inheritance cycle detected at " + current.role());
            }
            Role parent = current.inherits();
            if (parent != null && !byRole.containsKey(parent)) {
                throw new IllegalArgumentException(current.role() + " inherits undefined role " + parent);
            }
            current = parent == null ? null : byRole.get(parent);
        }
    }
}
