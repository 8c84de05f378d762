package com.example.emobility.authz.policy;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import lombok.Builder;
import lombok.Singular;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Permission for a role to perform some actions on one resource kind.
 *
 * @param resource   resource kind
 * @param actions    actions covered by this grant
 * @param attributes fields the caller may see; empty means all fields
 * @param condition  optional data-dependent condition
 */
@Builder
public record Grant(
        Entity resource,
        @Singular Set<Action> actions,
        @Singular List<String> attributes,
        @Nullable DynamicCondition condition
) {
    public Grant {
        if (resource == null) {
            throw new IllegalArgumentException("Grant resource must be set");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("Grant on " + resource + " must name at least one action");
        }
        actions = Set.copyOf(actions);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        if (condition != null && condition.isEmpty()) {
            condition = null;
        }
    }

    public boolean isConditional() {
        return condition != null;
    }
}
