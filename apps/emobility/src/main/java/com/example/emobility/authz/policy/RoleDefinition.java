package com.example.emobility.authz.policy;

import com.example.emobility.authz.model.Role;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Grants owned by one role, optionally inheriting everything from a parent role.
 * Own grants always take precedence over inherited ones.
 */
public record RoleDefinition(Role role, List<Grant> grants, @Nullable Role inherits) {

    public RoleDefinition {
        grants = List.copyOf(grants);
    }

    public static Builder of(Role role) {
        return new Builder(role);
    }

    public static final class Builder {
        private final Role role;
        private final List<Grant> grants = new ArrayList<>();
        private Role inherits;

        private Builder(Role role) {
            this.role = role;
        }

        public Builder grant(Grant grant) {
            grants.add(grant);
            return this;
        }

        public Builder inherits(Role parent) {
            this.inherits = parent;
            return this;
        }

        public RoleDefinition build() {
            return new RoleDefinition(role, grants, inherits);
        }
    }
}
