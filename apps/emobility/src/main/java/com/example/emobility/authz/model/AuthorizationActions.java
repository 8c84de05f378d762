package com.example.emobility.authz.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-entity capability flags ({@code canRead}, {@code canUpdate}, ...) computed after a fetch.
 * Flags are never persisted; they only travel with the response.
 */
public final class AuthorizationActions {

    private final Map<Action, Boolean> flags;

    public AuthorizationActions(Map<Action, Boolean> flags) {
        this.flags = flags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(flags));
    }

    public boolean can(Action action) {
        return Boolean.TRUE.equals(flags.get(action));
    }

    @JsonAnyGetter
    public Map<String, Boolean> toFlags() {
        Map<String, Boolean> json = new LinkedHashMap<>();
        flags.forEach((action, allowed) -> json.put(action.getFlagName(), allowed));
        return json;
    }

    @Override
    public String toString() {
        return toFlags().toString();
    }
}
