package com.example.emobility.security.context;

/**
 * Tenant addressed by the request together with the authenticated user.
 */
public record CallerContext(Tenant tenant, UserToken user) {
}
