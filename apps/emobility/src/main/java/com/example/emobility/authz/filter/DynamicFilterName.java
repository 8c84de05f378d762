package com.example.emobility.authz.filter;

public enum DynamicFilterName {
    ASSIGNED_SITES_COMPANIES,
    SITES_ADMIN,
    SITES_OWNER,
    ASSIGNED_SITES,
    OWN_USER,
    LOCAL_ISSUER
}
