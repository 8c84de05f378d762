package com.example.emobility.authz.datasource;

public enum DataSourceName {
    ASSIGNED_SITES_COMPANIES,
    SITES_ADMIN,
    SITES_OWNER,
    ASSIGNED_SITES,
    OWN_USER
}
