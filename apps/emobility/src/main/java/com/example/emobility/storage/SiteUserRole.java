package com.example.emobility.storage;

/**
 * Which site assignments to consider when resolving a user's sites.
 */
public enum SiteUserRole {
    ANY,
    ADMIN,
    OWNER
}
