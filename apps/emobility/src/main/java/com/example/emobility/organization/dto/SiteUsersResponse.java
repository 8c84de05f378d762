package com.example.emobility.organization.dto;

public record SiteUsersResponse(
        String siteId,
        int requested,
        long changed
) {}
