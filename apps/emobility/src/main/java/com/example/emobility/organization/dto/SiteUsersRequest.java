package com.example.emobility.organization.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SiteUsersRequest(
        @NotEmpty(message = "userIds must not be empty")
        List<String> userIds
) {}
