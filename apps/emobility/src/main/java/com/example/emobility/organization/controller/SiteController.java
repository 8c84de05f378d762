package com.example.emobility.organization.controller;

import com.example.emobility.model.Site;
import com.example.emobility.organization.dto.SiteUsersRequest;
import com.example.emobility.organization.dto.SiteUsersResponse;
import com.example.emobility.organization.service.SiteService;
import com.example.emobility.security.annotation.ResolvedCaller;
import com.example.emobility.security.context.CallerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/sites")
@RequiredArgsConstructor
public class SiteController {

    private final SiteService siteService;

    @GetMapping
    public Flux<Site> listSites(@ResolvedCaller CallerContext caller) {
        log.debug("GET /sites - user: {}, role: {}", caller.user().id(), caller.user().role());
        return siteService.listSites(caller);
    }

    @GetMapping("/{siteId}")
    public Mono<Site> getSite(@ResolvedCaller CallerContext caller, @PathVariable String siteId) {
        log.debug("GET /sites/{} - user: {}, role: {}", siteId, caller.user().id(), caller.user().role());
        return siteService.getSite(caller, siteId);
    }

    @PutMapping("/{siteId}/users")
    public Mono<SiteUsersResponse> assignUsers(
            @ResolvedCaller CallerContext caller,
            @PathVariable String siteId,
            @Valid @RequestBody SiteUsersRequest request) {

        log.debug("PUT /sites/{}/users - user: {}, count: {}", siteId, caller.user().id(), request.userIds().size());
        return siteService.assignUsers(caller, siteId, request.userIds());
    }

    @PostMapping("/{siteId}/users/unassign")
    public Mono<SiteUsersResponse> unassignUsers(
            @ResolvedCaller CallerContext caller,
            @PathVariable String siteId,
            @Valid @RequestBody SiteUsersRequest request) {

        log.debug("POST /sites/{}/users/unassign - user: {}, count: {}",
                siteId, caller.user().id(), request.userIds().size());
        return siteService.unassignUsers(caller, siteId, request.userIds());
    }
}
