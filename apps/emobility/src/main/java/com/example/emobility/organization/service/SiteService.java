package com.example.emobility.organization.service;

import com.example.emobility.authz.datasource.DynamicDataSources;
import com.example.emobility.authz.gate.AccessOptions;
import com.example.emobility.authz.gate.EntityAccessGate;
import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.resource.Resources;
import com.example.emobility.model.Site;
import com.example.emobility.model.User;
import com.example.emobility.organization.dto.SiteUsersResponse;
import com.example.emobility.security.context.CallerContext;
import com.example.emobility.storage.SiteUserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SiteService {

    private final EntityAccessGate accessGate;
    private final SiteUserStore siteUserStore;

    public Mono<Site> getSite(CallerContext caller, String siteId) {
        return accessGate.checkAndGetSiteAuthorization(caller.tenant(), caller.user(), siteId, Action.READ,
                AccessOptions.defaults().withProjectFields());
    }

    public Flux<Site> listSites(CallerContext caller) {
        return accessGate.listAuthorized(caller.tenant(), caller.user(), Resources.SITE, FilterParams.none());
    }

    public Mono<SiteUsersResponse> assignUsers(CallerContext caller, String siteId, List<String> userIds) {
        return checkSiteUsers(caller, siteId, Action.ASSIGN_USERS_TO_SITE, Action.ASSIGN, userIds)
                .flatMap(users -> siteUserStore.assignUsers(caller.tenant(), siteId, idsOf(users)))
                .map(changed -> new SiteUsersResponse(siteId, userIds.size(), changed));
    }

    public Mono<SiteUsersResponse> unassignUsers(CallerContext caller, String siteId, List<String> userIds) {
        return checkSiteUsers(caller, siteId, Action.UNASSIGN_USERS_TO_SITE, Action.UNASSIGN, userIds)
                .flatMap(users -> siteUserStore.unassignUsers(caller.tenant(), siteId, idsOf(users)))
                .map(changed -> new SiteUsersResponse(siteId, userIds.size(), changed));
    }

    // Site and user checks of one request share a single data source memo.
    private Mono<List<User>> checkSiteUsers(CallerContext caller, String siteId, Action siteAction,
            Action assignmentAction, List<String> userIds) {
        AccessOptions options = AccessOptions.defaults()
                .withDataSources(DynamicDataSources.forRequest(caller.tenant(), caller.user()));
        return accessGate.checkAndGetSiteAuthorization(caller.tenant(), caller.user(), siteId, siteAction, options)
                .flatMap(site -> accessGate.checkSiteUsersAuthorization(
                        caller.tenant(), caller.user(), site, assignmentAction, userIds, options));
    }

    private static List<String> idsOf(List<User> users) {
        return users.stream().map(User::getId).toList();
    }
}
