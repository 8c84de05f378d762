package com.example.emobility.authz.model;

import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Optional hints about the entity being authorized (its site, company, owner...).
 * Dynamic filters use them to narrow or reject a request before anything is fetched.
 */
public record AuthorizationContext(
        @Nullable String site,
        @Nullable Set<String> sites,
        @Nullable String company,
        @Nullable Set<String> companies,
        @Nullable String owner,
        @Nullable String siteArea
) {
    private static final AuthorizationContext EMPTY = new AuthorizationContext(null, null, null, null, null, null);

    public AuthorizationContext {
        sites = sites == null ? null : Set.copyOf(sites);
        companies = companies == null ? null : Set.copyOf(companies);
    }

    public static AuthorizationContext empty() {
        return EMPTY;
    }

    public static AuthorizationContext forSite(@Nullable String siteId) {
        return new AuthorizationContext(siteId, null, null, null, null, null);
    }

    public static AuthorizationContext forCompany(@Nullable String companyId) {
        return new AuthorizationContext(null, null, companyId, null, null, null);
    }

    public static AuthorizationContext forOwner(@Nullable String userId) {
        return new AuthorizationContext(null, null, null, null, userId, null);
    }

    public AuthorizationContext withSites(@Nullable Set<String> siteIds) {
        return new AuthorizationContext(site, siteIds, company, companies, owner, siteArea);
    }

    public AuthorizationContext withCompany(@Nullable String companyId) {
        return new AuthorizationContext(site, sites, companyId, companies, owner, siteArea);
    }

    public AuthorizationContext withSiteArea(@Nullable String siteAreaId) {
        return new AuthorizationContext(site, sites, company, companies, owner, siteAreaId);
    }

    /**
     * All site IDs named by this context, or an empty set when no site hint was given.
     */
    public Set<String> siteIds() {
        return merge(site, sites);
    }

    public Set<String> companyIds() {
        return merge(company, companies);
    }

    public boolean hasSiteHint() {
        return site != null || (sites != null && !sites.isEmpty());
    }

    public boolean hasCompanyHint() {
        return company != null || (companies != null && !companies.isEmpty());
    }

    private static Set<String> merge(@Nullable String single, @Nullable Set<String> many) {
        Set<String> result = new LinkedHashSet<>();
        if (single != null) {
            result.add(single);
        }
        if (many != null) {
            result.addAll(many);
        }
        return result;
    }
}
