package com.example.emobility.authz.filter;

import com.example.emobility.authz.datasource.DataSourceData.CompanyIdsData;
import com.example.emobility.authz.datasource.DataSourceData.SiteIdsData;
import com.example.emobility.authz.datasource.DataSourceData.UserIdData;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.FilterParam;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Dynamic filters")
class DynamicFiltersTest {

    @Nested
    @DisplayName("Site IDs filter")
    class SiteIds {

        private final SiteIdsFilter filter = new SiteIdsFilter(DynamicFilterName.ASSIGNED_SITES,
                DataSourceName.ASSIGNED_SITES);

        @Test
        @DisplayName("should restrict to all user sites without hint")
        void shouldRestrictToAllSitesWithoutHint() {
            FilterFragment fragment = filter.apply(new SiteIdsData(Set.of("s1", "s2")), AuthorizationContext.empty());

            assertThat(fragment.satisfiable()).isTrue();
            assertThat(fragment.params().ids(FilterParam.SITE_IDS)).contains(Set.of("s1", "s2"));
        }

        @Test
        @DisplayName("should be unsatisfiable when user has no sites")
        void shouldBeUnsatisfiableWithoutSites() {
            FilterFragment fragment = filter.apply(new SiteIdsData(Set.of()), AuthorizationContext.empty());

            assertThat(fragment.satisfiable()).isFalse();
        }

        @Test
        @DisplayName("should keep only hinted sites the user can reach")
        void shouldIntersectWithHint() {
            AuthorizationContext hint = AuthorizationContext.forSite("s2").withSites(Set.of("s3"));

            FilterFragment fragment = filter.apply(new SiteIdsData(Set.of("s1", "s2")), hint);

            assertThat(fragment.satisfiable()).isTrue();
            assertThat(fragment.params().ids(FilterParam.SITE_IDS)).contains(Set.of("s2"));
        }

        @Test
        @DisplayName("should be unsatisfiable when hinted site is out of reach")
        void shouldRejectUnreachableHint() {
            FilterFragment fragment = filter.apply(new SiteIdsData(Set.of("s1")), AuthorizationContext.forSite("s9"));

            assertThat(fragment.satisfiable()).isFalse();
        }

        @Test
        @DisplayName("should not match a loaded entity attached to no site")
        void shouldRejectEntityWithoutSite() {
            FilterFragment fragment = filter.applyToEntity(new SiteIdsData(Set.of("s1")), AuthorizationContext.empty());

            assertThat(fragment.satisfiable()).isFalse();
        }

        @Test
        @DisplayName("should match a loaded entity on one of the user's sites")
        void shouldMatchEntityOnReachableSite() {
            FilterFragment fragment = filter.applyToEntity(new SiteIdsData(Set.of("s1", "s2")),
                    AuthorizationContext.forSite("s2"));

            assertThat(fragment.satisfiable()).isTrue();
            assertThat(fragment.params().ids(FilterParam.SITE_IDS)).contains(Set.of("s2"));
        }

        @Test
        @DisplayName("should fail on unexpected data")
        void shouldFailOnUnexpectedData() {
            assertThatThrownBy(() -> filter.apply(new UserIdData("u1"), AuthorizationContext.empty()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("SiteIdsData");
        }
    }

    @Nested
    @DisplayName("Assigned sites companies filter")
    class AssignedSitesCompanies {

        private final AssignedSitesCompaniesFilter filter = new AssignedSitesCompaniesFilter();

        @Test
        @DisplayName("should restrict to companies of assigned sites")
        void shouldRestrictToCompanies() {
            FilterFragment fragment = filter.apply(new CompanyIdsData(Set.of("c1")), AuthorizationContext.empty());

            assertThat(fragment.params().ids(FilterParam.COMPANY_IDS)).contains(Set.of("c1"));
        }

        @Test
        @DisplayName("should reject a company hint outside the user's companies")
        void shouldRejectForeignCompany() {
            FilterFragment fragment = filter.apply(new CompanyIdsData(Set.of("c1")),
                    AuthorizationContext.forCompany("c2"));

            assertThat(fragment.satisfiable()).isFalse();
        }

        @Test
        @DisplayName("should not match a loaded entity without company")
        void shouldRejectEntityWithoutCompany() {
            FilterFragment fragment = filter.applyToEntity(new CompanyIdsData(Set.of("c1")),
                    AuthorizationContext.empty());

            assertThat(fragment.satisfiable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Own user filter")
    class OwnUser {

        private final OwnUserFilter filter = new OwnUserFilter();

        @Test
        @DisplayName("should restrict to the requesting user")
        void shouldRestrictToRequestingUser() {
            FilterFragment fragment = filter.apply(new UserIdData("u1"), AuthorizationContext.empty());

            assertThat(fragment.params().ids(FilterParam.USER_IDS)).contains(Set.of("u1"));
        }

        @Test
        @DisplayName("should be unsatisfiable for another owner")
        void shouldRejectOtherOwner() {
            FilterFragment fragment = filter.apply(new UserIdData("u1"), AuthorizationContext.forOwner("u2"));

            assertThat(fragment.satisfiable()).isFalse();
        }

        @Test
        @DisplayName("should not match a loaded entity without owner")
        void shouldRejectEntityWithoutOwner() {
            FilterFragment fragment = filter.applyToEntity(new UserIdData("u1"), AuthorizationContext.forOwner(null));

            assertThat(fragment.satisfiable()).isFalse();
        }
    }

    @Test
    @DisplayName("local issuer filter should require locally issued entities")
    void localIssuerShouldRequireIssuer() {
        FilterFragment fragment = new LocalIssuerFilter().apply(null, AuthorizationContext.empty());

        assertThat(fragment.params().flag(FilterParam.ISSUER)).contains(true);
    }
}
