package com.example.emobility.authz.policy;

import com.example.emobility.authz.assertion.DynamicAssertName;
import com.example.emobility.authz.filter.DynamicFilterName;
import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static com.example.emobility.authz.assertion.DynamicAssertName.POOL_CAR;
import static com.example.emobility.authz.filter.DynamicFilterName.ASSIGNED_SITES;
import static com.example.emobility.authz.filter.DynamicFilterName.ASSIGNED_SITES_COMPANIES;
import static com.example.emobility.authz.filter.DynamicFilterName.LOCAL_ISSUER;
import static com.example.emobility.authz.filter.DynamicFilterName.SITES_ADMIN;
import static com.example.emobility.authz.filter.DynamicFilterName.SITES_OWNER;

/**
 * Built-in grant table for every role.
 */
@Slf4j
@Configuration
public class DefaultAuthorizationDefinitionConfig {

    static final List<String> COMPANY_PUBLIC_FIELDS = List.of("id", "name", "issuer", "address", "logo");
    static final List<String> SITE_PUBLIC_FIELDS = List.of("id", "name", "companyID", "issuer", "address");
    static final List<String> SITE_AREA_PUBLIC_FIELDS = List.of("id", "name", "siteID", "issuer", "accessControl");
    static final List<String> CHARGING_STATION_PUBLIC_FIELDS =
            List.of("id", "siteID", "siteAreaID", "issuer", "chargePointVendor", "deleted");
    static final List<String> USER_SELF_FIELDS =
            List.of("id", "name", "firstName", "email", "role", "status", "issuer", "locale");
    static final List<String> USER_SITE_ADMIN_FIELDS =
            List.of("id", "name", "firstName", "email", "role", "status", "issuer");
    static final List<String> TAG_FIELDS = List.of("id", "visualID", "userID", "active", "issuer", "description");

    @Bean
    public AuthorizationDefinition authorizationDefinition() {
        return defaultDefinition();
    }

    public static AuthorizationDefinition defaultDefinition() {
        return new AuthorizationDefinition(List.of(
                superAdmin(),
                admin(),
                basic(),
                siteAdmin(),
                siteOwner(),
                demo()));
    }

    private static RoleDefinition superAdmin() {
        return RoleDefinition.of(Role.SUPER_ADMIN)
                .grant(Grant.builder().resource(Entity.TENANT)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.USER)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.CAR_CATALOG)
                        .action(Action.READ).action(Action.LIST).action(Action.SYNCHRONIZE)
                        .build())
                .build();
    }

    private static RoleDefinition admin() {
        return RoleDefinition.of(Role.ADMIN)
                .grant(Grant.builder().resource(Entity.COMPANY)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.SITE)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .action(Action.ASSIGN_USERS_TO_SITE).action(Action.UNASSIGN_USERS_TO_SITE)
                        .action(Action.EXPORT_OCPP_PARAMS).action(Action.GENERATE_QR)
                        .build())
                .grant(Grant.builder().resource(Entity.SITE_AREA)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .action(Action.ASSIGN_ASSETS_TO_SITE_AREA).action(Action.UNASSIGN_ASSETS_TO_SITE_AREA)
                        .action(Action.ASSIGN_CHARGING_STATIONS_TO_SITE_AREA)
                        .action(Action.UNASSIGN_CHARGING_STATIONS_TO_SITE_AREA)
                        .action(Action.EXPORT_OCPP_PARAMS).action(Action.GENERATE_QR)
                        .build())
                .grant(Grant.builder().resource(Entity.CHARGING_STATION)
                        .action(Action.READ).action(Action.UPDATE).action(Action.DELETE).action(Action.LIST)
                        .action(Action.CHANGE_AVAILABILITY)
                        .action(Action.EXPORT_OCPP_PARAMS).action(Action.GENERATE_QR)
                        .build())
                .grant(Grant.builder().resource(Entity.USER)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.USERS_SITES)
                        .action(Action.ASSIGN).action(Action.UNASSIGN).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.CAR)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.CAR_CATALOG)
                        .action(Action.READ).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.TAG)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.ASSIGN).action(Action.UNASSIGN)
                        .build())
                .grant(Grant.builder().resource(Entity.TAG)
                        .action(Action.LIST)
                        .condition(DynamicCondition.filters(LOCAL_ISSUER))
                        .build())
                .grant(Grant.builder().resource(Entity.ASSET)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.REGISTRATION_TOKEN)
                        .action(Action.CREATE).action(Action.READ).action(Action.UPDATE)
                        .action(Action.DELETE).action(Action.LIST)
                        .build())
                .build();
    }

    private static RoleDefinition basic() {
        return RoleDefinition.of(Role.BASIC)
                .grant(Grant.builder().resource(Entity.COMPANY)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(COMPANY_PUBLIC_FIELDS)
                        .condition(DynamicCondition.filters(ASSIGNED_SITES_COMPANIES))
                        .build())
                .grant(Grant.builder().resource(Entity.SITE)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(SITE_PUBLIC_FIELDS)
                        .condition(DynamicCondition.filters(ASSIGNED_SITES))
                        .build())
                .grant(Grant.builder().resource(Entity.SITE_AREA)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(SITE_AREA_PUBLIC_FIELDS)
                        .condition(DynamicCondition.filters(ASSIGNED_SITES))
                        .build())
                .grant(Grant.builder().resource(Entity.CHARGING_STATION)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(CHARGING_STATION_PUBLIC_FIELDS)
                        .condition(DynamicCondition.filters(ASSIGNED_SITES))
                        .build())
                .grant(Grant.builder().resource(Entity.USER)
                        .action(Action.READ).action(Action.UPDATE)
                        .attributes(USER_SELF_FIELDS)
                        .condition(DynamicCondition.filters(DynamicFilterName.OWN_USER).andAsserts(DynamicAssertName.OWN_USER))
                        .build())
                .grant(Grant.builder().resource(Entity.CAR)
                        .action(Action.READ)
                        .condition(DynamicCondition.anyOfAsserts(DynamicAssertName.OWN_USER, POOL_CAR))
                        .build())
                .grant(Grant.builder().resource(Entity.CAR)
                        .action(Action.UPDATE).action(Action.DELETE).action(Action.LIST)
                        .condition(DynamicCondition.filters(DynamicFilterName.OWN_USER).andAsserts(DynamicAssertName.OWN_USER))
                        .build())
                .grant(Grant.builder().resource(Entity.CAR)
                        .action(Action.CREATE)
                        .build())
                .grant(Grant.builder().resource(Entity.CAR_CATALOG)
                        .action(Action.READ).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.TAG)
                        .action(Action.READ).action(Action.UPDATE).action(Action.LIST)
                        .attributes(TAG_FIELDS)
                        .condition(DynamicCondition.filters(DynamicFilterName.OWN_USER).andAsserts(DynamicAssertName.OWN_USER))
                        .build())
                .build();
    }

    private static RoleDefinition siteAdmin() {
        return RoleDefinition.of(Role.SITE_ADMIN)
                .inherits(Role.BASIC)
                .grant(Grant.builder().resource(Entity.SITE)
                        .action(Action.UPDATE).action(Action.EXPORT_OCPP_PARAMS).action(Action.GENERATE_QR)
                        .action(Action.ASSIGN_USERS_TO_SITE).action(Action.UNASSIGN_USERS_TO_SITE)
                        .condition(DynamicCondition.filters(SITES_ADMIN))
                        .build())
                .grant(Grant.builder().resource(Entity.SITE_AREA)
                        .action(Action.CREATE).action(Action.UPDATE).action(Action.DELETE)
                        .action(Action.ASSIGN_ASSETS_TO_SITE_AREA).action(Action.UNASSIGN_ASSETS_TO_SITE_AREA)
                        .action(Action.ASSIGN_CHARGING_STATIONS_TO_SITE_AREA)
                        .action(Action.UNASSIGN_CHARGING_STATIONS_TO_SITE_AREA)
                        .action(Action.EXPORT_OCPP_PARAMS).action(Action.GENERATE_QR)
                        .condition(DynamicCondition.filters(SITES_ADMIN))
                        .build())
                .grant(Grant.builder().resource(Entity.CHARGING_STATION)
                        .action(Action.UPDATE).action(Action.DELETE).action(Action.CHANGE_AVAILABILITY)
                        .action(Action.EXPORT_OCPP_PARAMS).action(Action.GENERATE_QR)
                        .condition(DynamicCondition.filters(SITES_ADMIN))
                        .build())
                .grant(Grant.builder().resource(Entity.USER)
                        .action(Action.LIST)
                        .attributes(USER_SITE_ADMIN_FIELDS)
                        .condition(DynamicCondition.filters(SITES_ADMIN))
                        .build())
                .grant(Grant.builder().resource(Entity.USERS_SITES)
                        .action(Action.ASSIGN).action(Action.UNASSIGN).action(Action.LIST)
                        .condition(DynamicCondition.filters(SITES_ADMIN))
                        .build())
                .grant(Grant.builder().resource(Entity.ASSET)
                        .action(Action.READ).action(Action.LIST)
                        .condition(DynamicCondition.filters(SITES_ADMIN))
                        .build())
                .build();
    }

    private static RoleDefinition siteOwner() {
        return RoleDefinition.of(Role.SITE_OWNER)
                .inherits(Role.BASIC)
                .grant(Grant.builder().resource(Entity.SITE)
                        .action(Action.UPDATE).action(Action.EXPORT_OCPP_PARAMS)
                        .condition(DynamicCondition.filters(SITES_OWNER))
                        .build())
                .grant(Grant.builder().resource(Entity.CHARGING_STATION)
                        .action(Action.CHANGE_AVAILABILITY)
                        .condition(DynamicCondition.filters(SITES_OWNER))
                        .build())
                .build();
    }

    private static RoleDefinition demo() {
        return RoleDefinition.of(Role.DEMO)
                .grant(Grant.builder().resource(Entity.COMPANY)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(COMPANY_PUBLIC_FIELDS)
                        .build())
                .grant(Grant.builder().resource(Entity.SITE)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(SITE_PUBLIC_FIELDS)
                        .build())
                .grant(Grant.builder().resource(Entity.SITE_AREA)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(SITE_AREA_PUBLIC_FIELDS)
                        .build())
                .grant(Grant.builder().resource(Entity.CHARGING_STATION)
                        .action(Action.READ).action(Action.LIST)
                        .attributes(CHARGING_STATION_PUBLIC_FIELDS)
                        .build())
                .grant(Grant.builder().resource(Entity.CAR_CATALOG)
                        .action(Action.READ).action(Action.LIST)
                        .build())
                .grant(Grant.builder().resource(Entity.USER)
                        .action(Action.READ)
                        .attributes(USER_SELF_FIELDS)
                        .condition(DynamicCondition.filters(DynamicFilterName.OWN_USER).andAsserts(DynamicAssertName.OWN_USER))
                        .build())
                .build();
    }
}
