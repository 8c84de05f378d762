package com.example.emobility.authz.model;

/**
 * Kind of resource a grant applies to.
 */
public enum Entity {
    TENANT("Tenant"),
    SITE("Site"),
    SITE_AREA("SiteArea"),
    COMPANY("Company"),
    CHARGING_STATION("ChargingStation"),
    USER("User"),
    USERS_SITES("UsersSites"),
    CAR("Car"),
    CAR_CATALOG("CarCatalog"),
    TAG("Tag"),
    ASSET("Asset"),
    REGISTRATION_TOKEN("RegistrationToken");

    private final String value;

    Entity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
