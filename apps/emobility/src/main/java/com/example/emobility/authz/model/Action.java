package com.example.emobility.authz.model;

/**
 * Operation checked by the authorization engine.
 *
 * <p>Each action knows the name of the transient flag it produces on an entity
 * (e.g. {@code canUpdate}) so API consumers can drive their UI from it.
 */
public enum Action {
    READ("Read", "canRead"),
    CREATE("Create", "canCreate"),
    UPDATE("Update", "canUpdate"),
    DELETE("Delete", "canDelete"),
    LIST("List", "canList"),
    ASSIGN("Assign", "canAssign"),
    UNASSIGN("Unassign", "canUnassign"),
    CHANGE_AVAILABILITY("ChangeAvailability", "canChangeAvailability"),
    ASSIGN_USERS_TO_SITE("AssignUsersToSite", "canAssignUsers"),
    UNASSIGN_USERS_TO_SITE("UnassignUsersToSite", "canUnassignUsers"),
    ASSIGN_ASSETS_TO_SITE_AREA("AssignAssetsToSiteArea", "canAssignAssets"),
    UNASSIGN_ASSETS_TO_SITE_AREA("UnassignAssetsToSiteArea", "canUnassignAssets"),
    ASSIGN_CHARGING_STATIONS_TO_SITE_AREA("AssignChargingStationsToSiteArea", "canAssignChargingStations"),
    UNASSIGN_CHARGING_STATIONS_TO_SITE_AREA("UnassignChargingStationsToSiteArea", "canUnassignChargingStations"),
    EXPORT_OCPP_PARAMS("ExportOCPPParams", "canExportOCPPParams"),
    GENERATE_QR("GenerateQrCode", "canGenerateQrCode"),
    SYNCHRONIZE("Synchronize", "canSynchronize");

    private final String value;
    private final String flagName;

    Action(String value, String flagName) {
        this.value = value;
        this.flagName = flagName;
    }

    public String getValue() {
        return value;
    }

    public String getFlagName() {
        return flagName;
    }
}
