package com.example.emobility.authz.resource;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.AuthorizationContext;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.model.Asset;
import com.example.emobility.model.Car;
import com.example.emobility.model.CarCatalog;
import com.example.emobility.model.ChargingStation;
import com.example.emobility.model.Company;
import com.example.emobility.model.Site;
import com.example.emobility.model.SiteArea;
import com.example.emobility.model.Tag;
import com.example.emobility.model.User;

import java.util.LinkedHashSet;

/**
 * Resource descriptors for every entity guarded by {@link com.example.emobility.authz.gate.EntityAccessGate}.
 */
public final class Resources {

    public static final String SITE_USERS_COLLECTION = "siteusers";

    private static final FieldMapping ID = FieldMapping.direct("_id");
    private static final FieldMapping ISSUER = FieldMapping.direct("issuer");

    public static final ResourceType<Company> COMPANY = ResourceType.<Company>builder()
            .entity(Entity.COMPANY)
            .type(Company.class)
            .displayName("Company")
            .collection("companies")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.COMPANY_IDS, ID)
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .requiredField("issuer")
            .contextExtractor(company -> AuthorizationContext.forCompany(company.getId()))
            .idHint(AuthorizationContext::forCompany)
            .build();

    public static final ResourceType<Site> SITE = ResourceType.<Site>builder()
            .entity(Entity.SITE)
            .type(Site.class)
            .displayName("Site")
            .collection("sites")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.SITE_IDS, ID)
            .field(FilterParam.COMPANY_IDS, FieldMapping.direct("companyID"))
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .flag(Action.ASSIGN_USERS_TO_SITE).flag(Action.UNASSIGN_USERS_TO_SITE)
            .flag(Action.EXPORT_OCPP_PARAMS).flag(Action.GENERATE_QR)
            .requiredField("companyID").requiredField("issuer")
            .contextExtractor(site -> AuthorizationContext.forSite(site.getId()).withCompany(site.getCompanyID()))
            .idHint(AuthorizationContext::forSite)
            .build();

    public static final ResourceType<SiteArea> SITE_AREA = ResourceType.<SiteArea>builder()
            .entity(Entity.SITE_AREA)
            .type(SiteArea.class)
            .displayName("Site Area")
            .collection("siteareas")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.SITE_AREA_IDS, ID)
            .field(FilterParam.SITE_IDS, FieldMapping.direct("siteID"))
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .flag(Action.ASSIGN_ASSETS_TO_SITE_AREA).flag(Action.UNASSIGN_ASSETS_TO_SITE_AREA)
            .flag(Action.ASSIGN_CHARGING_STATIONS_TO_SITE_AREA).flag(Action.UNASSIGN_CHARGING_STATIONS_TO_SITE_AREA)
            .flag(Action.EXPORT_OCPP_PARAMS).flag(Action.GENERATE_QR)
            .requiredField("siteID").requiredField("issuer")
            .contextExtractor(area -> AuthorizationContext.forSite(area.getSiteID()).withSiteArea(area.getId()))
            .build();

    public static final ResourceType<ChargingStation> CHARGING_STATION = ResourceType.<ChargingStation>builder()
            .entity(Entity.CHARGING_STATION)
            .type(ChargingStation.class)
            .displayName("Charging Station")
            .collection("chargingstations")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.SITE_IDS, FieldMapping.direct("siteID"))
            .field(FilterParam.SITE_AREA_IDS, FieldMapping.direct("siteAreaID"))
            .field(FilterParam.COMPANY_IDS, FieldMapping.direct("companyID"))
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .flag(Action.CHANGE_AVAILABILITY).flag(Action.EXPORT_OCPP_PARAMS).flag(Action.GENERATE_QR)
            .requiredField("siteID").requiredField("siteAreaID").requiredField("companyID")
            .requiredField("issuer").requiredField("deleted")
            .contextExtractor(station -> AuthorizationContext.forSite(station.getSiteID())
                    .withSiteArea(station.getSiteAreaID())
                    .withCompany(station.getCompanyID()))
            .deletedCheck(ChargingStation::isDeleted)
            .build();

    public static final ResourceType<User> USER = ResourceType.<User>builder()
            .entity(Entity.USER)
            .type(User.class)
            .displayName("User")
            .collection("users")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.USER_IDS, ID)
            .field(FilterParam.SITE_IDS, FieldMapping.viaLookup(SITE_USERS_COLLECTION, "_id", "userID", "siteID"))
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .requiredField("issuer")
            .contextExtractor(user -> AuthorizationContext.forOwner(user.getId()))
            .idHint(AuthorizationContext::forOwner)
            .build();

    public static final ResourceType<Car> CAR = ResourceType.<Car>builder()
            .entity(Entity.CAR)
            .type(Car.class)
            .displayName("Car")
            .collection("cars")
            .issuerChecked(false)
            .field(FilterParam.IDS, ID)
            .field(FilterParam.USER_IDS, FieldMapping.direct("userID"))
            .field(FilterParam.SITE_IDS, FieldMapping.direct("siteIDs"))
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .requiredField("userID").requiredField("type").requiredField("siteIDs")
            .contextExtractor(car -> AuthorizationContext.forOwner(car.getUserID())
                    .withSites(car.getSiteIDs() == null ? null : new LinkedHashSet<>(car.getSiteIDs())))
            .build();

    public static final ResourceType<CarCatalog> CAR_CATALOG = ResourceType.<CarCatalog>builder()
            .entity(Entity.CAR_CATALOG)
            .type(CarCatalog.class)
            .displayName("Car Catalog")
            .collection("carcatalogs")
            .tenantScoped(false)
            .issuerChecked(false)
            .idConverter(Resources::numericId)
            .field(FilterParam.IDS, ID)
            .flag(Action.READ)
            .build();

    public static final ResourceType<Tag> TAG = ResourceType.<Tag>builder()
            .entity(Entity.TAG)
            .type(Tag.class)
            .displayName("Tag")
            .collection("tags")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.VISUAL_IDS, FieldMapping.direct("visualID"))
            .field(FilterParam.USER_IDS, FieldMapping.direct("userID"))
            .field(FilterParam.SITE_IDS, FieldMapping.viaLookup(SITE_USERS_COLLECTION, "userID", "userID", "siteID"))
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .flag(Action.ASSIGN).flag(Action.UNASSIGN)
            .requiredField("userID").requiredField("issuer")
            .contextExtractor(tag -> AuthorizationContext.forOwner(tag.getUserID()))
            .build();

    public static final ResourceType<Asset> ASSET = ResourceType.<Asset>builder()
            .entity(Entity.ASSET)
            .type(Asset.class)
            .displayName("Asset")
            .collection("assets")
            .field(FilterParam.IDS, ID)
            .field(FilterParam.SITE_IDS, FieldMapping.direct("siteID"))
            .field(FilterParam.SITE_AREA_IDS, FieldMapping.direct("siteAreaID"))
            .field(FilterParam.ISSUER, ISSUER)
            .flag(Action.READ).flag(Action.UPDATE).flag(Action.DELETE)
            .requiredField("siteID").requiredField("siteAreaID").requiredField("issuer")
            .contextExtractor(asset -> AuthorizationContext.forSite(asset.getSiteID()).withSiteArea(asset.getSiteAreaID()))
            .build();

    private Resources() {}

    static Object numericId(String id) {
        try {
            return Integer.valueOf(id.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("The ID '" + id + "' must be a number", e);
        }
    }
}
