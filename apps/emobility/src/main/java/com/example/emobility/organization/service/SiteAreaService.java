package com.example.emobility.organization.service;

import com.example.emobility.authz.gate.AccessOptions;
import com.example.emobility.authz.gate.EntityAccessGate;
import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.FilterParam;
import com.example.emobility.authz.model.FilterParams;
import com.example.emobility.authz.resource.Resources;
import com.example.emobility.model.ChargingStation;
import com.example.emobility.model.SiteArea;
import com.example.emobility.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class SiteAreaService {

    private final EntityAccessGate accessGate;

    public Mono<SiteArea> getSiteArea(CallerContext caller, String siteAreaId) {
        return accessGate.checkAndGetSiteAreaAuthorization(caller.tenant(), caller.user(), siteAreaId, Action.READ,
                AccessOptions.defaults().withProjectFields());
    }

    public Flux<SiteArea> listSiteAreas(CallerContext caller, @Nullable String siteId) {
        FilterParams filters = siteId == null || siteId.isBlank()
                ? FilterParams.none()
                : FilterParams.of(FilterParam.SITE_IDS, siteId);
        return accessGate.listAuthorized(caller.tenant(), caller.user(), Resources.SITE_AREA, filters);
    }

    public Mono<ChargingStation> getChargingStation(CallerContext caller, String chargingStationId) {
        return accessGate.checkAndGetChargingStationAuthorization(caller.tenant(), caller.user(), chargingStationId, Action.READ,
                AccessOptions.defaults().withProjectFields());
    }
}
