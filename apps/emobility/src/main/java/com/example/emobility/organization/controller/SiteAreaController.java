package com.example.emobility.organization.controller;

import com.example.emobility.model.ChargingStation;
import com.example.emobility.model.SiteArea;
import com.example.emobility.organization.service.SiteAreaService;
import com.example.emobility.security.annotation.ResolvedCaller;
import com.example.emobility.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SiteAreaController {

    private final SiteAreaService siteAreaService;

    @GetMapping("/site-areas")
    public Flux<SiteArea> listSiteAreas(
            @ResolvedCaller CallerContext caller,
            @RequestParam(required = false) String siteId) {
        log.debug("GET /site-areas - user: {}, siteId: {}", caller.user().id(), siteId);
        return siteAreaService.listSiteAreas(caller, siteId);
    }

    @GetMapping("/site-areas/{siteAreaId}")
    public Mono<SiteArea> getSiteArea(@ResolvedCaller CallerContext caller, @PathVariable String siteAreaId) {
        log.debug("GET /site-areas/{} - user: {}", siteAreaId, caller.user().id());
        return siteAreaService.getSiteArea(caller, siteAreaId);
    }

    @GetMapping("/charging-stations/{chargingStationId}")
    public Mono<ChargingStation> getChargingStation(
            @ResolvedCaller CallerContext caller,
            @PathVariable String chargingStationId) {
        log.debug("GET /charging-stations/{} - user: {}", chargingStationId, caller.user().id());
        return siteAreaService.getChargingStation(caller, chargingStationId);
    }
}
