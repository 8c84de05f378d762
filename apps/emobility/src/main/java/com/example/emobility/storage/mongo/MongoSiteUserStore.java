package com.example.emobility.storage.mongo;

import com.example.emobility.authz.resource.Resources;
import com.example.emobility.exception.SystemException;
import com.example.emobility.model.Site;
import com.example.emobility.model.SiteUser;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.storage.SiteUserRole;
import com.example.emobility.storage.SiteUserStore;
import com.mongodb.client.result.DeleteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoSiteUserStore implements SiteUserStore {

    private static final String SITES_COLLECTION = "sites";

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    public Flux<String> findSiteIds(Tenant tenant, String userId, SiteUserRole role) {
        Criteria criteria = Criteria.where("userID").is(userId);
        if (role == SiteUserRole.ADMIN) {
            criteria = criteria.and("siteAdmin").is(true);
        } else if (role == SiteUserRole.OWNER) {
            criteria = criteria.and("siteOwner").is(true);
        }
        Query query = new Query(criteria);
        query.fields().include("siteID");

        String collection = siteUsersCollection(tenant);
        return mongoTemplate.find(query, SiteUser.class, collection)
                .map(SiteUser::getSiteID)
                .filter(Objects::nonNull)
                .distinct()
                .onErrorMap(DataAccessException.class,
                        e -> new SystemException("mongodb", "Failed to read " + collection, e));
    }

    @Override
    public Flux<String> findCompanyIds(Tenant tenant, Collection<String> siteIds) {
        if (siteIds.isEmpty()) {
            return Flux.empty();
        }
        Query query = new Query(Criteria.where("_id").in(siteIds));
        query.fields().include("companyID");

        String collection = TenantCollections.name(tenant, SITES_COLLECTION);
        return mongoTemplate.find(query, Site.class, collection)
                .map(Site::getCompanyID)
                .filter(Objects::nonNull)
                .distinct()
                .onErrorMap(DataAccessException.class,
                        e -> new SystemException("mongodb", "Failed to read " + collection, e));
    }

    @Override
    public Mono<Long> assignUsers(Tenant tenant, String siteId, Collection<String> userIds) {
        String collection = siteUsersCollection(tenant);
        return Flux.fromIterable(userIds)
                .concatMap(userId -> mongoTemplate.upsert(
                        new Query(Criteria.where("siteID").is(siteId).and("userID").is(userId)),
                        new Update().setOnInsert("siteAdmin", false).setOnInsert("siteOwner", false),
                        collection))
                .filter(result -> result.getUpsertedId() != null)
                .count()
                .doOnNext(count -> log.info("Assigned {} users to site {} in tenant {}", count, siteId, tenant.id()))
                .onErrorMap(DataAccessException.class,
                        e -> new SystemException("mongodb", "Failed to write " + collection, e));
    }

    @Override
    public Mono<Long> unassignUsers(Tenant tenant, String siteId, Collection<String> userIds) {
        String collection = siteUsersCollection(tenant);
        return mongoTemplate.remove(
                        new Query(Criteria.where("siteID").is(siteId).and("userID").in(userIds)),
                        collection)
                .map(DeleteResult::getDeletedCount)
                .doOnNext(count -> log.info("Unassigned {} users from site {} in tenant {}", count, siteId, tenant.id()))
                .onErrorMap(DataAccessException.class,
                        e -> new SystemException("mongodb", "Failed to write " + collection, e));
    }

    private static String siteUsersCollection(Tenant tenant) {
        return TenantCollections.name(tenant, Resources.SITE_USERS_COLLECTION);
    }
}
