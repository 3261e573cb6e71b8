package com.dmarcradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed partial updates for dmarc_records.
 */
@Repository
@RequiredArgsConstructor
public class DmarcRecordRepositoryImpl implements DmarcRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<String> findUnprocessedIds() {
        Query query = new Query(where("reprocessed").is(false)).with(Sort.by(Sort.Direction.ASC, "_id"));
        query.fields().include("_id");
        return mongoTemplate.find(query, DmarcRecord.class).stream()
                .map(DmarcRecord::getId)
                .toList();
    }

    @Override
    public long resetReprocessedFlags() {
        Update update = new Update().set("reprocessed", false).unset("reprocessedByJobId");
        return mongoTemplate.updateMulti(new Query(), update, DmarcRecord.class).getModifiedCount();
    }

    @Override
    public void saveClassification(String recordId, Boolean forwarded, String forwardReason, String jobId) {
        Update update = new Update()
                .set("forwarded", forwarded)
                .set("forwardReason", forwardReason)
                .set("reprocessed", true)
                .set("reprocessedByJobId", jobId);
        mongoTemplate.updateFirst(new Query(where("_id").is(recordId)), update, DmarcRecord.class);
    }

    @Override
    public void updateGeoLookupStatus(Collection<String> recordIds, GeoLookupStatus status) {
        if (recordIds == null || recordIds.isEmpty()) {
            return;
        }
        Update update = new Update().set("geoLookupStatus", status);
        if (status == GeoLookupStatus.PROCESSING) {
            update.set("geoLookupLastAttempt", Instant.now()).inc("geoLookupAttempts", 1);
        }
        mongoTemplate.updateMulti(new Query(where("_id").in(recordIds)), update, DmarcRecord.class);
    }

    @Override
    public void applyGeoLocation(Collection<String> recordIds, GeoLocationData data) {
        if (recordIds == null || recordIds.isEmpty() || data == null) {
            return;
        }
        Update update = new Update()
                .set("geoCountry", data.getCountry())
                .set("geoCountryName", data.getCountryName())
                .set("geoCity", data.getCity())
                .set("geoLatitude", data.getLatitude())
                .set("geoLongitude", data.getLongitude())
                .set("geoIsp", data.getIsp())
                .set("geoOrg", data.getOrg())
                .set("geoLookupStatus", GeoLookupStatus.COMPLETED)
                .set("geoLookupCompletedAt", Instant.now());
        mongoTemplate.updateMulti(new Query(where("_id").in(recordIds)), update, DmarcRecord.class);
    }

    @Override
    public Map<String, List<String>> findUnresolvedRecordIdsByIp(int limit) {
        Criteria unresolved = new Criteria().orOperator(
                where("geoLookupStatus").in(GeoLookupStatus.PENDING, GeoLookupStatus.FAILED),
                where("geoLookupStatus").is(null));
        Query query = new Query(new Criteria().andOperator(where("sourceIp").ne(null), unresolved))
                .with(Sort.by(Sort.Direction.ASC, "_id"))
                .limit(Math.max(1, limit));
        query.fields().include("_id").include("sourceIp");
        Map<String, List<String>> byIp = new LinkedHashMap<>();
        for (DmarcRecord r : mongoTemplate.find(query, DmarcRecord.class)) {
            byIp.computeIfAbsent(r.getSourceIp(), ip -> new ArrayList<>()).add(r.getId());
        }
        return byIp;
    }
}
