package com.dmarcradar.domain;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Partial updates on dmarc_records. Each call touches only its own fields so that the geolocation queue
 * and the reprocessing workers can write the same record concurrently.
 */
public interface DmarcRecordRepositoryCustom {

    /** Ids of records with reprocessed=false, ascending. */
    List<String> findUnprocessedIds();

    /** Sets reprocessed=false and clears reprocessedByJobId on every record; returns the modified count. */
    long resetReprocessedFlags();

    void saveClassification(String recordId, Boolean forwarded, String forwardReason, String jobId);

    /**
     * Sets geoLookupStatus on the given records. PROCESSING also stamps the attempt time and increments the attempt count.
     */
    void updateGeoLookupStatus(Collection<String> recordIds, GeoLookupStatus status);

    /** Copies location fields onto the records and marks them COMPLETED. */
    void applyGeoLocation(Collection<String> recordIds, GeoLocationData data);

    /**
     * Record ids that still need a location (status PENDING, FAILED or unset), grouped by source IP.
     * At most {@code limit} records are scanned.
     */
    Map<String, List<String>> findUnresolvedRecordIdsByIp(int limit);
}
