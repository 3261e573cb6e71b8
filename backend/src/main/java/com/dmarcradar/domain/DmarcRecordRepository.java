package com.dmarcradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for dmarc_records. Field-level updates live in {@link DmarcRecordRepositoryCustom}.
 */
public interface DmarcRecordRepository extends MongoRepository<DmarcRecord, String>, DmarcRecordRepositoryCustom {

    List<DmarcRecord> findByDmarcReportId(String dmarcReportId);

    long deleteByDmarcReportId(String dmarcReportId);

    long countByReprocessedFalse();

    long countByReprocessedByJobId(String jobId);

    long countByReprocessedByJobIdAndForwarded(String jobId, Boolean forwarded);

    long countByReprocessedByJobIdAndForwardedIsNull(String jobId);
}
