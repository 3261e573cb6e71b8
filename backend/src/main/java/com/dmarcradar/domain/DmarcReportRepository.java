package com.dmarcradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface DmarcReportRepository extends MongoRepository<DmarcReport, String> {

    Optional<DmarcReport> findByReportId(String reportId);
}
