package com.dmarcradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ReprocessingJobRepository extends MongoRepository<ReprocessingJob, String>, ReprocessingJobRepositoryCustom {

    Optional<ReprocessingJob> findFirstByStatusOrderByCreatedAtDesc(ReprocessingJob.JobStatus status);

    Optional<ReprocessingJob> findFirstByStatusInOrderByCreatedAtDesc(Collection<ReprocessingJob.JobStatus> statuses);

    List<ReprocessingJob> findTop50ByOrderByCreatedAtDesc();
}
