package com.dmarcradar.reprocessing;

import com.dmarcradar.classification.ForwardingClassifier;
import com.dmarcradar.classification.ForwardingVerdict;
import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.DmarcRecordRepository;
import com.dmarcradar.domain.ReprocessingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Re-classifies one contiguous chunk of record ids in batches. Every handled record is stamped with the job id,
 * including records whose classification or save failed (counted unknown).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReprocessingChunkWorker {

    private final DmarcRecordRepository dmarcRecordRepository;
    private final ReprocessingJobRepository reprocessingJobRepository;
    private final ForwardingClassifier forwardingClassifier;

    /**
     * @return false when the job was cancelled before the chunk was finished
     */
    public boolean process(String jobId, List<String> recordIds, int batchSize, ReprocessingBatchCallback callback) {
        int size = Math.max(1, batchSize);
        for (int from = 0; from < recordIds.size(); from += size) {
            if (reprocessingJobRepository.isCancelled(jobId)) {
                log.info("Job {} cancelled; chunk stops at {}/{}", jobId, from, recordIds.size());
                return false;
            }
            List<String> batch = recordIds.subList(from, Math.min(from + size, recordIds.size()));
            processBatch(jobId, batch, callback);
        }
        return true;
    }

    private void processBatch(String jobId, List<String> batch, ReprocessingBatchCallback callback) {
        long forwarded = 0;
        long notForwarded = 0;
        long unknown = 0;
        long processed = 0;
        for (DmarcRecord record : dmarcRecordRepository.findAllById(batch)) {
            Boolean verdict = classifyAndSave(jobId, record);
            processed++;
            if (verdict == null) {
                unknown++;
            } else if (verdict) {
                forwarded++;
            } else {
                notForwarded++;
            }
        }
        callback.onBatch(processed, forwarded, notForwarded, unknown);
    }

    private Boolean classifyAndSave(String jobId, DmarcRecord record) {
        try {
            ForwardingVerdict verdict = forwardingClassifier.classify(record);
            dmarcRecordRepository.saveClassification(record.getId(), verdict.forwarded(), verdict.reason(), jobId);
            return verdict.forwarded();
        } catch (RuntimeException e) {
            log.warn("Reprocessing record {} failed: {}", record.getId(), e.getMessage());
            try {
                dmarcRecordRepository.saveClassification(record.getId(), null, null, jobId);
            } catch (RuntimeException again) {
                log.error("Could not mark record {} as reprocessed", record.getId(), again);
            }
            return null;
        }
    }
}
