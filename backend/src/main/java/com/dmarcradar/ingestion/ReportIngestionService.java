package com.dmarcradar.ingestion;

import com.dmarcradar.classification.ForwardingClassifier;
import com.dmarcradar.classification.ForwardingVerdict;
import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.DmarcRecordRepository;
import com.dmarcradar.domain.DmarcReport;
import com.dmarcradar.domain.DmarcReportRepository;
import com.dmarcradar.domain.GeoLookupStatus;
import com.dmarcradar.geo.GeoLookupResult;
import com.dmarcradar.geo.GeoProviderException;
import com.dmarcradar.geo.GeolocationService;
import com.dmarcradar.geo.queue.IpLookupQueueService;
import com.dmarcradar.ingestion.archive.ReportArchiveExtractor;
import com.dmarcradar.ingestion.config.IngestionProperties;
import com.dmarcradar.ingestion.normalizer.DmarcReportNormalizer;
import com.dmarcradar.ingestion.normalizer.ParsedReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Upload pipeline: extract, normalize, upsert the report by reportId (records of a re-uploaded report are
 * replaced), classify every record, then geolocate inline or hand the IPs to the lookup queue.
 */
@Service
@Slf4j
public class ReportIngestionService {

    private final ReportArchiveExtractor reportArchiveExtractor;
    private final DmarcReportNormalizer dmarcReportNormalizer;
    private final ForwardingClassifier forwardingClassifier;
    private final DmarcReportRepository dmarcReportRepository;
    private final DmarcRecordRepository dmarcRecordRepository;
    private final GeolocationService geolocationService;
    private final IpLookupQueueService ipLookupQueueService;
    private final AtomicBoolean asyncGeoLookup;

    public ReportIngestionService(ReportArchiveExtractor reportArchiveExtractor,
                                  DmarcReportNormalizer dmarcReportNormalizer,
                                  ForwardingClassifier forwardingClassifier,
                                  DmarcReportRepository dmarcReportRepository,
                                  DmarcRecordRepository dmarcRecordRepository,
                                  GeolocationService geolocationService,
                                  IpLookupQueueService ipLookupQueueService,
                                  IngestionProperties ingestionProperties) {
        this.reportArchiveExtractor = reportArchiveExtractor;
        this.dmarcReportNormalizer = dmarcReportNormalizer;
        this.forwardingClassifier = forwardingClassifier;
        this.dmarcReportRepository = dmarcReportRepository;
        this.dmarcRecordRepository = dmarcRecordRepository;
        this.geolocationService = geolocationService;
        this.ipLookupQueueService = ipLookupQueueService;
        this.asyncGeoLookup = new AtomicBoolean(ingestionProperties.isAsyncGeoLookup());
    }

    /**
     * @throws InvalidReportInputException when the file cannot be decoded or carries no report id
     */
    public IngestionResult ingest(byte[] content, String fileName) {
        String xml = reportArchiveExtractor.extract(content, extensionOf(fileName));
        ParsedReport parsed = dmarcReportNormalizer.normalize(xml);
        DmarcReport incoming = parsed.report();
        if (incoming.getReportId() == null || incoming.getReportId().isBlank()) {
            throw new InvalidReportInputException("Report has no report_id");
        }

        Instant now = Instant.now();
        DmarcReport report = dmarcReportRepository.findByReportId(incoming.getReportId()).orElse(null);
        boolean replaced = report != null;
        if (replaced) {
            copyHeader(incoming, report);
            long removed = dmarcRecordRepository.deleteByDmarcReportId(report.getId());
            log.info("Report {} re-uploaded; replacing {} records", report.getReportId(), removed);
        } else {
            report = incoming;
            report.setCreatedAt(now);
        }
        report.setUpdatedAt(now);
        DmarcReport saved = dmarcReportRepository.save(report);

        List<DmarcRecord> records = parsed.records();
        for (DmarcRecord record : records) {
            record.setDmarcReportId(saved.getId());
            ForwardingVerdict verdict = forwardingClassifier.classify(record);
            record.setForwarded(verdict.forwarded());
            record.setForwardReason(verdict.reason());
            record.setReprocessed(true);
            record.setGeoLookupStatus(GeoLookupStatus.PENDING);
        }

        boolean queued = asyncGeoLookup.get();
        if (!queued) {
            resolveInline(records);
        }
        List<DmarcRecord> stored = dmarcRecordRepository.saveAll(records);
        int queuedIps = enqueueUnresolved(stored, queued);

        log.info("Ingested report {} from {} ({} records, {} IPs queued)",
                saved.getReportId(), saved.getOrgName(), stored.size(), queuedIps);
        return new IngestionResult(saved.getId(), saved.getReportId(), saved.getOrgName(), saved.getDomain(),
                stored.size(), replaced, queuedIps);
    }

    public boolean isAsyncGeoLookup() {
        return asyncGeoLookup.get();
    }

    public void setAsyncGeoLookup(boolean async) {
        asyncGeoLookup.set(async);
        log.info("Geolocation during ingestion: {}", async ? "queued" : "inline");
    }

    private void resolveInline(List<DmarcRecord> records) {
        Map<String, List<DmarcRecord>> byIp = groupByIp(records);
        for (Map.Entry<String, List<DmarcRecord>> e : byIp.entrySet()) {
            try {
                GeoLookupResult result = geolocationService.lookup(e.getKey());
                Instant at = Instant.now();
                for (DmarcRecord r : e.getValue()) {
                    if (result.isFound()) {
                        r.applyGeoLocation(result.data(), at);
                    } else {
                        r.setGeoLookupStatus(GeoLookupStatus.FAILED);
                    }
                }
            } catch (GeoProviderException ex) {
                // left PENDING; picked up by the queue after save
                log.warn("Inline lookup of {} failed: {}", e.getKey(), ex.getMessage());
            }
        }
    }

    /** Queues records still PENDING (all of them in queued mode, provider failures in inline mode). */
    private int enqueueUnresolved(List<DmarcRecord> stored, boolean queuedMode) {
        Map<String, List<String>> idsByIp = new LinkedHashMap<>();
        for (DmarcRecord r : stored) {
            if (r.getSourceIp() == null || r.getGeoCountry() != null || r.getGeoLookupStatus() != GeoLookupStatus.PENDING) {
                continue;
            }
            idsByIp.computeIfAbsent(r.getSourceIp(), k -> new ArrayList<>()).add(r.getId());
        }
        if (idsByIp.isEmpty()) {
            return 0;
        }
        ipLookupQueueService.enqueueAll(idsByIp,
                queuedMode ? IpLookupQueueService.PRIORITY_HIGH : IpLookupQueueService.PRIORITY_NORMAL);
        return idsByIp.size();
    }

    private static Map<String, List<DmarcRecord>> groupByIp(List<DmarcRecord> records) {
        Map<String, List<DmarcRecord>> byIp = new LinkedHashMap<>();
        for (DmarcRecord r : records) {
            if (r.getSourceIp() != null) {
                byIp.computeIfAbsent(r.getSourceIp(), k -> new ArrayList<>()).add(r);
            }
        }
        return byIp;
    }

    /** Original XML of an existing report is kept as first received. */
    private static void copyHeader(DmarcReport from, DmarcReport to) {
        to.setOrgName(from.getOrgName());
        to.setEmail(from.getEmail());
        to.setDomain(from.getDomain());
        to.setPolicy(from.getPolicy());
        to.setBeginDate(from.getBeginDate());
        to.setEndDate(from.getEndDate());
        if (to.getOriginalXml() == null) {
            to.setOriginalXml(from.getOriginalXml());
        }
    }

    /** "report.xml.gz" gives "gz"; no extension gives "". */
    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
