package com.dmarcradar.ingestion;

import com.dmarcradar.classification.ForwardingClassifier;
import com.dmarcradar.classification.ForwardingVerdict;
import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.DmarcRecordRepository;
import com.dmarcradar.domain.DmarcReport;
import com.dmarcradar.domain.DmarcReportRepository;
import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.domain.GeoLookupStatus;
import com.dmarcradar.geo.GeoLookupResult;
import com.dmarcradar.geo.GeoProviderException;
import com.dmarcradar.geo.GeolocationService;
import com.dmarcradar.geo.queue.IpLookupQueueService;
import com.dmarcradar.ingestion.archive.ReportArchiveExtractor;
import com.dmarcradar.ingestion.config.IngestionProperties;
import com.dmarcradar.ingestion.normalizer.DmarcReportNormalizer;
import com.dmarcradar.ingestion.normalizer.ParsedReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportIngestionServiceTest {

    private static final byte[] BYTES = "<feedback/>".getBytes(StandardCharsets.UTF_8);

    @Mock
    ReportArchiveExtractor reportArchiveExtractor;
    @Mock
    DmarcReportNormalizer dmarcReportNormalizer;
    @Mock
    ForwardingClassifier forwardingClassifier;
    @Mock
    DmarcReportRepository dmarcReportRepository;
    @Mock
    DmarcRecordRepository dmarcRecordRepository;
    @Mock
    GeolocationService geolocationService;
    @Mock
    IpLookupQueueService ipLookupQueueService;

    ReportIngestionService service;

    @BeforeEach
    void setUp() {
        service = new ReportIngestionService(reportArchiveExtractor, dmarcReportNormalizer, forwardingClassifier,
                dmarcReportRepository, dmarcRecordRepository, geolocationService, ipLookupQueueService,
                new IngestionProperties());
    }

    @Test
    @DisplayName("new report is saved, records classified and their IPs queued at high priority")
    void newReportQueued() {
        givenParsed(report("rid-1", "<xml-v1/>"), record("8.8.8.8"), record("8.8.8.8"), record("1.1.1.1"));
        when(dmarcReportRepository.findByReportId("rid-1")).thenReturn(Optional.empty());
        whenSavingReportAssignId("rep-1");
        whenSavingRecordsAssignIds();
        when(forwardingClassifier.classify(any())).thenReturn(ForwardingVerdict.notForwarded());

        IngestionResult result = service.ingest(BYTES, "google.com!example.com.xml.gz");

        verify(reportArchiveExtractor).extract(BYTES, "gz");
        assertThat(result.replaced()).isFalse();
        assertThat(result.recordCount()).isEqualTo(3);
        assertThat(result.queuedIps()).isEqualTo(2);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, List<String>>> queued = ArgumentCaptor.forClass(Map.class);
        verify(ipLookupQueueService).enqueueAll(queued.capture(), eq(IpLookupQueueService.PRIORITY_HIGH));
        assertThat(queued.getValue()).containsOnlyKeys("8.8.8.8", "1.1.1.1");
        assertThat(queued.getValue().get("8.8.8.8")).containsExactly("id-0", "id-1");
        verify(geolocationService, never()).lookup(any());
    }

    @Test
    @DisplayName("re-upload replaces the records and keeps the first original XML")
    void reUploadReplacesRecords() {
        DmarcReport existing = report("rid-2", "<xml-v1/>");
        existing.setId("rep-2");
        givenParsed(report("rid-2", "<xml-v2/>"), record("8.8.8.8"));
        when(dmarcReportRepository.findByReportId("rid-2")).thenReturn(Optional.of(existing));
        when(dmarcReportRepository.save(existing)).thenReturn(existing);
        whenSavingRecordsAssignIds();
        when(forwardingClassifier.classify(any())).thenReturn(ForwardingVerdict.forwarded("fwd"));

        IngestionResult result = service.ingest(BYTES, "report.xml");

        assertThat(result.replaced()).isTrue();
        assertThat(result.id()).isEqualTo("rep-2");
        assertThat(existing.getOriginalXml()).isEqualTo("<xml-v1/>");
        verify(dmarcRecordRepository).deleteByDmarcReportId("rep-2");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DmarcRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(dmarcRecordRepository).saveAll(saved.capture());
        DmarcRecord r = saved.getValue().get(0);
        assertThat(r.getDmarcReportId()).isEqualTo("rep-2");
        assertThat(r.getForwarded()).isTrue();
        assertThat(r.getForwardReason()).isEqualTo("fwd");
        assertThat(r.isReprocessed()).isTrue();
    }

    @Test
    @DisplayName("inline mode geolocates before saving and queues only provider failures")
    void inlineMode() {
        service.setAsyncGeoLookup(false);
        givenParsed(report("rid-3", "<x/>"), record("8.8.8.8"), record("9.9.9.9"), record("10.0.0.1"));
        when(dmarcReportRepository.findByReportId("rid-3")).thenReturn(Optional.empty());
        whenSavingReportAssignId("rep-3");
        whenSavingRecordsAssignIds();
        when(forwardingClassifier.classify(any())).thenReturn(ForwardingVerdict.unknown());
        when(geolocationService.lookup("8.8.8.8"))
                .thenReturn(new GeoLookupResult(GeoLocationData.builder().country("US").build(), "ip-api", true));
        when(geolocationService.lookup("9.9.9.9")).thenThrow(new GeoProviderException("down"));
        when(geolocationService.lookup("10.0.0.1")).thenReturn(GeoLookupResult.notFound(false));

        IngestionResult result = service.ingest(BYTES, "report.xml");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DmarcRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(dmarcRecordRepository).saveAll(saved.capture());
        List<DmarcRecord> records = saved.getValue();
        assertThat(records.get(0).getGeoCountry()).isEqualTo("US");
        assertThat(records.get(0).getGeoLookupStatus()).isEqualTo(GeoLookupStatus.COMPLETED);
        assertThat(records.get(1).getGeoLookupStatus()).isEqualTo(GeoLookupStatus.PENDING);
        assertThat(records.get(2).getGeoLookupStatus()).isEqualTo(GeoLookupStatus.FAILED);
        assertThat(result.queuedIps()).isEqualTo(1);
        verify(ipLookupQueueService).enqueueAll(Map.of("9.9.9.9", List.of("id-1")), IpLookupQueueService.PRIORITY_NORMAL);
    }

    @Test
    void missingReportIdRejected() {
        givenParsed(report(" ", "<x/>"));

        assertThatThrownBy(() -> service.ingest(BYTES, "r.xml"))
                .isInstanceOf(InvalidReportInputException.class)
                .hasMessageContaining("report_id");
        verify(dmarcReportRepository, never()).save(any());
        verify(ipLookupQueueService, never()).enqueueAll(anyMap(), anyInt());
        verify(dmarcRecordRepository, never()).saveAll(anyList());
    }

    @Test
    void extensionOf() {
        assertThat(ReportIngestionService.extensionOf("a.XML")).isEqualTo("xml");
        assertThat(ReportIngestionService.extensionOf("report.xml.gz")).isEqualTo("gz");
        assertThat(ReportIngestionService.extensionOf("noext")).isEmpty();
        assertThat(ReportIngestionService.extensionOf("trailing.")).isEmpty();
        assertThat(ReportIngestionService.extensionOf(null)).isEmpty();
    }

    private void givenParsed(DmarcReport report, DmarcRecord... records) {
        when(reportArchiveExtractor.extract(any(), any())).thenReturn("<feedback/>");
        when(dmarcReportNormalizer.normalize("<feedback/>"))
                .thenReturn(new ParsedReport(report, new ArrayList<>(List.of(records))));
    }

    private void whenSavingReportAssignId(String id) {
        when(dmarcReportRepository.save(any(DmarcReport.class))).thenAnswer(inv -> {
            DmarcReport r = inv.getArgument(0);
            r.setId(id);
            return r;
        });
    }

    private void whenSavingRecordsAssignIds() {
        when(dmarcRecordRepository.saveAll(anyList())).thenAnswer(inv -> {
            List<DmarcRecord> records = inv.getArgument(0);
            for (int i = 0; i < records.size(); i++) {
                records.get(i).setId("id-" + i);
            }
            return records;
        });
    }

    private static DmarcReport report(String reportId, String xml) {
        DmarcReport r = new DmarcReport();
        r.setReportId(reportId);
        r.setOrgName("google.com");
        r.setDomain("example.com");
        r.setOriginalXml(xml);
        return r;
    }

    private static DmarcRecord record(String ip) {
        DmarcRecord r = new DmarcRecord();
        r.setSourceIp(ip);
        r.setHeaderFrom("example.com");
        return r;
    }
}
