package com.dmarcradar.ingestion.normalizer;

import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.DmarcReport;
import com.dmarcradar.ingestion.InvalidReportInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DmarcReportNormalizerTest {

    private final DmarcReportNormalizer normalizer = new DmarcReportNormalizer();

    @Test
    @DisplayName("single record report with an override reason")
    void singleRecord() throws IOException {
        ParsedReport parsed = normalizer.normalize(fixture("aggregate-single.xml"));

        DmarcReport report = parsed.report();
        assertThat(report.getReportId()).isEqualTo("13902847104625377214");
        assertThat(report.getOrgName()).isEqualTo("google.com");
        assertThat(report.getDomain()).isEqualTo("example.com");
        assertThat(report.getBeginDate()).isEqualTo(Instant.ofEpochSecond(1709251200L));
        assertThat(report.getPolicy()).containsEntry("p", "quarantine").containsEntry("pct", "100");
        assertThat(report.getOriginalXml()).contains("<feedback>");

        assertThat(parsed.records()).hasSize(1);
        DmarcRecord r = parsed.records().get(0);
        assertThat(r.getSourceIp()).isEqualTo("209.85.220.41");
        assertThat(r.getCount()).isEqualTo(3);
        assertThat(r.getDisposition()).isEqualTo(DmarcRecord.Disposition.NONE);
        assertThat(r.getDmarcDkim()).isEqualTo(DmarcRecord.AuthOutcome.PASS);
        assertThat(r.getDmarcSpf()).isEqualTo(DmarcRecord.AuthOutcome.FAIL);
        assertThat(r.getHeaderFrom()).isEqualTo("example.com");
        assertThat(r.getReasonType()).isEqualTo("forwarded");
        assertThat(r.getReasonComment()).isEqualTo("looks forwarded");
        assertThat(r.getDkimResults()).singleElement()
                .satisfies(d -> assertThat(d.getSelector()).isEqualTo("s1"));
        assertThat(r.getSpfResults()).singleElement()
                .satisfies(s -> assertThat(s.getDomain()).isEqualTo("bounce.lists.example.net"));
        assertThat(r.isDkimMissing()).isFalse();
    }

    @Test
    @DisplayName("camelCase metadata, repeated records and repeated DKIM results")
    void multipleRecords() throws IOException {
        ParsedReport parsed = normalizer.normalize(fixture("aggregate-multi.xml"));

        assertThat(parsed.report().getReportId()).isEqualTo("mr-2024-0042");
        assertThat(parsed.report().getOrgName()).isEqualTo("Mail.Ru");
        assertThat(parsed.report().getDomain()).isEqualTo("example.org");
        assertThat(parsed.report().getEmail()).isNull();
        assertThat(parsed.records()).hasSize(2);

        DmarcRecord first = parsed.records().get(0);
        assertThat(first.getDkimResults()).extracting("domain").containsExactly("example.org", "forwarder.io");
        assertThat(first.getDisposition()).isEqualTo(DmarcRecord.Disposition.REJECT);
        assertThat(first.getPolicyOverrideReasons()).isEmpty();

        DmarcRecord second = parsed.records().get(1);
        assertThat(second.getCount()).isEqualTo(12);
        assertThat(second.getDkimResults()).isEmpty();
        assertThat(second.isDkimMissing()).isTrue();
        assertThat(second.getSpfResults().get(0).getScope()).isEqualTo("mfrom");
    }

    @Test
    void reportWithoutRecords() {
        ParsedReport parsed = normalizer.normalize(
                "<feedback><report_metadata><report_id>empty-1</report_id></report_metadata></feedback>");

        assertThat(parsed.report().getReportId()).isEqualTo("empty-1");
        assertThat(parsed.records()).isEmpty();
    }

    @Test
    @DisplayName("date range beyond the representable instants is left empty")
    void outOfRangeDateRange() {
        ParsedReport parsed = normalizer.normalize("<feedback><report_metadata><report_id>far-1</report_id>"
                + "<date_range><begin>99999999999999999</begin><end>1709337599</end></date_range>"
                + "</report_metadata></feedback>");

        assertThat(parsed.report().getReportId()).isEqualTo("far-1");
        assertThat(parsed.report().getBeginDate()).isNull();
        assertThat(parsed.report().getEndDate()).isEqualTo(Instant.ofEpochSecond(1709337599L));
    }

    @Test
    void notXmlRejected() {
        assertThatThrownBy(() -> normalizer.normalize("{\"json\":true}"))
                .isInstanceOf(InvalidReportInputException.class);
        assertThatThrownBy(() -> normalizer.normalize("  "))
                .isInstanceOf(InvalidReportInputException.class);
    }

    @Test
    void camelCaseConversion() {
        assertThat(DmarcReportNormalizer.camel("report_metadata")).isEqualTo("reportMetadata");
        assertThat(DmarcReportNormalizer.camel("source_ip")).isEqualTo("sourceIp");
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = DmarcReportNormalizerTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
