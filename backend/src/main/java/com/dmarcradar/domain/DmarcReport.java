package com.dmarcradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One DMARC aggregate report (report header only). Records live in dmarc_records, linked by dmarcReportId.
 * Upserted by reportId: re-ingesting the same report replaces header fields and records.
 */
@Document(collection = "dmarc_reports")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DmarcReport {

    @Id
    @EqualsAndHashCode.Include
    private String id;

    @Indexed(unique = true)
    private String reportId;
    private String orgName;
    private String email;
    private String domain;
    /** policy_published as flat key/value pairs (adkim, aspf, p, sp, pct, np, fo). */
    private Map<String, String> policy = new LinkedHashMap<>();
    private Instant beginDate;
    private Instant endDate;
    /** Stored verbatim, never rewritten. */
    private String originalXml;
    private Instant createdAt;
    private Instant updatedAt;
}
