package com.dmarcradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One &lt;record&gt; row of a DMARC report with its auth sub-results embedded.
 * dmarcDkim/dmarcSpf come from policy_evaluated only; the raw auth results never fill them in.
 * forwarded is tri-state: TRUE, FALSE, or null when the evidence is insufficient.
 */
@Document(collection = "dmarc_records")
@CompoundIndex(name = "reprocessed_id", def = "{'reprocessed': 1, '_id': 1}")
@CompoundIndex(name = "geo_status_ip", def = "{'geoLookupStatus': 1, 'sourceIp': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DmarcRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;

    @Indexed
    private String dmarcReportId;

    private String sourceIp;
    private Integer count;
    private Disposition disposition;
    private AuthOutcome dmarcDkim;
    private AuthOutcome dmarcSpf;
    private boolean dkimMissing;

    private String envelopeTo;
    private String envelopeFrom;
    private String headerFrom;

    /** Primary (first) policy override reason. */
    private String reasonType;
    private String reasonComment;

    private List<DkimResult> dkimResults = new ArrayList<>();
    private List<SpfResult> spfResults = new ArrayList<>();
    private List<PolicyOverrideReason> policyOverrideReasons = new ArrayList<>();

    private String geoCountry;
    private String geoCountryName;
    private String geoCity;
    private Double geoLatitude;
    private Double geoLongitude;
    private String geoIsp;
    private String geoOrg;

    private Boolean forwarded;
    private String forwardReason;
    private boolean reprocessed;
    /** Reprocessing job that last classified this record; drives exact counters on resume. */
    @Indexed
    private String reprocessedByJobId;

    private GeoLookupStatus geoLookupStatus;
    private int geoLookupAttempts;
    private Instant geoLookupLastAttempt;
    private Instant geoLookupCompletedAt;

    public enum Disposition {
        NONE,
        QUARANTINE,
        REJECT
    }

    public enum AuthOutcome {
        PASS,
        FAIL
    }

    public void applyGeoLocation(GeoLocationData data, Instant completedAt) {
        geoCountry = data.getCountry();
        geoCountryName = data.getCountryName();
        geoCity = data.getCity();
        geoLatitude = data.getLatitude();
        geoLongitude = data.getLongitude();
        geoIsp = data.getIsp();
        geoOrg = data.getOrg();
        geoLookupStatus = GeoLookupStatus.COMPLETED;
        geoLookupCompletedAt = completedAt;
    }
}
