package com.dmarcradar.ingestion.normalizer;

import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.DmarcReport;

import java.util.List;

/**
 * Normalizer output: the report header and one unsaved record per &lt;record&gt; element, in document order.
 */
public record ParsedReport(DmarcReport report, List<DmarcRecord> records) {
}
