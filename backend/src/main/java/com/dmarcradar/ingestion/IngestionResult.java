package com.dmarcradar.ingestion;

/**
 * Summary of one ingested report.
 *
 * @param replaced   true when a report with the same reportId existed and its records were replaced
 * @param queuedIps  distinct IPs handed to the lookup queue (0 in inline mode)
 */
public record IngestionResult(String id, String reportId, String orgName, String domain,
                              int recordCount, boolean replaced, int queuedIps) {
}
