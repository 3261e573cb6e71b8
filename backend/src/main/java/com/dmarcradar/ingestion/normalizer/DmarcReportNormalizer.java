package com.dmarcradar.ingestion.normalizer;

import com.dmarcradar.domain.DkimResult;
import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.DmarcReport;
import com.dmarcradar.domain.PolicyOverrideReason;
import com.dmarcradar.domain.SpfResult;
import com.dmarcradar.ingestion.InvalidReportInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses RFC 7489 aggregate feedback XML into a report header and record drafts.
 * Tag names are accepted in snake_case (per the RFC) and camelCase (seen from some reporters); single
 * elements and repeated elements are read the same way. Missing elements leave fields null; only input
 * that is not XML at all is rejected.
 */
@Component
@Slf4j
public class DmarcReportNormalizer {

    private final XmlMapper xmlMapper = new XmlMapper();

    public ParsedReport normalize(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new InvalidReportInputException("Invalid XML content");
        }
        JsonNode root;
        try {
            root = xmlMapper.readTree(xml.strip());
        } catch (JsonProcessingException e) {
            throw new InvalidReportInputException("Failed to parse XML content", e);
        }
        JsonNode feedback = unwrapRoot(root);

        DmarcReport report = new DmarcReport();
        report.setOriginalXml(xml);
        JsonNode metadata = field(feedback, "report_metadata");
        report.setOrgName(text(metadata, "org_name"));
        report.setEmail(text(metadata, "email"));
        report.setReportId(text(metadata, "report_id"));
        JsonNode dateRange = field(metadata, "date_range");
        report.setBeginDate(epochSeconds(text(dateRange, "begin")));
        report.setEndDate(epochSeconds(text(dateRange, "end")));

        JsonNode policyPublished = field(feedback, "policy_published");
        report.setDomain(text(policyPublished, "domain"));
        report.setPolicy(flatten(policyPublished));

        List<DmarcRecord> records = new ArrayList<>();
        JsonNode recordNodes = field(feedback, "record");
        if (recordNodes.isMissingNode()) {
            recordNodes = field(feedback, "records");
        }
        for (JsonNode recordNode : asList(recordNodes)) {
            records.add(normalizeRecord(recordNode));
        }
        log.debug("Parsed report {} from {} with {} records", report.getReportId(), report.getOrgName(), records.size());
        return new ParsedReport(report, records);
    }

    private static JsonNode unwrapRoot(JsonNode root) {
        if (root == null || !root.isObject()) {
            return MissingNode.getInstance();
        }
        for (String wrapper : List.of("feedback", "report")) {
            JsonNode inner = root.path(wrapper);
            if (inner.isObject() && (inner.has("record") || inner.has("report_metadata") || inner.has("reportMetadata"))) {
                return inner;
            }
        }
        return root;
    }

    private DmarcRecord normalizeRecord(JsonNode node) {
        DmarcRecord r = new DmarcRecord();
        JsonNode row = field(node, "row");
        r.setSourceIp(text(row, "source_ip"));
        r.setCount(integer(text(row, "count")));

        JsonNode evaluated = field(row, "policy_evaluated");
        r.setDisposition(disposition(text(evaluated, "disposition")));
        r.setDmarcDkim(outcome(text(evaluated, "dkim")));
        r.setDmarcSpf(outcome(text(evaluated, "spf")));
        List<PolicyOverrideReason> reasons = new ArrayList<>();
        for (JsonNode reason : asList(field(evaluated, "reason"))) {
            String type = text(reason, "type");
            String comment = text(reason, "comment");
            if (type != null || comment != null) {
                reasons.add(new PolicyOverrideReason(lower(type), comment));
            }
        }
        r.setPolicyOverrideReasons(reasons);
        if (!reasons.isEmpty()) {
            r.setReasonType(reasons.get(0).getType());
            r.setReasonComment(reasons.get(0).getComment());
        }

        JsonNode identifiers = field(node, "identifiers");
        if (identifiers.isMissingNode()) {
            identifiers = field(node, "identities");
        }
        r.setEnvelopeTo(text(identifiers, "envelope_to"));
        r.setEnvelopeFrom(text(identifiers, "envelope_from"));
        r.setHeaderFrom(lower(text(identifiers, "header_from")));

        JsonNode auth = field(node, "auth_results");
        List<DkimResult> dkim = new ArrayList<>();
        for (JsonNode d : asList(field(auth, "dkim"))) {
            dkim.add(new DkimResult(lower(text(d, "domain")), text(d, "selector"),
                    lower(text(d, "result")), text(d, "human_result")));
        }
        List<SpfResult> spf = new ArrayList<>();
        for (JsonNode s : asList(field(auth, "spf"))) {
            spf.add(new SpfResult(lower(text(s, "domain")), lower(text(s, "scope")), lower(text(s, "result"))));
        }
        r.setDkimResults(dkim);
        r.setSpfResults(spf);
        r.setDkimMissing(dkim.isEmpty());
        return r;
    }

    /**
     * Child by snake_case name, falling back to its camelCase form.
     */
    static JsonNode field(JsonNode node, String snakeName) {
        if (node == null || !node.isObject()) {
            return MissingNode.getInstance();
        }
        JsonNode value = node.get(snakeName);
        if (value == null) {
            value = node.get(camel(snakeName));
        }
        return value == null ? MissingNode.getInstance() : value;
    }

    static String camel(String snake) {
        StringBuilder sb = new StringBuilder(snake.length());
        boolean upper = false;
        for (char c : snake.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }

    /**
     * Text of a child; a list contributes its first element, an element with attributes its text content.
     */
    static String text(JsonNode node, String snakeName) {
        return valueText(field(node, snakeName));
    }

    private static String valueText(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            return value.isEmpty() ? null : valueText(value.get(0));
        }
        if (value.isObject()) {
            return valueText(value.get(""));
        }
        String s = value.asText().strip();
        return s.isEmpty() ? null : s;
    }

    static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(out::add);
        } else {
            out.add(node);
        }
        return out;
    }

    private static Map<String, String> flatten(JsonNode node) {
        Map<String, String> map = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return map;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String value = valueText(e.getValue());
            if (value != null) {
                map.put(e.getKey(), value);
            }
        }
        return map;
    }

    private static DmarcRecord.Disposition disposition(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "none" -> DmarcRecord.Disposition.NONE;
            case "quarantine" -> DmarcRecord.Disposition.QUARANTINE;
            case "reject" -> DmarcRecord.Disposition.REJECT;
            default -> null;
        };
    }

    private static DmarcRecord.AuthOutcome outcome(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "pass" -> DmarcRecord.AuthOutcome.PASS;
            case "fail" -> DmarcRecord.AuthOutcome.FAIL;
            default -> null;
        };
    }

    private static Instant epochSeconds(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric date_range value {}", value);
            return null;
        } catch (DateTimeException e) {
            log.debug("Ignoring out-of-range date_range value {}", value);
            return null;
        }
    }

    private static Integer integer(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
