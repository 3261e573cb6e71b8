package com.dmarcradar.classification;

import com.dmarcradar.classification.sender.ThirdPartySenderMatcher;
import com.dmarcradar.domain.DkimResult;
import com.dmarcradar.domain.DmarcRecord;
import com.dmarcradar.domain.PolicyOverrideReason;
import com.dmarcradar.domain.SpfResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a record describes forwarded mail from DKIM/SPF domain evidence alone.
 * Rules, first match wins:
 * <ol>
 *   <li>override reason "forwarded" from the receiver: forwarded;</li>
 *   <li>no header-from: unknown;</li>
 *   <li>any DKIM or SPF domain belongs to an enabled third-party sender: not forwarded;</li>
 *   <li>DKIM from the header-from base domain plus DKIM/SPF from another domain: forwarded (sub-typed by outcomes);</li>
 *   <li>only original DKIM, only foreign auth, or only SPF: not forwarded; otherwise unknown.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ForwardingClassifier {

    static final List<String> KNOWN_FORWARDER_PATTERNS = List.of(
            "onmicrosoft.com",
            "fwd.privateemail.com",
            "forward",
            "relay",
            "mail-forwarding",
            "forwardemail",
            "improvmx.com",
            "mailgun.",
            "sendgrid.",
            "amazonses.com"
    );

    private final ThirdPartySenderMatcher thirdPartySenderMatcher;

    public ForwardingVerdict classify(DmarcRecord record) {
        try {
            return doClassify(record);
        } catch (Exception e) {
            log.error("Forwarding classification failed for record {}: {}",
                    record == null ? null : record.getId(), e.getMessage(), e);
            return ForwardingVerdict.unknown();
        }
    }

    private ForwardingVerdict doClassify(DmarcRecord record) {
        for (PolicyOverrideReason reason : nullSafe(record.getPolicyOverrideReasons())) {
            if ("forwarded".equalsIgnoreCase(reason.getType())) {
                String comment = reason.getComment();
                return ForwardingVerdict.forwarded(comment != null && !comment.isBlank()
                        ? "Explicitly marked as forwarded by recipient's mail server: " + comment
                        : "Explicitly marked as forwarded by recipient's mail server");
            }
        }

        String headerFrom = record.getHeaderFrom();
        if (headerFrom == null || headerFrom.isBlank()) {
            return ForwardingVerdict.unknown();
        }
        String headerFromBase = BaseDomains.of(headerFrom);
        List<DkimResult> dkimResults = nullSafe(record.getDkimResults());
        List<SpfResult> spfResults = nullSafe(record.getSpfResults());

        for (DkimResult dkim : dkimResults) {
            if (hasDomain(dkim.getDomain()) && thirdPartySenderMatcher.matchesDkim(dkim.getDomain()).isPresent()) {
                return ForwardingVerdict.notForwarded();
            }
        }
        for (SpfResult spf : spfResults) {
            if (hasDomain(spf.getDomain()) && thirdPartySenderMatcher.matchesSpf(spf.getDomain()).isPresent()) {
                return ForwardingVerdict.notForwarded();
            }
        }

        List<DkimResult> originalDkim = dkimResults.stream()
                .filter(d -> hasDomain(d.getDomain()) && BaseDomains.of(d.getDomain()).equals(headerFromBase))
                .toList();
        List<DkimResult> forwarderDkim = dkimResults.stream()
                .filter(d -> hasDomain(d.getDomain()) && !BaseDomains.of(d.getDomain()).equals(headerFromBase))
                .toList();
        List<SpfResult> forwarderSpf = spfResults.stream()
                .filter(s -> hasDomain(s.getDomain()) && !BaseDomains.of(s.getDomain()).equals(headerFromBase))
                .toList();

        if (!originalDkim.isEmpty() && (!forwarderDkim.isEmpty() || !forwarderSpf.isEmpty())) {
            return classifyForwardingPattern(originalDkim, forwarderDkim, forwarderSpf);
        }
        if (!originalDkim.isEmpty()) {
            return ForwardingVerdict.notForwarded();
        }
        if (!dkimResults.isEmpty() || !spfResults.isEmpty()) {
            return ForwardingVerdict.notForwarded();
        }
        return ForwardingVerdict.unknown();
    }

    private ForwardingVerdict classifyForwardingPattern(List<DkimResult> originalDkim,
                                                        List<DkimResult> forwarderDkim,
                                                        List<SpfResult> forwarderSpf) {
        boolean originalFailed = originalDkim.stream().allMatch(d -> "fail".equalsIgnoreCase(d.getResult()));
        boolean originalPassed = originalDkim.stream().anyMatch(DkimResult::isPass);
        Optional<String> passingForwarder = forwarderDkim.stream()
                .filter(DkimResult::isPass)
                .map(DkimResult::getDomain)
                .findFirst()
                .or(() -> forwarderSpf.stream().filter(SpfResult::isPass).map(SpfResult::getDomain).findFirst());

        if (originalFailed && passingForwarder.isPresent()) {
            return ForwardingVerdict.forwarded("Email forwarded with modifications (original DKIM signature broken, "
                    + "authenticated by forwarder: " + passingForwarder.get() + ")");
        }
        if (originalPassed && passingForwarder.isPresent()) {
            return ForwardingVerdict.forwarded("Email forwarded without modifications (original DKIM signature preserved, "
                    + "authenticated by forwarder: " + passingForwarder.get() + ")");
        }
        Optional<String> knownForwarder = forwarderDkim.stream()
                .map(DkimResult::getDomain)
                .filter(ForwardingClassifier::isKnownForwarder)
                .findFirst();
        if (knownForwarder.isPresent()) {
            return ForwardingVerdict.forwarded("Email forwarded by known forwarding service: " + knownForwarder.get());
        }
        return ForwardingVerdict.forwarded(
                "Email likely forwarded (DKIM from both original and forwarding domains detected)");
    }

    static boolean isKnownForwarder(String domain) {
        if (domain == null || domain.isEmpty()) {
            return false;
        }
        String lower = domain.toLowerCase(Locale.ROOT);
        return KNOWN_FORWARDER_PATTERNS.stream().anyMatch(lower::contains);
    }

    private static boolean hasDomain(String domain) {
        return domain != null && !domain.isBlank();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
