package com.dmarcradar.classification;

/**
 * Classifier output. forwarded is null when the evidence is insufficient; reason is set only for positive verdicts.
 */
public record ForwardingVerdict(Boolean forwarded, String reason) {

    private static final ForwardingVerdict UNKNOWN = new ForwardingVerdict(null, null);
    private static final ForwardingVerdict NOT_FORWARDED = new ForwardingVerdict(Boolean.FALSE, null);

    public static ForwardingVerdict unknown() {
        return UNKNOWN;
    }

    public static ForwardingVerdict notForwarded() {
        return NOT_FORWARDED;
    }

    public static ForwardingVerdict forwarded(String reason) {
        return new ForwardingVerdict(Boolean.TRUE, reason);
    }
}
