package com.dmarcradar.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * auth_results/spf entry, stored as parsed.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class SpfResult {

    private String domain;
    /** helo or mfrom. */
    private String scope;
    private String result;

    public boolean isPass() {
        return "pass".equalsIgnoreCase(result);
    }
}
