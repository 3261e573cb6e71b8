package com.dmarcradar.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * auth_results/dkim entry, stored as parsed.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class DkimResult {

    private String domain;
    private String selector;
    /** none, pass, fail, policy, neutral, temperror, permerror. */
    private String result;
    private String humanResult;

    public boolean isPass() {
        return "pass".equalsIgnoreCase(result);
    }
}
