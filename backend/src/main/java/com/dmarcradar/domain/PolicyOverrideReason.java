package com.dmarcradar.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * policy_evaluated/reason entry: forwarded, sampled_out, trusted_forwarder, mailing_list, local_policy, other.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class PolicyOverrideReason {

    private String type;
    private String comment;
}
