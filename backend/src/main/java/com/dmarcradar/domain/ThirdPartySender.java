package com.dmarcradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Known legitimate sending service (e.g. an ESP). A DKIM or SPF domain matching one of its patterns is
 * treated as authorized infrastructure rather than a forwarder.
 */
@Document(collection = "third_party_senders")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ThirdPartySender {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private String description;
    /** Case-insensitive regex matched against DKIM signing domains; blank means never. */
    private String dkimPattern;
    /** Case-insensitive regex matched against SPF domains; blank means never. */
    private String spfPattern;
    private boolean enabled = true;
    private Instant createdAt;
    private Instant updatedAt;
}
