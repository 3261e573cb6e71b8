package com.dmarcradar.api.dto;

import com.dmarcradar.domain.ThirdPartySender;

import java.time.Instant;

public record ThirdPartySenderResponse(String id, String name, String description, String dkimPattern,
                                       String spfPattern, boolean enabled, Instant createdAt, Instant updatedAt) {

    public static ThirdPartySenderResponse from(ThirdPartySender s) {
        return new ThirdPartySenderResponse(s.getId(), s.getName(), s.getDescription(), s.getDkimPattern(),
                s.getSpfPattern(), s.isEnabled(), s.getCreatedAt(), s.getUpdatedAt());
    }
}
