package com.dmarcradar.api.dto;

import com.dmarcradar.classification.sender.ThirdPartySenderCommand;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * PUT /api/v1/third-party-senders/{id} request body. Omitted fields keep their stored value.
 */
public record UpdateThirdPartySenderRequest(
        @Size(min = 1, max = 200, message = "INVALID_NAME")
        @Pattern(regexp = ".*\\S.*", message = "INVALID_NAME")
        String name,

        @Size(max = 1000)
        String description,

        @Size(max = 500, message = "INVALID_PATTERN")
        String dkimPattern,

        @Size(max = 500, message = "INVALID_PATTERN")
        String spfPattern,

        Boolean enabled
) {

    public ThirdPartySenderCommand toCommand() {
        return new ThirdPartySenderCommand(name != null ? name.strip() : null, description, dkimPattern, spfPattern, enabled);
    }
}
