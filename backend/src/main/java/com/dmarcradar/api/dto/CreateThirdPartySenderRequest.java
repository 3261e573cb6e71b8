package com.dmarcradar.api.dto;

import com.dmarcradar.classification.sender.ThirdPartySenderCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * POST /api/v1/third-party-senders request body. Pattern syntax is checked by the service.
 */
public record CreateThirdPartySenderRequest(
        @NotBlank(message = "INVALID_NAME")
        @Size(max = 200, message = "INVALID_NAME")
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
        return new ThirdPartySenderCommand(name.strip(), description, dkimPattern, spfPattern, enabled);
    }
}
