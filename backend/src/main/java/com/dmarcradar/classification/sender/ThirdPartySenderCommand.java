package com.dmarcradar.classification.sender;

/**
 * Create/update input. On update a null field leaves the stored value unchanged.
 */
public record ThirdPartySenderCommand(String name, String description, String dkimPattern, String spfPattern,
                                      Boolean enabled) {
}
