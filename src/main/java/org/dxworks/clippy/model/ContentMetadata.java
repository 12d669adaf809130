package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Capture metadata. Every field is optional; {@code capturedAt} is an ISO-8601 instant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentMetadata(String sourceUrl, String sourceDomain, String capturedAt, OriginalFormat originalFormat) {
}
