package com.starscape.offlineocr.features.languages.api.dto;

import com.starscape.offlineocr.features.languages.domain.LanguageArtifact;

/**
 * A language the caller can request for recognition.
 */
public record LanguageResponse(
    String code,
    String label,
    String origin,
    boolean cached,
    String checksum
) {
    public static LanguageResponse from(LanguageArtifact artifact) {
        return new LanguageResponse(
            artifact.code(),
            artifact.label(),
            artifact.origin().name(),
            artifact.cached(),
            artifact.checksum()
        );
    }
}
