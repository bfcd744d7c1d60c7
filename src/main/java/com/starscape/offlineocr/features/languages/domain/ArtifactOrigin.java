package com.starscape.offlineocr.features.languages.domain;

public enum ArtifactOrigin {
    BUILTIN,
    IMPORTED
}
