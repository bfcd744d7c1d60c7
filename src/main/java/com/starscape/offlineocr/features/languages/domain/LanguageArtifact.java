package com.starscape.offlineocr.features.languages.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A recognition-model resource for one language, keyed by its code (eng, deu, chi_sim...).
 * The bytes live in the artifact store; this only records where and whether they are there.
 */
public record LanguageArtifact(
    String code,
    String label,
    ArtifactOrigin origin,
    String storageKey,
    boolean cached,
    String checksum
) {
    
    public static final String STORAGE_SUFFIX = ".traineddata";
    
    private static final Pattern CODE_PATTERN = Pattern.compile("[a-z0-9_]+");
    
    public LanguageArtifact {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            throw new IllegalArgumentException("Invalid language code: " + code);
        }
        if (origin == null) {
            throw new IllegalArgumentException("Origin is required");
        }
        if (storageKey == null || storageKey.isBlank()) {
            storageKey = storageKeyFor(code);
        }
        if (label == null || label.isBlank()) {
            label = code.toUpperCase(Locale.ROOT);
        }
    }
    
    public static LanguageArtifact builtin(String code, String label) {
        return new LanguageArtifact(normalizeCode(code), label, ArtifactOrigin.BUILTIN, null, false, null);
    }
    
    /**
     * An imported artifact. A null label falls back to the upper-cased code.
     */
    public static LanguageArtifact imported(String code, String label, String checksum) {
        return new LanguageArtifact(normalizeCode(code), label, ArtifactOrigin.IMPORTED, null, true, checksum);
    }
    
    public LanguageArtifact asCached(String checksum) {
        return new LanguageArtifact(code, label, origin, storageKey, true, checksum != null ? checksum : this.checksum);
    }
    
    public LanguageArtifact asEvicted() {
        return new LanguageArtifact(code, label, origin, storageKey, false, null);
    }
    
    public static String storageKeyFor(String code) {
        return code + STORAGE_SUFFIX;
    }
    
    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toLowerCase(Locale.ROOT);
    }
    
    public static boolean isValidCode(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }
}
