package com.starscape.offlineocr.features.languages.infra;

import com.starscape.offlineocr.common.exception.InvalidArtifactException;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;

/**
 * Unpacks artifact payloads. Language data is usually distributed gzip-compressed;
 * plain payloads are passed through unchanged. Payloads that are markup (an HTML error page
 * served with 200 OK, an XML listing) are rejected instead of being cached as model data.
 */
public final class ArtifactArchives {
    
    private ArtifactArchives() {
    }
    
    public static byte[] decode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new InvalidArtifactException("Artifact is empty");
        }
        
        byte[] payload = isGzip(raw) ? gunzip(raw) : raw;
        if (payload.length == 0) {
            throw new InvalidArtifactException("Artifact decompressed to zero bytes");
        }
        if (looksLikeMarkup(payload)) {
            throw new InvalidArtifactException("Artifact is an HTML or XML document, not language data");
        }
        return payload;
    }
    
    public static String checksum(byte[] payload) {
        return DigestUtils.sha256Hex(payload);
    }
    
    static boolean isGzip(byte[] data) {
        return data.length >= 2
                && (data[0] & 0xff) == (GZIPInputStream.GZIP_MAGIC & 0xff)
                && (data[1] & 0xff) == ((GZIPInputStream.GZIP_MAGIC >> 8) & 0xff);
    }
    
    static boolean looksLikeMarkup(byte[] data) {
        int i = 0;
        // UTF-8 byte order mark
        if (data.length >= 3 && (data[0] & 0xff) == 0xef && (data[1] & 0xff) == 0xbb && (data[2] & 0xff) == 0xbf) {
            i = 3;
        }
        while (i < data.length && Character.isWhitespace(data[i])) {
            i++;
        }
        return i < data.length && data[i] == '<';
    }
    
    private static byte[] gunzip(byte[] compressed) {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new InvalidArtifactException("Artifact is not a readable gzip archive: " + e.getMessage(), e);
        }
    }
}
