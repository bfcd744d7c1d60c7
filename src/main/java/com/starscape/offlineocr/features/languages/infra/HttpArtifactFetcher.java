package com.starscape.offlineocr.features.languages.infra;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;

/**
 * Fetches artifacts over HTTP from {base-url}/{remote-prefix}{code}{remote-suffix}.
 */
@Component
@ConditionalOnProperty(name = "app.artifacts.source", havingValue = "http", matchIfMissing = true)
public class HttpArtifactFetcher implements ArtifactFetcher {
    
    private static final Logger log = LoggerFactory.getLogger(HttpArtifactFetcher.class);
    
    private final RestClient restClient;
    private final ArtifactProperties artifactProperties;
    
    public HttpArtifactFetcher(RestClient.Builder restClientBuilder, ArtifactProperties artifactProperties) {
        this.restClient = restClientBuilder.baseUrl(artifactProperties.getBaseUrl()).build();
        this.artifactProperties = artifactProperties;
    }
    
    @Override
    public byte[] fetch(String code) throws IOException {
        String path = "/" + artifactProperties.remoteKey(code);
        log.debug("Downloading artifact: {}{}", artifactProperties.getBaseUrl(), path);
        
        byte[] body;
        try {
            body = restClient.get()
                    .uri(path)
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            throw new IOException("GET " + path + " failed: " + e.getMessage(), e);
        }
        
        if (body == null || body.length == 0) {
            throw new IOException("GET " + path + " returned no content");
        }
        return body;
    }
}
