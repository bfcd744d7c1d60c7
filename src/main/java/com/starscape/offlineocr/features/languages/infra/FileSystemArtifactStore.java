package com.starscape.offlineocr.features.languages.infra;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Artifact store backed by a directory laid out the way Tesseract expects its tessdata folder.
 * Writes go to a temporary file first and are moved into place, so a crash mid-write leaves
 * only a stray .part file behind.
 */
@Component
public class FileSystemArtifactStore implements ArtifactStore {
    
    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);
    private static final String PARTIAL_SUFFIX = ".part";
    
    private final Path root;
    
    public FileSystemArtifactStore(ArtifactProperties artifactProperties) {
        this.root = artifactProperties.getCacheDir().toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create artifact cache directory: " + root, e);
        }
        log.info("Artifact cache directory: {}", root);
    }
    
    @Override
    public boolean contains(String key) {
        Path path = resolve(key);
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            log.debug("Could not stat cached artifact {}: {}", path, e.getMessage());
            return false;
        }
    }
    
    @Override
    public void write(String key, byte[] data) throws IOException {
        Path target = resolve(key);
        Path temp = Files.createTempFile(root, key + ".", PARTIAL_SUFFIX);
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Stored artifact: key={}, bytes={}", key, data.length);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
    
    @Override
    public byte[] read(String key) throws IOException {
        return Files.readAllBytes(resolve(key));
    }
    
    @Override
    public List<String> keys() {
        try (Stream<Path> files = Files.list(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(LanguageArtifact.STORAGE_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list artifact cache directory: " + root, e);
        }
    }
    
    @Override
    public Path root() {
        return root;
    }
    
    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.getParent().equals(root)) {
            throw new IllegalArgumentException("Artifact key escapes the cache directory: " + key);
        }
        return path;
    }
}
