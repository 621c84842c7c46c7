package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads extracted text files stored under {@code app.library.path}, addressed by each paper's text path.
 */
@Component
@Slf4j
public class LibraryFullTextStore implements FullTextStore {

    private final AppConfigurationProperties properties;

    public LibraryFullTextStore(AppConfigurationProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> readText(Paper paper) {
        String libraryPath = properties.getLibrary().getPath();
        if (paper == null || !ValidationUtils.hasText(paper.getTextPath()) || !ValidationUtils.hasText(libraryPath)) {
            return Optional.empty();
        }
        Path root = Path.of(libraryPath).toAbsolutePath().normalize();
        Path file = root.resolve(paper.getTextPath()).normalize();
        if (!file.startsWith(root)) {
            log.warn("Ignoring text path outside the library for paper {}: {}", paper.getId(), paper.getTextPath());
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read text for paper " + paper.getId(), e);
        }
    }
}
