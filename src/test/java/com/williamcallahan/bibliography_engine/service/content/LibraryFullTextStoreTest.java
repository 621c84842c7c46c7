package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.model.Paper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LibraryFullTextStoreTest {

    @TempDir
    Path tempDir;

    private Path library;
    private LibraryFullTextStore store;

    @BeforeEach
    void setUp() throws IOException {
        library = Files.createDirectories(tempDir.resolve("library"));
        AppConfigurationProperties properties = new AppConfigurationProperties();
        properties.getLibrary().setPath(library.toString());
        store = new LibraryFullTextStore(properties);
    }

    private static Paper paperWithText(String textPath) {
        Paper paper = new Paper(1L, "Paper");
        paper.setTextPath(textPath);
        return paper;
    }

    @Test
    void readsTextRelativeToLibrary() throws IOException {
        Files.createDirectories(library.resolve("texts"));
        Files.writeString(library.resolve("texts/one.txt"), "doi:10.1000/xyz", StandardCharsets.UTF_8);

        assertEquals(Optional.of("doi:10.1000/xyz"), store.readText(paperWithText("texts/one.txt")));
    }

    @Test
    void missingFileOrPathIsEmpty() {
        assertTrue(store.readText(paperWithText("texts/absent.txt")).isEmpty());
        assertTrue(store.readText(paperWithText(null)).isEmpty());
    }

    @Test
    void pathsEscapingTheLibraryAreIgnored() throws IOException {
        Files.writeString(tempDir.resolve("secret.txt"), "outside", StandardCharsets.UTF_8);

        assertTrue(store.readText(paperWithText("../secret.txt")).isEmpty());
    }
}
