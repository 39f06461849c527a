package com.example.rittdoc.service.extraction;

import com.example.rittdoc.dto.conversion.BookMetadata;
import com.example.rittdoc.dto.conversion.EpubPackage;
import com.example.rittdoc.exception.ExtractionException;
import com.example.rittdoc.support.TestBooks;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for reading the EPUB package document.
 */
class EpubPackageReaderTest {

    private final EpubPackageReader reader = new EpubPackageReader();

    @TempDir
    Path tempDir;

    /**
     * Dublin Core metadata is mapped onto the book metadata, with the ISBN taken from its URN.
     */
    @Test
    void readsMetadata() throws Exception {
        EpubPackage epub = reader.read(TestBooks.sampleEpub(tempDir, false));

        BookMetadata metadata = epub.getMetadata();
        assertThat(epub.getSourceName()).isEqualTo("cardiology.epub");
        assertThat(epub.getOpfPath()).isEqualTo("OEBPS/content.opf");
        assertThat(metadata.getTitle()).isEqualTo("Cardiology Basics");
        assertThat(metadata.getAuthors()).containsExactly("Jane Smith", "Doe, John");
        assertThat(metadata.getPublisher()).isEqualTo("Ritt Press");
        assertThat(metadata.getPublicationDate()).isEqualTo("2021");
        assertThat(metadata.getIsbn()).isEqualTo("9781234567897");
        assertThat(metadata.getCopyrightYear()).isEqualTo("2021");
        assertThat(metadata.getCopyrightHolder()).isEqualTo("Ritt Press");
        assertThat(metadata.getLanguage()).isEqualTo("en");
    }

    @Test
    void readsSpineInOrderAndManifestImages() throws Exception {
        EpubPackage epub = reader.read(TestBooks.sampleEpub(tempDir, false));

        assertThat(epub.getSpine()).extracting(EpubPackage.SpineDocument::getPath).containsExactly(
                "OEBPS/intro.xhtml", "OEBPS/chapter1.xhtml", "OEBPS/chapter2.xhtml",
                "OEBPS/text/chapter3.xhtml", "OEBPS/glossary.xhtml");
        assertThat(epub.getSpine().get(1).getContent()).contains("The Heart");
        assertThat(epub.getImages()).extracting(EpubPackage.ManifestImage::getPath).containsExactly(
                "OEBPS/images/heart.png", "OEBPS/images/unused.png", "OEBPS/images/empty.png");
        assertThat(epub.getImages().get(2).getData()).isEmpty();
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(ExtractionException.class, () -> reader.read(tempDir.resolve("absent.epub")));
    }

    @Test
    void nonArchiveIsRejected() throws Exception {
        Path notAnEpub = tempDir.resolve("notes.epub");
        Files.writeString(notAnEpub, "plain text, not a zip");

        assertThrows(ExtractionException.class, () -> reader.read(notAnEpub));
    }

    @Test
    void resolveNormalizesRelativeHrefs() {
        assertThat(EpubPackageReader.resolve("OEBPS/text/", "../images/a%20b.png")).isEqualTo("OEBPS/images/a b.png");
        assertThat(EpubPackageReader.resolve("OEBPS/", "./chapter1.xhtml")).isEqualTo("OEBPS/chapter1.xhtml");
        assertThat(EpubPackageReader.resolve("OEBPS/", "/cover.xhtml")).isEqualTo("cover.xhtml");
        assertThat(EpubPackageReader.resolve("", "c++.xhtml")).isEqualTo("c++.xhtml");
    }
}
