package com.example.rittdoc.service.extraction;

import com.example.rittdoc.dto.conversion.ExtractedImage;
import com.example.rittdoc.dto.conversion.OutlineEntry;
import com.example.rittdoc.dto.conversion.PageLayout;
import com.example.rittdoc.dto.conversion.PdfLayout;
import com.example.rittdoc.dto.conversion.TextRun;
import com.example.rittdoc.exception.ExtractionException;
import com.example.rittdoc.support.TestBooks;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for PDFBox based layout extraction on a generated two page PDF.
 */
class PdfLayoutExtractorTest {

    private final PdfLayoutExtractor extractor = new PdfLayoutExtractor();

    @TempDir
    Path tempDir;

    private static String text(PageLayout page) {
        return page.getRuns().stream().map(TextRun::getText).collect(Collectors.joining(" "));
    }

    @Test
    void extractsRunsWithPositionsAndFontSizes() throws Exception {
        PdfLayout layout = extractor.extract(TestBooks.samplePdf(tempDir), tempDir.resolve("media"));

        assertThat(layout.getSourceName()).isEqualTo("sample.pdf");
        assertThat(layout.getPages()).hasSize(2);
        PageLayout first = layout.getPages().get(0);
        assertThat(first.getPageNumber()).isEqualTo(1);
        assertThat(first.getWidth()).isEqualTo(612.0, within(0.01));
        assertThat(text(first)).contains("The Heart").contains("four chambers.");
        assertThat(text(layout.getPages().get(1))).contains("Rhythm").contains("Atrial flutter");

        TextRun heading = first.getRuns().stream().filter(r -> r.getText().contains("Heart")).findFirst().orElseThrow();
        assertThat(heading.getFontSize()).isEqualTo(24.0, within(0.5));
        assertThat(heading.getY()).isBetween(60.0, 92.0);
        assertThat(heading.getPageNumber()).isEqualTo(1);
        assertThat(first.getRuns()).allMatch(r -> r.getPageNumber() == 1);
    }

    /**
     * Drawn images are saved as PNG under an intermediate name together with their placement on the page.
     */
    @Test
    void extractsPlacedImages() throws Exception {
        Path media = tempDir.resolve("media");
        PdfLayout layout = extractor.extract(TestBooks.samplePdf(tempDir), media);

        assertThat(layout.getPages().get(0).getImages()).singleElement().satisfies(image -> {
            assertThat(image.getOriginalPath()).isEqualTo("page1/image1");
            assertThat(image.getIntermediateName()).isEqualTo("img_0001.png");
            assertThat(image.getPixelWidth()).isEqualTo(30);
            assertThat(image.getPixelHeight()).isEqualTo(20);
            assertThat(image.getBoundingBox().getX()).isEqualTo(72.0, within(0.01));
            assertThat(image.getBoundingBox().getY()).isEqualTo(252.0, within(0.01));
            assertThat(image.getBoundingBox().getWidth()).isEqualTo(60.0, within(0.01));
            assertThat(image.getFileSize()).isPositive();
        });
        assertThat(Files.isRegularFile(media.resolve("img_0001.png"))).isTrue();
        assertThat(layout.getPages().get(1).getImages()).extracting(ExtractedImage::getOriginalPath).isEmpty();
    }

    @Test
    void readsOutlineAndMetadata() throws Exception {
        PdfLayout layout = extractor.extract(TestBooks.samplePdf(tempDir), tempDir.resolve("media"));

        assertThat(layout.getOutline()).extracting(OutlineEntry::getTitle, OutlineEntry::getPageNumber)
                .containsExactly(tuple("The Heart", 1),
                        tuple("Rhythm", 2));
        assertThat(layout.getMetadata().getTitle()).isEqualTo("Cardiology Basics");
        assertThat(layout.getMetadata().getAuthors()).containsExactly("Jane Smith", "John Doe");
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(ExtractionException.class,
                () -> extractor.extract(tempDir.resolve("absent.pdf"), tempDir.resolve("media")));
    }

    @Test
    void corruptFileIsRejected() throws Exception {
        Path corrupt = tempDir.resolve("corrupt.pdf");
        Files.writeString(corrupt, "this is not a pdf");

        assertThrows(ExtractionException.class, () -> extractor.extract(corrupt, tempDir.resolve("media")));
    }
}
