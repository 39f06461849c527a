package com.example.rittdoc.service.extraction;

import com.example.rittdoc.dto.conversion.BookMetadata;
import com.example.rittdoc.dto.conversion.BoundingBox;
import com.example.rittdoc.dto.conversion.ExtractedImage;
import com.example.rittdoc.dto.conversion.OutlineEntry;
import com.example.rittdoc.dto.conversion.PageLayout;
import com.example.rittdoc.dto.conversion.PdfLayout;
import com.example.rittdoc.dto.conversion.TextRun;
import com.example.rittdoc.exception.ExtractionException;
import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.Locale;

/**
 * Reads a PDF with PDFBox into per-page text runs, placed images and the top-level outline.
 * Images are written as PNG files into the media work directory under their intermediate names.
 */
@Service
public class PdfLayoutExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PdfLayoutExtractor.class);

    public PdfLayout extract(Path pdfFile, Path mediaDir) {
        logger.info("Starting layout extraction for PDF: {}", pdfFile.getFileName());
        if (!Files.isRegularFile(pdfFile)) {
            throw new ExtractionException("PDF file not found: " + pdfFile);
        }

        PdfLayout layout = new PdfLayout();
        layout.setSourceName(pdfFile.getFileName().toString());

        try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
            Files.createDirectories(mediaDir);
            int totalPages = document.getNumberOfPages();
            logger.info("PDF has {} pages, starting extraction...", totalPages);

            layout.setMetadata(extractMetadata(document));
            layout.setOutline(extractOutline(document));

            int[] imageCounter = {0};
            for (int i = 0; i < totalPages; i++) {
                PDPage page = document.getPage(i);
                PDRectangle mediaBox = page.getMediaBox();

                PageLayout pageLayout = new PageLayout();
                pageLayout.setPageNumber(i + 1);
                pageLayout.setWidth(mediaBox.getWidth());
                pageLayout.setHeight(mediaBox.getHeight());
                pageLayout.setRuns(extractRuns(document, i));

                ImageCollector collector = new ImageCollector(page, i + 1, mediaDir, imageCounter);
                collector.processPage(page);
                pageLayout.setImages(collector.getImages());

                layout.getPages().add(pageLayout);
                logger.debug("Page {}/{}: {} runs, {} images", i + 1, totalPages,
                        pageLayout.getRuns().size(), pageLayout.getImages().size());
            }
            logger.info("Layout extraction completed: {} pages, {} images", totalPages, imageCounter[0]);
        } catch (IOException e) {
            logger.error("Error during layout extraction of {}: {}", pdfFile.getFileName(), e.getMessage(), e);
            throw new ExtractionException("Could not read PDF " + pdfFile.getFileName() + ": " + e.getMessage(), e);
        }
        return layout;
    }

    private List<TextRun> extractRuns(PDDocument document, int pageIndex) throws IOException {
        PositionAwareTextStripper stripper = new PositionAwareTextStripper(pageIndex + 1);
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        stripper.setSortByPosition(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.getText(document);
        return stripper.getRuns();
    }

    private BookMetadata extractMetadata(PDDocument document) {
        BookMetadata metadata = new BookMetadata();
        PDDocumentInformation info = document.getDocumentInformation();
        if (info == null) {
            return metadata;
        }
        metadata.setTitle(StringUtils.trimToNull(info.getTitle()));
        if (StringUtils.isNotBlank(info.getAuthor())) {
            for (String author : info.getAuthor().split(";|\\band\\b|&")) {
                if (StringUtils.isNotBlank(author)) {
                    metadata.getAuthors().add(author.trim());
                }
            }
        }
        Calendar created = info.getCreationDate();
        if (created != null) {
            metadata.setPublicationDate(String.valueOf(created.get(Calendar.YEAR)));
        }
        return metadata;
    }

    private List<OutlineEntry> extractOutline(PDDocument document) throws IOException {
        List<OutlineEntry> entries = new ArrayList<>();
        PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
        if (outline == null) {
            return entries;
        }
        for (PDOutlineItem item : outline.children()) {
            PDPage target = item.findDestinationPage(document);
            if (target == null) {
                logger.debug("Outline entry '{}' has no page destination, skipped", item.getTitle());
                continue;
            }
            int pageIndex = document.getPages().indexOf(target);
            if (pageIndex >= 0) {
                entries.add(new OutlineEntry(StringUtils.trimToEmpty(item.getTitle()), pageIndex + 1));
            }
        }
        logger.debug("Found {} top-level outline entries", entries.size());
        return entries;
    }

    /**
     * Turns each word handed to {@link #writeString} into one {@link TextRun}.
     */
    private static class PositionAwareTextStripper extends PDFTextStripper {
        private final int pageNumber;
        private final List<TextRun> runs = new ArrayList<>();

        PositionAwareTextStripper(int pageNumber) throws IOException {
            super();
            this.pageNumber = pageNumber;
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (textPositions == null || textPositions.isEmpty() || StringUtils.isBlank(text)) {
                return;
            }
            TextPosition first = textPositions.get(0);
            double minX = Double.MAX_VALUE;
            double maxX = 0;
            double top = Double.MAX_VALUE;
            double bottom = 0;
            double fontSize = 0;
            for (TextPosition position : textPositions) {
                minX = Math.min(minX, position.getXDirAdj());
                maxX = Math.max(maxX, position.getXDirAdj() + position.getWidthDirAdj());
                // yDirAdj is the baseline measured from the top of the page
                top = Math.min(top, position.getYDirAdj() - position.getHeightDir());
                bottom = Math.max(bottom, position.getYDirAdj());
                fontSize = Math.max(fontSize, position.getFontSizeInPt());
            }

            String fontName = first.getFont() != null && first.getFont().getName() != null
                    ? first.getFont().getName() : "Unknown";
            String lower = fontName.toLowerCase(Locale.ROOT);

            runs.add(TextRun.builder()
                    .text(text)
                    .x(minX)
                    .y(top)
                    .width(Math.max(0.0, maxX - minX))
                    .height(Math.max(0.0, bottom - top))
                    .pageNumber(pageNumber)
                    .fontSize(fontSize)
                    .fontFamily(fontName)
                    .bold(lower.contains("bold") || lower.contains("black"))
                    .italic(lower.contains("italic") || lower.contains("oblique"))
                    .build());
        }

        List<TextRun> getRuns() {
            return runs;
        }
    }

    /**
     * Walks the page content stream and saves every drawn image together with its placement.
     */
    private static class ImageCollector extends PDFGraphicsStreamEngine {
        private final int pageNumber;
        private final double pageHeight;
        private final Path mediaDir;
        private final int[] counter;
        private final List<ExtractedImage> images = new ArrayList<>();
        private Point2D currentPoint;

        ImageCollector(PDPage page, int pageNumber, Path mediaDir, int[] counter) {
            super(page);
            this.pageNumber = pageNumber;
            this.pageHeight = page.getMediaBox().getHeight();
            this.mediaDir = mediaDir;
            this.counter = counter;
        }

        List<ExtractedImage> getImages() {
            return images;
        }

        @Override
        public void drawImage(PDImage pdImage) throws IOException {
            BufferedImage bufferedImage = pdImage.getImage();
            if (bufferedImage == null) {
                logger.warn("Image on page {} could not be decoded, skipped", pageNumber);
                return;
            }
            counter[0]++;
            String intermediateName = String.format("img_%04d.png", counter[0]);
            File target = mediaDir.resolve(intermediateName).toFile();
            ImageIO.write(bufferedImage, "png", target);

            Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
            double width = Math.abs(ctm.getScalingFactorX());
            double height = Math.abs(ctm.getScalingFactorY());
            double top = pageHeight - (ctm.getTranslateY() + height);

            ExtractedImage image = new ExtractedImage();
            image.setOriginalPath(String.format("page%d/image%d", pageNumber, images.size() + 1));
            image.setIntermediateName(intermediateName);
            image.setFile(target.toPath());
            image.setBoundingBox(new BoundingBox(ctm.getTranslateX(), top, width, height, pageNumber));
            image.setPixelWidth(bufferedImage.getWidth());
            image.setPixelHeight(bufferedImage.getHeight());
            image.setFileSize(target.length());
            images.add(image);
        }

        @Override
        public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
            currentPoint = p0;
        }

        @Override
        public void clip(int windingRule) {
            // clipping does not affect image placement
        }

        @Override
        public void moveTo(float x, float y) {
            currentPoint = new Point2D.Float(x, y);
        }

        @Override
        public void lineTo(float x, float y) {
            currentPoint = new Point2D.Float(x, y);
        }

        @Override
        public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
            currentPoint = new Point2D.Float(x3, y3);
        }

        @Override
        public Point2D getCurrentPoint() {
            return currentPoint;
        }

        @Override
        public void closePath() {
            // paths are not collected
        }

        @Override
        public void endPath() {
            currentPoint = null;
        }

        @Override
        public void strokePath() {
            currentPoint = null;
        }

        @Override
        public void fillPath(int windingRule) {
            currentPoint = null;
        }

        @Override
        public void fillAndStrokePath(int windingRule) {
            currentPoint = null;
        }

        @Override
        public void shadingFill(COSName shadingName) {
            // shadings are not images
        }
    }
}
