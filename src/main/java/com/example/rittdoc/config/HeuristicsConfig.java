package com.example.rittdoc.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Tuning knobs for the layout heuristics of the PDF path.
 * Field initializers carry the same defaults as the property placeholders so the
 * class can be instantiated directly outside of a Spring context.
 */
@Configuration
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeuristicsConfig {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicsConfig.class);

    /** Two runs share a paragraph only while the empty space between them stays below this many typical line heights. */
    @Value("${rittdoc.flow.line-height-multiplier:2.0}")
    private double lineHeightMultiplier = 2.0;

    /** A font size change of at least this many points ends a paragraph. */
    @Value("${rittdoc.flow.font-size-break:2.0}")
    private double paragraphFontSizeBreak = 2.0;

    /** Maximum font size difference, in points, between blocks merged into one chapter title. */
    @Value("${rittdoc.title.font-size-tolerance:1.0}")
    private double fontSizeTolerance = 1.0;

    /** Maximum gap between title blocks, in multiples of the anchor font size. */
    @Value("${rittdoc.title.gap-multiplier:2.0}")
    private double titleGapMultiplier = 2.0;

    /** Number of pages, starting at the chapter opening, searched for the chapter title. */
    @Value("${rittdoc.title.search-pages:1}")
    private int titleSearchPages = 1;

    @Value("${rittdoc.reading-order.grid-rows:8}")
    private int gridRows = 8;

    @Value("${rittdoc.reading-order.grid-columns:1}")
    private int gridColumns = 1;

    /** Paragraphs at least this much larger than body text are treated as section headings. */
    @Value("${rittdoc.structure.heading-size-ratio:1.15}")
    private double headingSizeRatio = 1.15;

    /** Paragraphs at least this much larger than body text open a new chapter when the PDF has no outline. */
    @Value("${rittdoc.structure.chapter-size-ratio:1.6}")
    private double chapterSizeRatio = 1.6;

    @PostConstruct
    public void validate() {
        if (lineHeightMultiplier <= 0 || titleGapMultiplier <= 0) {
            throw new IllegalStateException("Line height and title gap multipliers must be positive");
        }
        if (fontSizeTolerance < 0) {
            throw new IllegalStateException("Font size tolerance must not be negative: " + fontSizeTolerance);
        }
        if (paragraphFontSizeBreak <= 0) {
            throw new IllegalStateException("Paragraph font size break must be positive: " + paragraphFontSizeBreak);
        }
        if (gridRows < 1 || gridColumns < 1 || titleSearchPages < 1) {
            throw new IllegalStateException("Grid dimensions and title search pages must be at least 1");
        }
        logger.info("Layout heuristics: lineHeightMultiplier={}, paragraphFontSizeBreak={}, fontSizeTolerance={}, grid={}x{}",
                lineHeightMultiplier, paragraphFontSizeBreak, fontSizeTolerance, gridRows, gridColumns);
    }
}
