package com.example.rittdoc.service.conversion;

import com.example.rittdoc.config.HeuristicsConfig;
import com.example.rittdoc.dto.conversion.BoundingBox;
import com.example.rittdoc.dto.conversion.Paragraph;
import com.example.rittdoc.dto.conversion.TextRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Groups reading-ordered runs into paragraphs.
 * <p>
 * Consecutive runs share a paragraph only when they sit on the same page and the empty space between the
 * bottom of one and the top of the next stays below {@code lineHeightMultiplier} times the typical line
 * height of that page. A page break always ends the paragraph. A font size change of at least
 * {@code paragraphFontSizeBreak} points, a bullet or a caption label also starts a new one.
 */
@Service
public class FlowBuilderService {

    private static final Logger logger = LoggerFactory.getLogger(FlowBuilderService.class);

    static final double DEFAULT_LINE_HEIGHT = 12.0;

    static final Pattern LIST_MARKER = Pattern.compile("^\\s*([\\u2022\\u25E6\\u25AA\\u25CF\\u2023\\u2043\\-*]|\\(?\\d{1,3}[.)]|\\(?[a-z][.)])\\s+.*");
    static final Pattern CAPTION_LABEL = Pattern.compile("^\\s*(figure|fig\\.|table|exhibit)\\s+[\\dIVXivx]+.*", Pattern.CASE_INSENSITIVE);

    private final HeuristicsConfig heuristics;

    @Autowired
    public FlowBuilderService(HeuristicsConfig heuristics) {
        this.heuristics = heuristics;
    }

    /**
     * @param orderedRuns runs of one or more pages, each page already in reading order, pages ascending
     */
    public List<Paragraph> buildParagraphs(List<TextRun> orderedRuns) {
        List<Paragraph> paragraphs = new ArrayList<>();
        if (orderedRuns == null || orderedRuns.isEmpty()) {
            return paragraphs;
        }

        Map<Integer, Double> lineHeights = typicalLineHeights(orderedRuns);
        Paragraph current = null;
        TextRun previous = null;

        for (TextRun run : orderedRuns) {
            if (run.getText() == null || run.getText().isBlank()) {
                continue;
            }
            if (current == null || !continues(previous, run, lineHeights.get(run.getPageNumber()))) {
                current = startParagraph(run);
                paragraphs.add(current);
            } else {
                current.getRuns().add(run);
                current.getBoundingBox().include(run);
                current.setFontSize(Math.max(current.getFontSize(), run.getFontSize()));
            }
            previous = run;
        }

        logger.debug("Built {} paragraphs from {} runs", paragraphs.size(), orderedRuns.size());
        return paragraphs;
    }

    boolean continues(TextRun previous, TextRun next, double lineHeight) {
        if (previous.getPageNumber() != next.getPageNumber()) {
            return false;
        }
        if (next.getY() - previous.getY() < -0.5 * lineHeight) {
            // moved back up the page, e.g. into the next column
            return false;
        }
        double gap = next.getY() - previous.getBottom();
        if (gap >= heuristics.getLineHeightMultiplier() * lineHeight) {
            return false;
        }
        if (Math.abs(next.getFontSize() - previous.getFontSize()) >= heuristics.getParagraphFontSizeBreak()) {
            return false;
        }
        String text = next.getText();
        return !LIST_MARKER.matcher(text).matches() && !CAPTION_LABEL.matcher(text).matches();
    }

    private Paragraph startParagraph(TextRun run) {
        Paragraph paragraph = new Paragraph();
        paragraph.getRuns().add(run);
        paragraph.setPageNumber(run.getPageNumber());
        paragraph.setBoundingBox(BoundingBox.of(run));
        paragraph.setFontSize(run.getFontSize());
        if (LIST_MARKER.matcher(run.getText()).matches()) {
            paragraph.setRole(Paragraph.ParagraphRole.LIST_ITEM);
        } else if (CAPTION_LABEL.matcher(run.getText()).matches()) {
            paragraph.setRole(Paragraph.ParagraphRole.CAPTION);
        }
        return paragraph;
    }

    /**
     * Median run height per page, the local notion of a line.
     */
    private Map<Integer, Double> typicalLineHeights(List<TextRun> runs) {
        Map<Integer, List<Double>> heights = new HashMap<>();
        for (TextRun run : runs) {
            double height = run.getHeight() > 0 ? run.getHeight() : run.getFontSize();
            if (height > 0) {
                heights.computeIfAbsent(run.getPageNumber(), p -> new ArrayList<>()).add(height);
            }
        }
        Map<Integer, Double> result = new HashMap<>();
        for (TextRun run : runs) {
            result.computeIfAbsent(run.getPageNumber(), page -> {
                List<Double> values = heights.get(page);
                if (values == null || values.isEmpty()) {
                    return DEFAULT_LINE_HEIGHT;
                }
                values.sort(Double::compareTo);
                return values.get(values.size() / 2);
            });
        }
        return result;
    }
}
