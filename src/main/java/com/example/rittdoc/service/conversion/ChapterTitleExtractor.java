package com.example.rittdoc.service.conversion;

import com.example.rittdoc.config.HeuristicsConfig;
import com.example.rittdoc.dto.conversion.ChapterTitle;
import com.example.rittdoc.dto.conversion.Paragraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Finds the title of a chapter in its opening region.
 * <p>
 * The block with the largest font is the anchor. The title grows forward and then backward from it over
 * adjacent blocks whose font size is within {@code fontSizeTolerance} of the anchor and whose vertical gap
 * to the last collected block is below {@code titleGapMultiplier} times the anchor font size.
 */
@Service
public class ChapterTitleExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ChapterTitleExtractor.class);

    private final HeuristicsConfig heuristics;

    @Autowired
    public ChapterTitleExtractor(HeuristicsConfig heuristics) {
        this.heuristics = heuristics;
    }

    /**
     * @param openingRegion paragraphs of the chapter start, in document order
     * @param placeholder   title used when the region holds no usable block
     */
    public ChapterTitle extract(List<Paragraph> openingRegion, String placeholder) {
        if (openingRegion == null || openingRegion.isEmpty()) {
            return ChapterTitle.placeholder(placeholder);
        }

        int anchorIndex = -1;
        double anchorSize = 0;
        for (int i = 0; i < openingRegion.size(); i++) {
            Paragraph block = openingRegion.get(i);
            if (!block.getText().isEmpty() && block.getFontSize() > anchorSize) {
                anchorSize = block.getFontSize();
                anchorIndex = i;
            }
        }
        if (anchorIndex < 0) {
            return ChapterTitle.placeholder(placeholder);
        }

        Paragraph anchor = openingRegion.get(anchorIndex);
        TreeMap<Integer, Paragraph> collected = new TreeMap<>();
        collected.put(anchorIndex, anchor);

        Paragraph last = anchor;
        for (int i = anchorIndex + 1; i < openingRegion.size(); i++) {
            Paragraph candidate = openingRegion.get(i);
            if (!belongsToTitle(anchor, last, candidate)) {
                break;
            }
            collected.put(i, candidate);
            last = candidate;
        }

        last = anchor;
        for (int i = anchorIndex - 1; i >= 0; i--) {
            Paragraph candidate = openingRegion.get(i);
            if (!belongsToTitle(anchor, last, candidate)) {
                break;
            }
            collected.put(i, candidate);
            last = candidate;
        }

        List<Paragraph> blocks = new ArrayList<>(collected.values());
        String text = blocks.stream().map(Paragraph::getText).collect(Collectors.joining(" ")).trim();
        if (blocks.size() > 1) {
            logger.debug("Merged {} blocks into chapter title '{}'", blocks.size(), text);
        }
        return new ChapterTitle(text, anchorSize, blocks, false);
    }

    private boolean belongsToTitle(Paragraph anchor, Paragraph last, Paragraph candidate) {
        if (candidate.getText().isEmpty() || candidate.getPageNumber() != last.getPageNumber()) {
            return false;
        }
        if (Math.abs(candidate.getFontSize() - anchor.getFontSize()) > heuristics.getFontSizeTolerance()) {
            return false;
        }
        return verticalGap(last, candidate) < heuristics.getTitleGapMultiplier() * anchor.getFontSize();
    }

    /**
     * Empty space between two blocks of one page, zero when they overlap.
     */
    static double verticalGap(Paragraph a, Paragraph b) {
        Paragraph upper = a.getBoundingBox().getY() <= b.getBoundingBox().getY() ? a : b;
        Paragraph lower = upper == a ? b : a;
        return Math.max(0.0, lower.getBoundingBox().getY() - upper.getBoundingBox().getBottom());
    }
}
