package com.example.rittdoc.service.conversion;

import com.example.rittdoc.config.HeuristicsConfig;
import com.example.rittdoc.dto.conversion.TextRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the text runs of one page with a coarse grid.
 * <p>
 * The page is cut into {@code gridRows} horizontal bands and {@code gridColumns} columns. A run belongs to
 * the cell holding its top-left corner. Cells are read band by band from the top, left to right inside a
 * band, and runs inside a cell by their top edge and then their left edge.
 */
@Service
public class ReadingOrderService {

    private static final Logger logger = LoggerFactory.getLogger(ReadingOrderService.class);

    private final HeuristicsConfig heuristics;

    @Autowired
    public ReadingOrderService(HeuristicsConfig heuristics) {
        this.heuristics = heuristics;
    }

    public List<TextRun> order(List<TextRun> runs, double pageWidth, double pageHeight) {
        if (runs == null || runs.isEmpty()) {
            return new ArrayList<>();
        }
        int page = runs.get(0).getPageNumber();
        if (runs.stream().anyMatch(r -> r.getPageNumber() != page)) {
            throw new IllegalArgumentException("Reading order is computed per page, got runs from several pages");
        }

        // Fall back to the extent of the runs when the page box is unknown
        double width = pageWidth > 0 ? pageWidth : runs.stream().mapToDouble(r -> r.getX() + r.getWidth()).max().orElse(1.0);
        double height = pageHeight > 0 ? pageHeight : runs.stream().mapToDouble(TextRun::getBottom).max().orElse(1.0);
        int rows = heuristics.getGridRows();
        int columns = heuristics.getGridColumns();
        double bandHeight = height / rows;
        double columnWidth = width / columns;

        List<TextRun> ordered = new ArrayList<>(runs);
        ordered.sort(Comparator
                .comparingInt((TextRun r) -> cellIndex(r.getY(), bandHeight, rows))
                .thenComparingInt(r -> cellIndex(r.getX(), columnWidth, columns))
                .thenComparingDouble(TextRun::getY)
                .thenComparingDouble(TextRun::getX));

        logger.debug("Ordered {} runs on page {} using a {}x{} grid", ordered.size(), page, rows, columns);
        return ordered;
    }

    private static int cellIndex(double coordinate, double cellSize, int cells) {
        int index = (int) Math.floor(coordinate / cellSize);
        return Math.max(0, Math.min(cells - 1, index));
    }
}
