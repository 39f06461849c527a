package com.example.rittdoc.service.conversion;

import com.example.rittdoc.config.HeuristicsConfig;
import com.example.rittdoc.dto.conversion.BookMetadata;
import com.example.rittdoc.dto.conversion.ChapterTitle;
import com.example.rittdoc.dto.conversion.ExtractedImage;
import com.example.rittdoc.dto.conversion.OutlineEntry;
import com.example.rittdoc.dto.conversion.PageLayout;
import com.example.rittdoc.dto.conversion.Paragraph;
import com.example.rittdoc.dto.conversion.PdfLayout;
import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.dto.conversion.TextRun;
import com.example.rittdoc.model.ResourceGeometry;
import com.example.rittdoc.model.ResourceKind;
import com.example.rittdoc.model.SourceFormat;
import com.example.rittdoc.service.reference.ReferenceMapper;
import com.example.rittdoc.xml.DocBook;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the intermediate DocBook tree of a PDF from its extracted layout.
 * <p>
 * Each page is put in reading order and grouped into paragraphs. Chapters start at the top-level outline
 * entries, or where no outline exists, at pages carrying a paragraph set markedly larger than body text.
 * Larger-than-body paragraphs inside a chapter become nested sections, one level per distinct size.
 */
@Service
public class PdfStructuringService {

    private static final Logger logger = LoggerFactory.getLogger(PdfStructuringService.class);

    private static final int MAX_HEADING_LENGTH = 200;
    private static final int METADATA_SCAN_PAGES = 5;

    private static final Pattern MARKER_PREFIX = Pattern.compile("^\\s*([\\u2022\\u25E6\\u25AA\\u25CF\\u2023\\u2043\\-*]|\\(?\\d{1,3}[.)]|\\(?[a-z][.)])\\s+");
    private static final Pattern ISBN = Pattern.compile("ISBN(?:-1[03])?:?\\s*([0-9][0-9\\- ]{8,15}[0-9Xx])", Pattern.CASE_INSENSITIVE);
    private static final Pattern COPYRIGHT = Pattern.compile("(?:\\u00A9|\\(c\\)|copyright)\\s*(?:\\u00A9\\s*)?(\\d{4})[,\\s]*(?:by\\s+)?([^.\\n]*)", Pattern.CASE_INSENSITIVE);

    private final HeuristicsConfig heuristics;
    private final ReadingOrderService readingOrderService;
    private final FlowBuilderService flowBuilderService;
    private final ChapterTitleExtractor chapterTitleExtractor;

    @Autowired
    public PdfStructuringService(HeuristicsConfig heuristics, ReadingOrderService readingOrderService,
                                 FlowBuilderService flowBuilderService, ChapterTitleExtractor chapterTitleExtractor) {
        this.heuristics = heuristics;
        this.readingOrderService = readingOrderService;
        this.flowBuilderService = flowBuilderService;
        this.chapterTitleExtractor = chapterTitleExtractor;
    }

    public StructuredDocument structure(PdfLayout layout, ReferenceMapper mapper) {
        logger.info("Structuring PDF {} ({} pages)", layout.getSourceName(), layout.getPages().size());

        Map<Integer, List<Paragraph>> paragraphsByPage = new LinkedHashMap<>();
        Map<Integer, List<ExtractedImage>> imagesByPage = new HashMap<>();
        for (PageLayout page : layout.getPages()) {
            List<TextRun> ordered = readingOrderService.order(page.getRuns(), page.getWidth(), page.getHeight());
            paragraphsByPage.put(page.getPageNumber(), flowBuilderService.buildParagraphs(ordered));
            List<ExtractedImage> images = new ArrayList<>(page.getImages());
            images.sort((a, b) -> Double.compare(a.getBoundingBox().getY(), b.getBoundingBox().getY()));
            imagesByPage.put(page.getPageNumber(), images);
            for (ExtractedImage image : images) {
                mapper.register(image.getOriginalPath(), image.getIntermediateName(), ResourceKind.IMAGE,
                        new ResourceGeometry(image.getPixelWidth(), image.getPixelHeight(), image.isVector(), image.getFileSize()));
            }
        }

        double bodySize = bodyFontSize(paragraphsByPage);
        markHeadings(paragraphsByPage, bodySize);
        List<Double> headingTiers = headingTiers(paragraphsByPage);
        logger.debug("Body font size {}, heading tiers {}", bodySize, headingTiers);

        StructuredDocument document = new StructuredDocument();
        document.setSourceFormat(SourceFormat.PDF);
        document.setSourceName(layout.getSourceName());
        document.setMetadata(layout.getMetadata() == null ? new BookMetadata() : layout.getMetadata());

        List<ChapterStart> starts = chapterStarts(layout, paragraphsByPage, imagesByPage, bodySize);
        int lastPage = layout.getPages().isEmpty() ? 1 : layout.getPages().get(layout.getPages().size() - 1).getPageNumber();
        for (int i = 0; i < starts.size(); i++) {
            ChapterStart start = starts.get(i);
            int endPage = i + 1 < starts.size() ? starts.get(i + 1).page - 1 : lastPage;
            String chapterId = DocBook.chapterId(i + 1);
            Element chapter = buildChapter(chapterId, i + 1, start, endPage, paragraphsByPage, imagesByPage,
                    headingTiers, bodySize, mapper);
            document.getChapters().add(new StructuredChapter(chapterId, "pages " + start.page + "-" + endPage, chapter));
        }

        scanFrontMatter(document, paragraphsByPage);
        logger.info("PDF {} structured into {} chapters", layout.getSourceName(), document.getChapters().size());
        return document;
    }

    /**
     * Font size carrying the most characters, rounded to half points.
     */
    double bodyFontSize(Map<Integer, List<Paragraph>> paragraphsByPage) {
        Map<Double, Integer> weights = new HashMap<>();
        for (List<Paragraph> paragraphs : paragraphsByPage.values()) {
            for (Paragraph paragraph : paragraphs) {
                for (TextRun run : paragraph.getRuns()) {
                    weights.merge(round(run.getFontSize()), run.getText().trim().length(), Integer::sum);
                }
            }
        }
        return weights.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(FlowBuilderService.DEFAULT_LINE_HEIGHT);
    }

    private void markHeadings(Map<Integer, List<Paragraph>> paragraphsByPage, double bodySize) {
        for (List<Paragraph> paragraphs : paragraphsByPage.values()) {
            for (Paragraph paragraph : paragraphs) {
                if (paragraph.getRole() == Paragraph.ParagraphRole.BODY && isHeadingSized(paragraph, bodySize)) {
                    paragraph.setRole(Paragraph.ParagraphRole.HEADING_CANDIDATE);
                }
            }
        }
    }

    private boolean isHeadingSized(Paragraph paragraph, double bodySize) {
        return paragraph.getFontSize() >= bodySize * heuristics.getHeadingSizeRatio()
                && paragraph.getText().length() <= MAX_HEADING_LENGTH;
    }

    /**
     * Distinct heading sizes, largest first. The position in this list is the section level.
     */
    private List<Double> headingTiers(Map<Integer, List<Paragraph>> paragraphsByPage) {
        Set<Double> sizes = new TreeSet<>(Collections.reverseOrder());
        for (List<Paragraph> paragraphs : paragraphsByPage.values()) {
            for (Paragraph paragraph : paragraphs) {
                if (paragraph.getRole() == Paragraph.ParagraphRole.HEADING_CANDIDATE) {
                    sizes.add(round(paragraph.getFontSize()));
                }
            }
        }
        return new ArrayList<>(sizes);
    }

    private List<ChapterStart> chapterStarts(PdfLayout layout, Map<Integer, List<Paragraph>> paragraphsByPage,
                                             Map<Integer, List<ExtractedImage>> imagesByPage, double bodySize) {
        List<ChapterStart> starts = new ArrayList<>();
        if (!layout.getOutline().isEmpty()) {
            List<OutlineEntry> outline = new ArrayList<>(layout.getOutline());
            outline.sort((a, b) -> Integer.compare(a.getPageNumber(), b.getPageNumber()));
            for (OutlineEntry entry : outline) {
                if (starts.isEmpty() || starts.get(starts.size() - 1).page != entry.getPageNumber()) {
                    starts.add(new ChapterStart(entry.getPageNumber(), entry.getTitle()));
                }
            }
            logger.debug("Chapter boundaries from outline: {}", starts.size());
        } else {
            double threshold = bodySize * heuristics.getChapterSizeRatio();
            for (Map.Entry<Integer, List<Paragraph>> page : paragraphsByPage.entrySet()) {
                boolean opensChapter = page.getValue().stream()
                        .anyMatch(p -> p.getFontSize() >= threshold && p.getText().length() <= MAX_HEADING_LENGTH);
                if (opensChapter) {
                    starts.add(new ChapterStart(page.getKey(), null));
                }
            }
            logger.debug("Chapter boundaries from font sizes: {}", starts.size());
        }

        int firstPage = paragraphsByPage.keySet().stream().findFirst().orElse(1);
        if (starts.isEmpty()) {
            starts.add(new ChapterStart(firstPage, null));
        } else if (starts.get(0).page > firstPage && hasContent(firstPage, starts.get(0).page - 1, paragraphsByPage, imagesByPage)) {
            // pages ahead of the first chapter become a front matter chapter
            starts.add(0, new ChapterStart(firstPage, null));
        }
        return starts;
    }

    private static boolean hasContent(int fromPage, int toPage, Map<Integer, List<Paragraph>> paragraphsByPage,
                                      Map<Integer, List<ExtractedImage>> imagesByPage) {
        for (int page = fromPage; page <= toPage; page++) {
            if (!paragraphsByPage.getOrDefault(page, List.of()).isEmpty()
                    || !imagesByPage.getOrDefault(page, List.of()).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private Element buildChapter(String chapterId, int number, ChapterStart start, int endPage,
                                 Map<Integer, List<Paragraph>> paragraphsByPage,
                                 Map<Integer, List<ExtractedImage>> imagesByPage,
                                 List<Double> headingTiers, double bodySize, ReferenceMapper mapper) {
        List<Paragraph> opening = new ArrayList<>();
        for (int page = start.page; page < start.page + heuristics.getTitleSearchPages() && page <= endPage; page++) {
            opening.addAll(paragraphsByPage.getOrDefault(page, List.of()));
        }
        String placeholder = start.outlineTitle != null && !start.outlineTitle.isBlank()
                ? start.outlineTitle : "Chapter " + number;
        ChapterTitle title = chapterTitleExtractor.extract(opening, placeholder);
        if (!title.isPlaceholder() && title.getFontSize() < bodySize * heuristics.getHeadingSizeRatio()) {
            title = ChapterTitle.placeholder(placeholder);
        }
        Map<Paragraph, Boolean> consumed = new IdentityHashMap<>();
        title.getSourceBlocks().forEach(block -> consumed.put(block, Boolean.TRUE));

        Element chapter = DocBook.element("chapter").attr("id", chapterId);
        chapter.appendChild(DocBook.element("title", title.getText()));

        ChapterBuilder builder = new ChapterBuilder(chapterId, chapter, headingTiers, mapper);
        for (int page = start.page; page <= endPage; page++) {
            Deque<ExtractedImage> images = new ArrayDeque<>(imagesByPage.getOrDefault(page, List.of()));
            for (Paragraph paragraph : paragraphsByPage.getOrDefault(page, List.of())) {
                while (!images.isEmpty() && images.peek().getBoundingBox().getY() <= paragraph.getBoundingBox().getY()) {
                    builder.addImage(images.poll());
                }
                if (!consumed.containsKey(paragraph)) {
                    builder.addParagraph(paragraph);
                }
            }
            images.forEach(builder::addImage);
        }
        builder.finish();
        return chapter;
    }

    private void scanFrontMatter(StructuredDocument document, Map<Integer, List<Paragraph>> paragraphsByPage) {
        BookMetadata metadata = document.getMetadata();
        int scanned = 0;
        for (List<Paragraph> paragraphs : paragraphsByPage.values()) {
            if (scanned++ >= METADATA_SCAN_PAGES) {
                break;
            }
            for (Paragraph paragraph : paragraphs) {
                String text = paragraph.getText();
                Matcher isbn = ISBN.matcher(text);
                if (metadata.getIsbn() == null && isbn.find()) {
                    metadata.setIsbn(isbn.group(1).replaceAll("[\\s]", ""));
                }
                Matcher copyright = COPYRIGHT.matcher(text);
                if (metadata.getCopyrightYear() == null && copyright.find()) {
                    metadata.setCopyrightYear(copyright.group(1));
                    String holder = copyright.group(2).trim();
                    if (!holder.isEmpty() && metadata.getCopyrightHolder() == null) {
                        metadata.setCopyrightHolder(holder);
                    }
                }
            }
        }
        if (metadata.getTitle() == null && !document.getChapters().isEmpty()) {
            Element firstTitle = document.getChapters().get(0).getRoot().child(0);
            if (!firstTitle.text().matches("Chapter \\d+")) {
                metadata.setTitle(firstTitle.text());
            }
        }
    }

    private static double round(double fontSize) {
        return Math.round(fontSize * 2) / 2.0;
    }

    private static final class ChapterStart {
        final int page;
        final String outlineTitle;

        ChapterStart(int page, String outlineTitle) {
            this.page = page;
            this.outlineTitle = outlineTitle;
        }
    }

    /**
     * Appends paragraphs and images to one chapter, tracking open sections, the current list and a
     * caption waiting for its figure.
     */
    private static final class ChapterBuilder {
        private final String chapterId;
        private final Element chapter;
        private final List<Double> headingTiers;
        private final ReferenceMapper mapper;
        private final Deque<Element> sections = new ArrayDeque<>();
        private final Deque<Integer> levels = new ArrayDeque<>();

        private Element currentList;
        private Element lastAppended;
        private String pendingCaption;

        ChapterBuilder(String chapterId, Element chapter, List<Double> headingTiers, ReferenceMapper mapper) {
            this.chapterId = chapterId;
            this.chapter = chapter;
            this.headingTiers = headingTiers;
            this.mapper = mapper;
        }

        void addParagraph(Paragraph paragraph) {
            switch (paragraph.getRole()) {
                case HEADING_CANDIDATE:
                    openSection(paragraph);
                    break;
                case LIST_ITEM:
                    addListItem(paragraph);
                    break;
                case CAPTION:
                    addCaption(paragraph);
                    break;
                default:
                    append(para(paragraph.getRuns(), false));
            }
        }

        void addImage(ExtractedImage image) {
            mapper.recordReference(image.getOriginalPath(), chapterId);
            Element figure;
            if (pendingCaption != null) {
                figure = DocBook.element("figure");
                figure.appendChild(DocBook.element("title", pendingCaption));
                pendingCaption = null;
            } else {
                figure = DocBook.element("informalfigure");
            }
            figure.appendElement("mediaobject")
                    .appendElement("imageobject")
                    .appendElement("imagedata").attr("fileref", image.getIntermediateName());
            append(figure);
        }

        void finish() {
            if (pendingCaption != null) {
                append(DocBook.element("para", pendingCaption));
                pendingCaption = null;
            }
        }

        private void openSection(Paragraph heading) {
            flushCaption();
            currentList = null;
            int level = headingTiers.indexOf(round(heading.getFontSize())) + 1;
            level = Math.max(1, Math.min(level, DocBook.MAX_SECTION_DEPTH));
            while (!levels.isEmpty() && levels.peek() >= level) {
                levels.pop();
                sections.pop();
            }
            Element section = DocBook.element("section");
            section.appendChild(DocBook.element("title", heading.getText()));
            container().appendChild(section);
            sections.push(section);
            levels.push(level);
            lastAppended = section;
        }

        private void addListItem(Paragraph paragraph) {
            flushCaption();
            Matcher marker = MARKER_PREFIX.matcher(paragraph.getText());
            boolean ordered = marker.find() && Character.isLetterOrDigit(marker.group(1).replace("(", "").charAt(0));
            String listName = ordered ? "orderedlist" : "itemizedlist";
            if (currentList == null || !currentList.normalName().equals(listName) || lastAppended != currentList) {
                currentList = DocBook.element(listName);
                container().appendChild(currentList);
                lastAppended = currentList;
            }
            Element item = currentList.appendElement("listitem");
            item.appendChild(para(paragraph.getRuns(), true));
        }

        private void addCaption(Paragraph paragraph) {
            flushCaption();
            if (lastAppended != null && lastAppended.normalName().equals("informalfigure")) {
                lastAppended.tagName("figure");
                lastAppended.prependChild(DocBook.element("title", paragraph.getText()));
            } else {
                pendingCaption = paragraph.getText();
            }
        }

        private void flushCaption() {
            if (pendingCaption != null) {
                append(DocBook.element("para", pendingCaption));
                pendingCaption = null;
            }
        }

        private void append(Element block) {
            if (!block.normalName().endsWith("figure")) {
                flushCaption();
            }
            container().appendChild(block);
            lastAppended = block;
            currentList = null;
        }

        private Element container() {
            return sections.isEmpty() ? chapter : sections.peek();
        }

        /**
         * Paragraph text with bold and italic runs marked, unless the whole paragraph shares the style.
         */
        private static Element para(List<TextRun> runs, boolean stripMarker) {
            Element para = DocBook.element("para");
            boolean allBold = runs.stream().allMatch(TextRun::isBold);
            boolean allItalic = runs.stream().allMatch(TextRun::isItalic);
            boolean first = true;
            for (int i = 0; i < runs.size(); i++) {
                TextRun run = runs.get(i);
                String text = run.getText().trim().replaceAll("\\s+", " ");
                if (i == 0 && stripMarker) {
                    // the marker is often a run of its own
                    text = MARKER_PREFIX.matcher(text + " ").replaceFirst("").trim();
                }
                if (text.isEmpty()) {
                    continue;
                }
                if (!first) {
                    para.appendText(" ");
                }
                first = false;
                if (run.isBold() && !allBold) {
                    para.appendElement("emphasis").attr("role", "bold").appendText(text);
                } else if (run.isItalic() && !allItalic) {
                    para.appendElement("emphasis").appendText(text);
                } else {
                    para.appendText(text);
                }
            }
            return para;
        }
    }
}
