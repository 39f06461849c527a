package com.example.rittdoc.service.compliance;

import com.example.rittdoc.dto.conversion.BookMetadata;
import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.exception.ComplianceTransformException;
import com.example.rittdoc.model.TransformReport;
import com.example.rittdoc.xml.DocBook;
import com.example.rittdoc.xml.DocBookXmlWriter;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Year;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the intermediate tree into the subset the RittDoc DTD accepts.
 * <p>
 * The rules are deterministic and a second pass over already compliant input changes nothing.
 * A chapter whose sections nest deeper than {@value DocBook#MAX_SECTION_DEPTH} levels is rejected
 * before any of its elements are touched.
 */
@Service
public class DtdComplianceTransformer {

    private static final Logger logger = LoggerFactory.getLogger(DtdComplianceTransformer.class);

    /** Generic or informal elements the DTD does not declare, with their legal counterparts. */
    static final Map<String, String> ELEMENT_SUBSTITUTIONS = Map.of(
            "variablelist", "glosslist",
            "varlistentry", "glossentry",
            "term", "glossterm",
            "informalfigure", "figure",
            "informaltable", "table",
            "simplesect", "section",
            "p", "para");

    static final String PLACEHOLDER_CHAPTER_TITLE = "Untitled Chapter";
    static final String PLACEHOLDER_SECTION_TITLE = "Untitled Section";
    static final String INTRO_SECTION_TITLE = "Introduction";
    static final String PLACEHOLDER_BOOK_TITLE = "Untitled Book";
    static final String PLACEHOLDER_ISBN = "UNKNOWN";
    static final String PLACEHOLDER_AUTHOR = "Unknown Author";
    static final String PLACEHOLDER_PUBLISHER = "Unknown Publisher";

    private static final Set<String> BLOCKS = Set.of(
            "para", "itemizedlist", "orderedlist", "glosslist", "figure", "table",
            "blockquote", "note", "programlisting", "anchor");

    private static final Set<String> BLOCKS_NOT_IN_PARA = Set.of(
            "itemizedlist", "orderedlist", "glosslist", "figure", "table", "blockquote", "note", "programlisting");

    private static final Set<String> LISTS = Set.of("itemizedlist", "orderedlist", "glosslist");

    private static final Set<String> INLINES = Set.of(
            "emphasis", "ulink", "link", "anchor", "subscript", "superscript", "literal", "phrase");

    /** Containers whose content model admits blocks only. */
    private static final Set<String> BLOCK_CONTAINERS = Set.of(
            "sect1", "sect2", "sect3", "sect4", "sect5", "listitem", "glossdef", "blockquote", "note");

    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    /**
     * Transforms every chapter and the book metadata, failing on the first chapter that cannot be fixed.
     */
    public TransformReport transform(StructuredDocument document) {
        TransformReport report = new TransformReport();
        for (StructuredChapter chapter : document.getChapters()) {
            transformChapter(chapter, report);
        }
        resolveLinks(document, report);
        transformBookInfo(document, report);
        return report;
    }

    public void transformChapter(StructuredChapter chapter, TransformReport report) {
        Element root = chapter.getRoot();
        String chapterId = chapter.getId();

        int depth = maxSectionDepth(root, 0);
        if (depth > DocBook.MAX_SECTION_DEPTH) {
            throw new ComplianceTransformException(chapterId, String.format(
                    "Chapter %s nests sections %d levels deep, at most %d are supported",
                    chapterId, depth, DocBook.MAX_SECTION_DEPTH));
        }

        int before = report.getTotal();
        substituteElements(root, report);
        removeEmptyLists(root, report);
        renumberSections(root, 0, report);
        ensureChapterTitle(root, report);
        wrapChapterContent(root, chapterId, report);
        for (Element section : root.children()) {
            if (section.normalName().equals("sect1")) {
                normalizeSection(section, 1, report);
            }
        }
        fixBlocks(root, report);
        namespaceIds(chapter, report);

        logger.debug("Chapter {}: {} compliance fixes", chapterId, report.getTotal() - before);
    }

    /**
     * Rebuilds {@code bookinfo} from the metadata, filling required fields with placeholders.
     */
    public void transformBookInfo(StructuredDocument document, TransformReport report) {
        BookMetadata metadata = document.getMetadata();
        if (metadata == null) {
            metadata = new BookMetadata();
            document.setMetadata(metadata);
        }
        if (StringUtils.isBlank(metadata.getTitle())) {
            metadata.setTitle(PLACEHOLDER_BOOK_TITLE);
            report.record("placeholder title");
        }
        if (StringUtils.isBlank(metadata.getIsbn())) {
            metadata.setIsbn(PLACEHOLDER_ISBN);
            report.record("placeholder isbn");
        }
        if (metadata.getAuthors().stream().allMatch(StringUtils::isBlank)) {
            metadata.getAuthors().clear();
            metadata.getAuthors().add(PLACEHOLDER_AUTHOR);
            report.record("placeholder author");
        }
        if (StringUtils.isBlank(metadata.getPublisher())) {
            metadata.setPublisher(PLACEHOLDER_PUBLISHER);
            report.record("placeholder publisher");
        }
        if (StringUtils.isBlank(metadata.getCopyrightYear())) {
            metadata.setCopyrightYear(yearOf(metadata.getPublicationDate()));
            report.record("placeholder copyright year");
        }

        Element bookInfo = buildBookInfo(metadata);
        Element existing = document.getBookInfo();
        if (existing == null || !DocBookXmlWriter.toXml(existing).equals(DocBookXmlWriter.toXml(bookInfo))) {
            document.setBookInfo(bookInfo);
            report.record("bookinfo rebuilt");
        }
    }

    private int maxSectionDepth(Element element, int depth) {
        int max = depth;
        for (Element child : element.children()) {
            int childDepth = DocBook.isSection(child) ? depth + 1 : depth;
            max = Math.max(max, maxSectionDepth(child, childDepth));
        }
        return max;
    }

    private void substituteElements(Element root, TransformReport report) {
        for (Element element : root.getAllElements()) {
            String name = element.normalName();
            String replacement = ELEMENT_SUBSTITUTIONS.get(name);
            if (replacement == null && name.equals("listitem") && element.parent() != null
                    && element.parent().normalName().equals("glossentry")) {
                replacement = "glossdef";
            }
            if (replacement != null) {
                element.tagName(replacement);
                report.record(name + " -> " + replacement);
            }
        }
    }

    /**
     * Drops lists without items. Runs before sections are checked for body content, innermost lists first.
     */
    private void removeEmptyLists(Element root, TransformReport report) {
        List<Element> elements = root.getAllElements();
        for (int i = elements.size() - 1; i >= 0; i--) {
            Element list = elements.get(i);
            if (LISTS.contains(list.normalName()) && list.children().isEmpty() && StringUtils.isBlank(list.text())) {
                list.remove();
                report.record("empty " + list.normalName() + " removed");
            }
        }
    }

    private void renumberSections(Element element, int depth, TransformReport report) {
        for (Element child : element.children()) {
            if (DocBook.isSection(child)) {
                String name = "sect" + (depth + 1);
                if (!child.normalName().equals(name)) {
                    report.record(child.normalName() + " -> " + name);
                    child.tagName(name);
                }
                renumberSections(child, depth + 1, report);
            } else {
                renumberSections(child, depth, report);
            }
        }
    }

    private void ensureChapterTitle(Element chapter, TransformReport report) {
        for (Element child : chapter.children()) {
            if (child.normalName().equals("title")) {
                return;
            }
        }
        Element title = DocBook.element("title", PLACEHOLDER_CHAPTER_TITLE);
        Element after = null;
        for (Element child : chapter.children()) {
            if (child.normalName().equals("beginpage") || child.normalName().equals("chapterinfo")) {
                after = child;
            }
        }
        if (after != null) {
            after.after(title);
        } else {
            chapter.prependChild(title);
        }
        report.record("chapter title added");
    }

    /**
     * Moves every chapter child the DTD does not allow into a section: content ahead of the first
     * section goes into a generated introduction section, content after a section joins that section.
     */
    private void wrapChapterContent(Element chapter, String chapterId, TransformReport report) {
        wrapLooseContent(chapter, report);
        Element intro = null;
        Element lastSection = null;
        for (Element child : chapter.children()) {
            String name = child.normalName();
            if (name.equals("sect1")) {
                lastSection = child;
            } else if (!DocBook.CHAPTER_CHILDREN.contains(name)) {
                if (lastSection != null) {
                    lastSection.appendChild(child);
                    report.record("chapter content moved into preceding sect1");
                } else {
                    if (intro == null) {
                        intro = DocBook.element("sect1").attr("id", chapterId + "-intro");
                        intro.appendChild(DocBook.element("title", INTRO_SECTION_TITLE));
                        child.before(intro);
                        report.record("introduction sect1 generated");
                    }
                    intro.appendChild(child);
                }
            }
        }
    }

    private void normalizeSection(Element section, int level, TransformReport report) {
        Element title = null;
        for (Element child : section.children()) {
            if (child.normalName().equals("title")) {
                title = child;
                break;
            }
        }
        if (title == null) {
            section.prependChild(DocBook.element("title", PLACEHOLDER_SECTION_TITLE));
            report.record("section title added");
        } else if (section.child(0) != title) {
            section.prependChild(title);
            report.record("section title moved first");
        }

        wrapLooseContent(section, report);

        String subsectionName = "sect" + (level + 1);
        Element lastSubsection = null;
        boolean hasBody = false;
        for (Element child : section.children()) {
            String name = child.normalName();
            if (name.equals(subsectionName)) {
                lastSubsection = child;
                hasBody = true;
            } else if (!name.equals("title")) {
                if (lastSubsection != null) {
                    lastSubsection.appendChild(child);
                    report.record("section content moved into preceding " + subsectionName);
                } else {
                    hasBody = true;
                }
            }
        }
        if (!hasBody) {
            section.appendElement("para");
            report.record("empty section filled");
        }

        for (Element child : section.children()) {
            if (child.normalName().equals(subsectionName)) {
                normalizeSection(child, level + 1, report);
            }
        }
    }

    private void fixBlocks(Element root, TransformReport report) {
        for (Element para : root.getElementsByTag("para")) {
            liftBlocks(para, report);
        }
        for (Element para : root.getElementsByTag("para")) {
            if (para.parent() != null && hasAncestor(para, "para")) {
                para.unwrap();
                report.record("nested para unwrapped");
            }
        }

        for (Element element : root.getAllElements()) {
            switch (element.normalName()) {
                case "figure":
                    fixFigure(element, report);
                    break;
                case "table":
                    fixTable(element, report);
                    break;
                case "itemizedlist":
                case "orderedlist":
                    fixList(element, report);
                    break;
                case "glosslist":
                    fixGlossList(element, report);
                    break;
                case "glossentry":
                    fixGlossEntry(element, report);
                    break;
                case "ulink":
                    if (StringUtils.isBlank(element.attr("url"))) {
                        element.tagName("phrase");
                        report.record("ulink without url -> phrase");
                    }
                    break;
                case "link":
                    if (StringUtils.isBlank(element.attr("linkend"))) {
                        element.tagName("phrase");
                        report.record("link without linkend -> phrase");
                    }
                    break;
                default:
                    break;
            }
        }

        for (Element element : root.getAllElements()) {
            String name = element.normalName();
            if (BLOCK_CONTAINERS.contains(name) && !name.startsWith("sect")) {
                wrapLooseContent(element, report);
                if (element.children().stream().noneMatch(c -> BLOCKS.contains(c.normalName())
                        || c.normalName().equals("title"))) {
                    element.appendElement("para");
                    report.record("empty " + name + " filled");
                }
            }
        }
    }

    /**
     * Splits a paragraph around the blocks it holds: text before a block stays in the paragraph,
     * the block follows it and text after the block goes into a new paragraph.
     */
    private void liftBlocks(Element para, TransformReport report) {
        if (para.children().stream().noneMatch(c -> BLOCKS_NOT_IN_PARA.contains(c.normalName()))) {
            return;
        }
        Node anchor = para;
        Element current = para;
        for (Node node : new ArrayList<>(para.childNodes())) {
            if (node instanceof Element && BLOCKS_NOT_IN_PARA.contains(((Element) node).normalName())) {
                anchor.after(node);
                anchor = node;
                current = null;
                report.record(((Element) node).normalName() + " lifted out of para");
            } else if (current == null) {
                if (node instanceof TextNode && ((TextNode) node).isBlank()) {
                    node.remove();
                    continue;
                }
                current = DocBook.element("para");
                anchor.after(current);
                anchor = current;
                current.appendChild(node);
            } else if (current != para) {
                current.appendChild(node);
            }
        }
        if (!para.hasAttr("id") && para.childNodes().stream()
                .allMatch(n -> n instanceof TextNode && ((TextNode) n).isBlank())) {
            para.remove();
        }
    }

    private void fixFigure(Element figure, TransformReport report) {
        ensureLeadingTitle(figure, "", report);
        Node anchor = figure;
        boolean hasMedia = false;
        for (Element child : figure.children()) {
            String name = child.normalName();
            if (name.equals("mediaobject")) {
                hasMedia = true;
            } else if (!name.equals("title")) {
                anchor.after(child);
                anchor = child;
                report.record("figure content moved after figure");
            }
        }
        if (!hasMedia) {
            figure.appendChild(DocBook.element("mediaobject")
                    .appendChild(DocBook.element("textobject")
                            .appendChild(DocBook.element("phrase", "Image not available"))));
            report.record("figure mediaobject placeholder");
        }
    }

    private void fixTable(Element table, TransformReport report) {
        ensureLeadingTitle(table, "", report);

        Element tgroup = null;
        for (Element child : table.children()) {
            if (child.normalName().equals("tgroup")) {
                tgroup = child;
                break;
            }
        }
        if (tgroup == null) {
            tgroup = DocBook.element("tgroup");
            table.appendChild(tgroup);
            for (Element child : table.children()) {
                String name = child.normalName();
                if (name.equals("thead") || name.equals("tbody") || name.equals("row")) {
                    tgroup.appendChild(child);
                }
            }
            report.record("tgroup added");
        }

        Node anchor = table;
        for (Element child : table.children()) {
            String name = child.normalName();
            if (!name.equals("title") && !name.equals("tgroup")) {
                anchor.after(child);
                anchor = child;
                report.record("table content moved after table");
            }
        }

        for (Element group : table.children()) {
            if (group.normalName().equals("tgroup")) {
                fixTableGroup(group, report);
            }
        }
    }

    private void fixTableGroup(Element tgroup, TransformReport report) {
        Element thead = null;
        Element tbody = null;
        for (Element child : tgroup.children()) {
            if (child.normalName().equals("thead") && thead == null) {
                thead = child;
            } else if (child.normalName().equals("tbody") && tbody == null) {
                tbody = child;
            }
        }
        if (tbody == null) {
            tbody = DocBook.element("tbody");
            tgroup.appendChild(tbody);
            report.record("tbody added");
        }
        for (Element child : tgroup.children()) {
            if (child.normalName().equals("row")) {
                tbody.appendChild(child);
                report.record("row moved into tbody");
            }
        }
        if (tbody.children().isEmpty() && thead != null) {
            for (Element row : thead.children()) {
                tbody.appendChild(row);
            }
            thead.remove();
            thead = null;
            report.record("header rows used as body");
        }
        if (tbody.children().isEmpty()) {
            tbody.appendElement("row").appendElement("entry");
            report.record("empty table filled");
        }
        if (thead != null && thead.children().isEmpty()) {
            thead.remove();
            report.record("empty thead removed");
        }

        int columns = 1;
        for (Element row : tgroup.getElementsByTag("row")) {
            if (row.children().isEmpty()) {
                row.appendElement("entry");
                report.record("empty row filled");
            }
            columns = Math.max(columns, row.children().size());
        }
        String cols = String.valueOf(columns);
        if (!cols.equals(tgroup.attr("cols"))) {
            tgroup.attr("cols", cols);
            report.record("tgroup cols set");
        }
    }

    private void fixList(Element list, TransformReport report) {
        for (Node node : new ArrayList<>(list.childNodes())) {
            if (node instanceof TextNode && ((TextNode) node).isBlank()) {
                continue;
            }
            if (node instanceof Element && ((Element) node).normalName().equals("listitem")) {
                continue;
            }
            Element item = DocBook.element("listitem");
            node.before(item);
            if (node instanceof Element && BLOCKS.contains(((Element) node).normalName())) {
                item.appendChild(node);
            } else {
                item.appendElement("para").appendChild(node);
            }
            report.record("list content wrapped in listitem");
        }
    }

    private void fixGlossList(Element list, TransformReport report) {
        for (Element child : list.children()) {
            if (!child.normalName().equals("glossentry")) {
                Element entry = DocBook.element("glossentry");
                child.before(entry);
                entry.appendChild(DocBook.element("glossterm"));
                entry.appendChild(DocBook.element("glossdef").appendChild(child));
                report.record("glosslist content wrapped in glossentry");
            }
        }
    }

    private void fixGlossEntry(Element entry, TransformReport report) {
        Element term = null;
        Element definition = null;
        for (Element child : entry.children()) {
            String name = child.normalName();
            if (name.equals("glossterm")) {
                if (term == null) {
                    term = child;
                } else {
                    term.appendText("; ");
                    for (Node node : new ArrayList<>(child.childNodes())) {
                        term.appendChild(node);
                    }
                    child.remove();
                    report.record("glossterms merged");
                }
            } else if (name.equals("glossdef")) {
                if (definition == null) {
                    definition = child;
                } else {
                    for (Node node : new ArrayList<>(child.childNodes())) {
                        definition.appendChild(node);
                    }
                    child.remove();
                    report.record("glossdefs merged");
                }
            }
        }
        if (term == null) {
            term = DocBook.element("glossterm");
            entry.prependChild(term);
            report.record("glossterm added");
        } else if (entry.child(0) != term) {
            entry.prependChild(term);
            report.record("glossterm moved first");
        }
        if (definition == null) {
            definition = DocBook.element("glossdef");
            entry.appendChild(definition);
            report.record("glossdef added");
        }
        for (Element child : entry.children()) {
            if (child != term && child != definition) {
                definition.appendChild(child);
                report.record("glossentry content moved into glossdef");
            }
        }
        for (Node node : new ArrayList<>(entry.childNodes())) {
            if (node instanceof TextNode && !((TextNode) node).isBlank()) {
                definition.appendElement("para").appendChild(node);
                report.record("glossentry text moved into glossdef");
            }
        }
    }

    /**
     * Wraps runs of text and inline elements sitting directly in a block-only container into paragraphs.
     */
    private void wrapLooseContent(Element container, TransformReport report) {
        Element current = null;
        for (Node node : new ArrayList<>(container.childNodes())) {
            boolean loose;
            if (node instanceof TextNode) {
                loose = !((TextNode) node).isBlank();
                if (!loose && current != null) {
                    current.appendChild(node);
                    continue;
                }
            } else if (node instanceof Element) {
                String name = ((Element) node).normalName();
                loose = INLINES.contains(name) && !name.equals("anchor");
            } else {
                loose = false;
            }
            if (!loose) {
                current = null;
                continue;
            }
            if (current == null) {
                current = DocBook.element("para");
                node.before(current);
                report.record("loose content wrapped in para");
            }
            current.appendChild(node);
        }
    }

    private void ensureLeadingTitle(Element element, String placeholder, TransformReport report) {
        Element title = null;
        for (Element child : element.children()) {
            if (child.normalName().equals("title")) {
                title = child;
                break;
            }
        }
        if (title == null) {
            element.prependChild(DocBook.element("title", placeholder));
            report.record(element.normalName() + " title added");
        } else if (element.child(0) != title) {
            element.prependChild(title);
            report.record(element.normalName() + " title moved first");
        }
    }

    /**
     * Prefixes every id with the chapter id and makes the ids of a chapter unique.
     */
    private void namespaceIds(StructuredChapter structured, TransformReport report) {
        Element chapter = structured.getRoot();
        String chapterId = structured.getId();
        if (!chapterId.equals(chapter.attr("id"))) {
            chapter.attr("id", chapterId);
            report.record("chapter id set");
        }
        String prefix = chapterId + "-";
        Set<String> seen = new HashSet<>();
        for (Element element : chapter.getAllElements()) {
            if (element == chapter || !element.hasAttr("id")) {
                continue;
            }
            String id = element.attr("id");
            if (StringUtils.isBlank(id)) {
                element.removeAttr("id");
                report.record("empty id removed");
                continue;
            }
            String namespaced = id.startsWith(prefix) ? id : prefix + sanitizeId(id);
            String unique = namespaced;
            for (int n = 2; seen.contains(unique); n++) {
                unique = namespaced + "-" + n;
            }
            seen.add(unique);
            if (!unique.equals(namespaced)) {
                structured.getRenamedDuplicateIds().add(namespaced);
            }
            if (!unique.equals(id)) {
                element.attr("id", unique);
                report.record("id namespaced");
            }
        }
    }

    /**
     * Checks every {@code link} of the book against the ids of all chapters. A link whose target is gone,
     * for instance because its chapter was excluded or its anchor dropped, becomes a {@code phrase}.
     * A link to an id that was duplicated in its chapter still points at the first occurrence and is
     * reported; each rename is reported once.
     */
    public void resolveLinks(StructuredDocument document, TransformReport report) {
        Set<String> ids = new HashSet<>();
        Set<String> renamed = new HashSet<>();
        for (StructuredChapter chapter : document.getChapters()) {
            for (Element element : chapter.getRoot().getAllElements()) {
                if (element.hasAttr("id")) {
                    ids.add(element.attr("id"));
                }
            }
            renamed.addAll(chapter.getRenamedDuplicateIds());
        }

        for (StructuredChapter chapter : document.getChapters()) {
            for (Element link : chapter.getRoot().select("link[linkend]")) {
                String linkend = link.attr("linkend");
                if (!ids.contains(linkend)) {
                    logger.warn("Chapter {}: link to unknown id {} kept as text", chapter.getId(), linkend);
                    link.removeAttr("linkend");
                    link.tagName("phrase");
                    report.record("dangling link -> phrase");
                } else if (renamed.contains(linkend)) {
                    logger.warn("Chapter {}: link to {} resolves to the first of several elements with that id",
                            chapter.getId(), linkend);
                    report.record("link targets renamed duplicate id");
                }
            }
        }
        for (StructuredChapter chapter : document.getChapters()) {
            chapter.getRenamedDuplicateIds().clear();
        }
    }

    /**
     * Reduces a source fragment identifier to characters legal in an XML name.
     */
    public static String sanitizeId(String id) {
        return id.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static boolean hasAncestor(Element element, String name) {
        for (Element parent = element.parent(); parent != null; parent = parent.parent()) {
            if (parent.normalName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static String yearOf(String date) {
        if (date != null) {
            Matcher matcher = YEAR.matcher(date);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return String.valueOf(Year.now().getValue());
    }

    private static Element buildBookInfo(BookMetadata metadata) {
        Element info = DocBook.element("bookinfo");
        info.appendChild(DocBook.element("title", metadata.getTitle()));
        if (StringUtils.isNotBlank(metadata.getSubtitle())) {
            info.appendChild(DocBook.element("subtitle", metadata.getSubtitle()));
        }
        info.appendChild(DocBook.element("isbn", metadata.getIsbn()));

        Element authors = info.appendElement("authorgroup");
        for (String author : metadata.getAuthors()) {
            if (StringUtils.isBlank(author)) {
                continue;
            }
            Element personName = authors.appendElement("author").appendElement("personname");
            String[] name = splitName(author);
            if (name[0] != null) {
                personName.appendChild(DocBook.element("firstname", name[0]));
            }
            personName.appendChild(DocBook.element("surname", name[1]));
        }

        info.appendElement("publisher").appendChild(DocBook.element("publishername", metadata.getPublisher()));
        if (StringUtils.isNotBlank(metadata.getPublicationDate())) {
            info.appendChild(DocBook.element("pubdate", metadata.getPublicationDate()));
        }
        Element copyright = info.appendElement("copyright");
        copyright.appendChild(DocBook.element("year", metadata.getCopyrightYear()));
        if (StringUtils.isNotBlank(metadata.getCopyrightHolder())) {
            copyright.appendChild(DocBook.element("holder", metadata.getCopyrightHolder()));
        }
        return info;
    }

    /**
     * Splits "Last, First" or "First Middle Last" into first name (possibly null) and surname.
     */
    static String[] splitName(String author) {
        String name = author.trim().replaceAll("\\s+", " ");
        if (name.contains(",")) {
            String surname = name.substring(0, name.indexOf(',')).trim();
            String first = name.substring(name.indexOf(',') + 1).trim();
            return new String[]{first.isEmpty() ? null : first, surname};
        }
        int lastSpace = name.lastIndexOf(' ');
        if (lastSpace < 0) {
            return new String[]{null, name};
        }
        return new String[]{name.substring(0, lastSpace), name.substring(lastSpace + 1)};
    }
}
