package com.example.rittdoc.service.conversion;

import com.example.rittdoc.model.ResourceKind;
import com.example.rittdoc.model.ResourceReference;
import com.example.rittdoc.service.compliance.DtdComplianceTransformer;
import com.example.rittdoc.service.extraction.EpubPackageReader;
import com.example.rittdoc.service.reference.ReferenceMapper;
import com.example.rittdoc.xml.DocBook;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts one XHTML spine document into one {@code <chapter>} element.
 * <p>
 * Output uses generic elements ({@code section}, {@code variablelist}, {@code informalfigure},
 * {@code informaltable}) that the compliance transformer later maps onto the DTD. Ids are copied as found;
 * link targets are written already namespaced with the chapter that owns them.
 * Not thread-safe, one instance per document.
 */
class XhtmlChapterConverter {

    private static final Pattern HEADING = Pattern.compile("h[1-6]");
    private static final Pattern URL_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:.*");

    private static final Set<String> SKIPPED = Set.of("script", "style", "hr", "head", "meta", "link", "noscript");

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "section", "article", "aside", "header", "footer", "main", "nav", "figure",
            "ul", "ol", "dl", "table", "blockquote", "pre", "h1", "h2", "h3", "h4", "h5", "h6",
            "img", "svg", "hr", "address", "center", "details", "summary", "figcaption", "body");

    private final String chapterId;
    private final String documentPath;
    private final String documentDir;
    private final Map<String, String> chapterIds;
    private final ReferenceMapper mapper;

    private final Deque<OpenSection> sections = new ArrayDeque<>();
    private Element chapter;
    private Element titleHeading;

    XhtmlChapterConverter(String chapterId, String documentPath, Map<String, String> chapterIds, ReferenceMapper mapper) {
        this.chapterId = chapterId;
        this.documentPath = documentPath;
        this.documentDir = documentPath.contains("/") ? documentPath.substring(0, documentPath.lastIndexOf('/') + 1) : "";
        this.chapterIds = chapterIds;
        this.mapper = mapper;
    }

    Element convert(Document html) {
        chapter = DocBook.element("chapter").attr("id", chapterId);
        Element title = chapter.appendElement("title");

        Element body = html.body();
        titleHeading = findTitleHeading(body);
        List<Element> titleFigures = new ArrayList<>();
        if (titleHeading != null) {
            appendInline(titleHeading, title, titleFigures);
            copyId(titleHeading, title);
        }
        if (StringUtils.isBlank(title.text())) {
            title.empty();
            title.appendText(titleFromFileName());
        }
        titleFigures.forEach(chapter::appendChild);

        processMixed(body, null);
        return chapter;
    }

    /**
     * First h1, otherwise the first h2 to h4. Documents without one (a glossary page, say) keep
     * all their headings as sections and take the title from the file name.
     */
    private Element findTitleHeading(Element body) {
        Element h1 = body.getElementsByTag("h1").first();
        if (h1 != null) {
            return h1;
        }
        for (Element element : body.getAllElements()) {
            String name = element.normalName();
            if (name.equals("h2") || name.equals("h3") || name.equals("h4")) {
                return element;
            }
        }
        return null;
    }

    private String titleFromFileName() {
        String name = documentPath.substring(documentPath.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        StringBuilder title = new StringBuilder();
        for (String word : StringUtils.split(stem.replaceAll("[_\\-]+", " "))) {
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(StringUtils.capitalize(word.toLowerCase(Locale.ROOT)));
        }
        return title.toString();
    }

    /**
     * Walks the children of {@code source}. Text and inline markup are collected into paragraphs, block
     * elements are converted in place. A null {@code target} means the current section of the chapter.
     */
    private void processMixed(Element source, Element target) {
        Element pending = null;
        for (Node node : source.childNodes()) {
            if (node instanceof Element && isBlock((Element) node)) {
                flush(pending, target);
                pending = null;
                processBlock((Element) node, target);
            } else if (node instanceof TextNode || node instanceof Element) {
                if (node instanceof TextNode && ((TextNode) node).isBlank() && pending == null) {
                    continue;
                }
                if (pending == null) {
                    pending = DocBook.element("para");
                }
                List<Element> figures = new ArrayList<>();
                appendInline(node, pending, figures);
                if (!figures.isEmpty()) {
                    flush(pending, target);
                    pending = null;
                    figures.forEach(f -> container(target).appendChild(f));
                }
            }
        }
        flush(pending, target);
    }

    private void flush(Element para, Element target) {
        if (para != null && (StringUtils.isNotBlank(para.text()) || !para.getElementsByTag("anchor").isEmpty())) {
            container(target).appendChild(para);
        }
    }

    private Element container(Element target) {
        if (target != null) {
            return target;
        }
        return sections.isEmpty() ? chapter : sections.peek().element;
    }

    private boolean isBlock(Element element) {
        return BLOCK_TAGS.contains(element.normalName()) || SKIPPED.contains(element.normalName());
    }

    private void processBlock(Element element, Element target) {
        String name = element.normalName();
        if (SKIPPED.contains(name)) {
            return;
        }
        if (HEADING.matcher(name).matches()) {
            processHeading(element, target);
            return;
        }
        switch (name) {
            case "p":
            case "address":
            case "summary":
            case "figcaption":
                processParagraph(element, target);
                break;
            case "ul":
            case "ol":
                container(target).appendChild(convertList(element));
                break;
            case "dl":
                List<Element> termFigures = new ArrayList<>();
                container(target).appendChild(convertDefinitionList(element, termFigures));
                termFigures.forEach(f -> container(target).appendChild(f));
                break;
            case "table":
                List<Element> cellFigures = new ArrayList<>();
                container(target).appendChild(convertTable(element, cellFigures));
                cellFigures.forEach(f -> container(target).appendChild(f));
                break;
            case "blockquote":
                Element quote = copyId(element, DocBook.element("blockquote"));
                processMixed(element, quote);
                container(target).appendChild(quote);
                break;
            case "aside":
                Element note = copyId(element, DocBook.element("note"));
                processMixed(element, note);
                container(target).appendChild(note);
                break;
            case "pre":
                container(target).appendChild(copyId(element, DocBook.element("programlisting", element.wholeText())));
                break;
            case "figure":
                container(target).appendChild(convertFigure(element));
                break;
            case "img":
            case "svg":
                imageFigures(element).forEach(f -> container(target).appendChild(f));
                break;
            default:
                // div-like containers: keep their id as an anchor and descend
                if (element.hasAttr("id") && StringUtils.isNotBlank(element.id())) {
                    container(target).appendChild(DocBook.element("anchor").attr("id", element.id()));
                }
                processMixed(element, target);
        }
    }

    private void processHeading(Element heading, Element target) {
        if (heading == titleHeading) {
            return;
        }
        if (target != null) {
            // headings inside lists, quotes and the like do not open sections
            Element para = copyId(heading, DocBook.element("para"));
            Element emphasis = para.appendElement("emphasis").attr("role", "bold");
            List<Element> figures = new ArrayList<>();
            appendInline(heading, emphasis, figures);
            target.appendChild(para);
            figures.forEach(target::appendChild);
            return;
        }
        int level = heading.normalName().charAt(1) - '0';
        while (!sections.isEmpty() && sections.peek().level >= level) {
            sections.pop();
        }
        Element section = copyId(heading, DocBook.element("section"));
        Element title = section.appendElement("title");
        List<Element> figures = new ArrayList<>();
        appendInline(heading, title, figures);
        container(null).appendChild(section);
        sections.push(new OpenSection(level, section));
        figures.forEach(section::appendChild);
    }

    private void processParagraph(Element paragraph, Element target) {
        Element para = copyId(paragraph, DocBook.element("para"));
        List<Element> figures = new ArrayList<>();
        for (Node node : paragraph.childNodes()) {
            appendInline(node, para, figures);
        }
        if (StringUtils.isNotBlank(para.text()) || !para.children().isEmpty()) {
            container(target).appendChild(para);
        }
        figures.forEach(f -> container(target).appendChild(f));
    }

    private Element convertList(Element list) {
        Element out = copyId(list, DocBook.element(list.normalName().equals("ol") ? "orderedlist" : "itemizedlist"));
        for (Element li : list.children()) {
            if (!li.normalName().equals("li")) {
                continue;
            }
            Element item = copyId(li, out.appendElement("listitem"));
            processMixed(li, item);
        }
        return out;
    }

    /**
     * Images inside terms go to {@code figures}, to be placed after the list.
     */
    private Element convertDefinitionList(Element dl, List<Element> figures) {
        Element out = copyId(dl, DocBook.element("variablelist"));
        Element entry = null;
        boolean hasDefinition = false;
        for (Element child : dl.children()) {
            if (child.normalName().equals("dt")) {
                if (entry == null || hasDefinition) {
                    entry = copyId(child, out.appendElement("varlistentry"));
                    hasDefinition = false;
                }
                Element term = entry.appendElement("term");
                appendInline(child, term, figures);
            } else if (child.normalName().equals("dd")) {
                if (entry == null) {
                    entry = out.appendElement("varlistentry");
                    entry.appendElement("term");
                }
                Element item = entry.appendElement("listitem");
                processMixed(child, item);
                hasDefinition = true;
            }
        }
        return out;
    }

    /**
     * Images inside the caption or the cells go to {@code figures}, to be placed after the table.
     */
    private Element convertTable(Element table, List<Element> figures) {
        Element caption = table.getElementsByTag("caption").first();
        Element out = copyId(table, DocBook.element(caption == null ? "informaltable" : "table"));
        if (caption != null) {
            appendInline(caption, out.appendElement("title"), figures);
        }

        Element tgroup = out.appendElement("tgroup");
        Element thead = DocBook.element("thead");
        Element tbody = DocBook.element("tbody");
        int columns = 1;
        for (Element tr : table.getElementsByTag("tr")) {
            boolean header = tr.parent() != null && tr.parent().normalName().equals("thead");
            Element row = (header ? thead : tbody).appendElement("row");
            for (Element cell : tr.children()) {
                if (cell.normalName().equals("td") || cell.normalName().equals("th")) {
                    appendInline(cell, row.appendElement("entry"), figures);
                }
            }
            columns = Math.max(columns, row.children().size());
        }
        tgroup.attr("cols", String.valueOf(columns));
        if (!thead.children().isEmpty()) {
            tgroup.appendChild(thead);
        }
        tgroup.appendChild(tbody);
        return out;
    }

    private Element convertFigure(Element figure) {
        Element caption = figure.getElementsByTag("figcaption").first();
        Element out = copyId(figure, DocBook.element(caption == null ? "informalfigure" : "figure"));
        if (caption != null) {
            // caption images are among the figure's own media objects below
            Element captionText = caption.clone();
            captionText.select("img, svg").remove();
            appendInline(captionText, out.appendElement("title"), new ArrayList<>());
        }
        for (Element img : images(figure)) {
            out.appendChild(mediaObject(img));
        }
        return out;
    }

    private List<Element> imageFigures(Element element) {
        List<Element> figures = new ArrayList<>();
        for (Element img : images(element)) {
            Element figure = DocBook.element("informalfigure");
            copyId(img, figure);
            figure.appendChild(mediaObject(img));
            figures.add(figure);
        }
        return figures;
    }

    private List<Element> images(Element element) {
        List<Element> images = new ArrayList<>();
        for (Element candidate : element.getAllElements()) {
            String name = candidate.normalName();
            if (name.equals("img") || (name.equals("image") && !imageSource(candidate).isEmpty())) {
                images.add(candidate);
            }
        }
        return images;
    }

    private static String imageSource(Element img) {
        for (String attribute : new String[]{"src", "xlink:href", "href"}) {
            if (StringUtils.isNotBlank(img.attr(attribute))) {
                return img.attr(attribute).trim();
            }
        }
        return "";
    }

    private Element mediaObject(Element img) {
        String src = imageSource(img);
        String fileref = src;
        if (!src.isEmpty() && !URL_SCHEME.matcher(src).matches()) {
            String path = EpubPackageReader.resolve(documentDir, src);
            Optional<ResourceReference> resource = mapper.find(path);
            if (resource.isPresent() && resource.get().getKind() == ResourceKind.IMAGE) {
                mapper.recordCrossReference(ResourceKind.IMAGE, chapterId, src, path, null);
                fileref = resource.get().getIntermediateName();
            } else {
                mapper.recordCrossReference(ResourceKind.IMAGE, chapterId, src, null, null);
            }
        } else {
            mapper.recordCrossReference(ResourceKind.IMAGE, chapterId, src, null, null);
        }

        Element mediaObject = DocBook.element("mediaobject");
        mediaObject.appendElement("imageobject").appendElement("imagedata").attr("fileref", fileref);
        String alt = img.attr("alt").trim();
        if (!alt.isEmpty()) {
            mediaObject.appendElement("textobject").appendChild(DocBook.element("phrase", alt));
        }
        return mediaObject;
    }

    /**
     * Appends the inline rendering of {@code node} to {@code out}. Images met on the way are returned
     * through {@code figures} so the caller can place them after the paragraph.
     */
    private void appendInline(Node node, Element out, List<Element> figures) {
        if (node instanceof TextNode) {
            out.appendText(((TextNode) node).text());
            return;
        }
        if (!(node instanceof Element)) {
            return;
        }
        Element element = (Element) node;
        String name = element.normalName();
        if (SKIPPED.contains(name)) {
            return;
        }
        switch (name) {
            case "em":
            case "i":
            case "cite":
            case "dfn":
            case "var":
                appendChildren(element, out.appendElement("emphasis"), figures);
                break;
            case "strong":
            case "b":
                appendChildren(element, out.appendElement("emphasis").attr("role", "bold"), figures);
                break;
            case "u":
                appendChildren(element, out.appendElement("emphasis").attr("role", "underline"), figures);
                break;
            case "sub":
                appendChildren(element, out.appendElement("subscript"), figures);
                break;
            case "sup":
                appendChildren(element, out.appendElement("superscript"), figures);
                break;
            case "code":
            case "kbd":
            case "samp":
            case "tt":
                out.appendChild(DocBook.element("literal", element.text()));
                break;
            case "br":
                out.appendText(" ");
                break;
            case "a":
                appendLink(element, out, figures);
                break;
            case "img":
            case "svg":
                figures.addAll(imageFigures(element));
                break;
            default:
                if (element.hasAttr("id") && StringUtils.isNotBlank(element.id()) && !HEADING.matcher(name).matches()) {
                    out.appendElement("anchor").attr("id", element.id());
                }
                appendChildren(element, out, figures);
        }
    }

    private void appendChildren(Element element, Element out, List<Element> figures) {
        for (Node child : element.childNodes()) {
            appendInline(child, out, figures);
        }
    }

    private void appendLink(Element anchor, Element out, List<Element> figures) {
        if (StringUtils.isNotBlank(anchor.id())) {
            out.appendElement("anchor").attr("id", anchor.id());
        }
        String href = anchor.attr("href").trim();
        if (href.isEmpty()) {
            appendChildren(anchor, out, figures);
            return;
        }
        if (URL_SCHEME.matcher(href).matches()) {
            appendChildren(anchor, out.appendElement("ulink").attr("url", href), figures);
            return;
        }

        int hash = href.indexOf('#');
        String filePart = hash >= 0 ? href.substring(0, hash) : href;
        String fragment = hash >= 0 ? href.substring(hash + 1) : "";
        String targetPath = filePart.isEmpty() ? documentPath : EpubPackageReader.resolve(documentDir, filePart);
        String targetChapter = chapterIds.get(targetPath);

        if (targetChapter == null) {
            mapper.recordCrossReference(ResourceKind.LINK, chapterId, href, null, StringUtils.trimToNull(fragment));
            appendChildren(anchor, out.appendElement("ulink").attr("url", href), figures);
            return;
        }
        mapper.recordCrossReference(ResourceKind.LINK, chapterId, href, targetPath, StringUtils.trimToNull(fragment));
        String linkend = fragment.isEmpty()
                ? targetChapter
                : targetChapter + "-" + DtdComplianceTransformer.sanitizeId(fragment);
        appendChildren(anchor, out.appendElement("link").attr("linkend", linkend), figures);
    }

    private static Element copyId(Element source, Element target) {
        if (StringUtils.isNotBlank(source.id())) {
            target.attr("id", source.id());
        }
        return target;
    }

    private static final class OpenSection {
        final int level;
        final Element element;

        OpenSection(int level, Element element) {
            this.level = level;
            this.element = element;
        }
    }
}
