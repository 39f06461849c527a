package com.example.rittdoc.xml;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Serializes the jsoup element tree as indented XML.
 * <p>
 * Structural elements get a line of their own so validator line numbers point at a single element.
 * An element holding text, or listed in {@link DocBook#INLINE_CONTAINERS}, is written on one line with its
 * content untouched. Output is deterministic for a given tree.
 */
public final class DocBookXmlWriter {

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private static final String INDENT = "  ";

    private DocBookXmlWriter() {
    }

    public static String toDocument(Element root) {
        StringBuilder out = new StringBuilder(XML_DECLARATION).append('\n');
        write(root, 0, out);
        return out.toString();
    }

    public static String toXml(Element root) {
        StringBuilder out = new StringBuilder();
        write(root, 0, out);
        return out.toString();
    }

    static void write(Element element, int depth, StringBuilder out) {
        indent(depth, out);
        if (isInline(element)) {
            writeInline(element, out);
            out.append('\n');
            return;
        }
        openTag(element, out);
        if (element.children().isEmpty()) {
            out.setLength(out.length() - 1);
            out.append("/>\n");
            return;
        }
        out.append('\n');
        for (Element child : element.children()) {
            write(child, depth + 1, out);
        }
        indent(depth, out);
        out.append("</").append(element.tagName()).append(">\n");
    }

    private static boolean isInline(Element element) {
        if (DocBook.INLINE_CONTAINERS.contains(element.normalName())) {
            return true;
        }
        for (Node node : element.childNodes()) {
            if (node instanceof TextNode && !((TextNode) node).isBlank()) {
                return true;
            }
        }
        return false;
    }

    private static void writeInline(Element element, StringBuilder out) {
        openTag(element, out);
        if (element.childNodeSize() == 0) {
            out.setLength(out.length() - 1);
            out.append("/>");
            return;
        }
        for (Node node : element.childNodes()) {
            if (node instanceof TextNode) {
                out.append(escape(((TextNode) node).getWholeText(), false));
            } else if (node instanceof Element) {
                writeInline((Element) node, out);
            }
        }
        out.append("</").append(element.tagName()).append('>');
    }

    private static void openTag(Element element, StringBuilder out) {
        out.append('<').append(element.tagName());
        for (Attribute attribute : element.attributes()) {
            out.append(' ').append(attribute.getKey()).append("=\"")
                    .append(escape(attribute.getValue(), true)).append('"');
        }
        out.append('>');
    }

    private static void indent(int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth));
    }

    public static String escape(String text, boolean attribute) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                case '"':
                    escaped.append(attribute ? "&quot;" : "\"");
                    break;
                default:
                    // drop characters XML 1.0 cannot carry
                    if (c >= 0x20 || c == '\t' || c == '\n' || c == '\r') {
                        escaped.append(c);
                    }
            }
        }
        return escaped.toString();
    }
}
