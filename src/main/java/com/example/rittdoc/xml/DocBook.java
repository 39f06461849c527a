package com.example.rittdoc.xml;

import org.jsoup.nodes.Element;

import java.util.Set;

/**
 * Element names of the RittDoc grammar and small helpers to build the tree with jsoup.
 */
public final class DocBook {

    public static final String PUBLIC_ID = "-//RIS Dev//DTD DocBook V4.3 -Based Variant V1.1//EN";
    public static final String DTD_DIRECTORY = "RITTDOCdtd/v1.1";
    public static final String DTD_FILE_NAME = "RittDocBook.dtd";
    public static final String DTD_SYSTEM_ID = DTD_DIRECTORY + "/" + DTD_FILE_NAME;
    public static final String BOOK_FILE_NAME = "Book.XML";
    public static final String MEDIA_DIRECTORY = "MultiMedia";

    /** Elements a chapter may hold directly. */
    public static final Set<String> CHAPTER_CHILDREN = Set.of(
            "beginpage", "chapterinfo", "title", "subtitle", "titleabbrev", "tocchap",
            "toc", "lot", "index", "glossary", "bibliography", "sect1", "section");

    /** Children that stay ahead of the sections of a chapter or section. */
    public static final Set<String> HEADER_CHILDREN = Set.of(
            "beginpage", "chapterinfo", "title", "subtitle", "titleabbrev", "tocchap");

    public static final Set<String> SECTION_NAMES = Set.of(
            "section", "simplesect", "sect1", "sect2", "sect3", "sect4", "sect5");

    public static final int MAX_SECTION_DEPTH = 5;

    /** Elements whose content is text and inline markup. */
    public static final Set<String> INLINE_CONTAINERS = Set.of(
            "title", "subtitle", "para", "glossterm", "term", "phrase", "emphasis", "ulink", "link",
            "subscript", "superscript", "literal", "programlisting", "firstname", "surname", "year",
            "holder", "isbn", "publishername", "pubdate", "entry");

    private DocBook() {
    }

    public static Element element(String name) {
        return new Element(name);
    }

    public static Element element(String name, String text) {
        Element element = new Element(name);
        if (text != null) {
            element.appendText(text);
        }
        return element;
    }

    public static boolean isSection(Element element) {
        return SECTION_NAMES.contains(element.normalName());
    }

    public static String chapterId(int index) {
        return String.format("ch%04d", index);
    }
}
