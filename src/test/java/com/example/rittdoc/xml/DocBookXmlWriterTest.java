package com.example.rittdoc.xml;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the XML serializer.
 */
class DocBookXmlWriterTest {

    /**
     * Structural elements go on their own lines, text-bearing elements stay on one line, empty ones self-close.
     */
    @Test
    void writesIndentedDocument() {
        Element chapter = DocBook.element("chapter").attr("id", "ch0001");
        chapter.appendChild(DocBook.element("title", "A & B"));
        Element sect1 = DocBook.element("sect1").attr("id", "s\"1");
        chapter.appendChild(sect1);
        sect1.appendChild(DocBook.element("title", "Intro"));
        Element para = DocBook.element("para", "Use ");
        para.appendChild(DocBook.element("emphasis", "x < y").attr("role", "bold"));
        para.appendText(" \"always\"");
        sect1.appendChild(para);
        Element imageObject = DocBook.element("imageobject");
        imageObject.appendChild(DocBook.element("imagedata").attr("fileref", "MultiMedia/a.png"));
        sect1.appendChild(DocBook.element("mediaobject").appendChild(imageObject));
        sect1.appendChild(DocBook.element("para"));

        String xml = DocBookXmlWriter.toDocument(chapter);

        assertThat(xml).isEqualTo(
                "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                        + "<chapter id=\"ch0001\">\n"
                        + "  <title>A &amp; B</title>\n"
                        + "  <sect1 id=\"s&quot;1\">\n"
                        + "    <title>Intro</title>\n"
                        + "    <para>Use <emphasis role=\"bold\">x &lt; y</emphasis> \"always\"</para>\n"
                        + "    <mediaobject>\n"
                        + "      <imageobject>\n"
                        + "        <imagedata fileref=\"MultiMedia/a.png\"/>\n"
                        + "      </imageobject>\n"
                        + "    </mediaobject>\n"
                        + "    <para/>\n"
                        + "  </sect1>\n"
                        + "</chapter>\n");
    }

    @Test
    void escapeDropsCharactersXmlCannotCarry() {
        assertThat(DocBookXmlWriter.escape("a\u0001b\tc", false)).isEqualTo("ab\tc");
        assertThat(DocBookXmlWriter.escape("\"q\" > p", true)).isEqualTo("&quot;q&quot; &gt; p");
    }

    /**
     * The same tree always serializes to the same text.
     */
    @Test
    void outputIsDeterministic() {
        Element bookInfo = DocBook.element("bookinfo");
        bookInfo.appendChild(DocBook.element("title", "Cardiology"));

        assertThat(DocBookXmlWriter.toXml(bookInfo)).isEqualTo(DocBookXmlWriter.toXml(bookInfo.clone()));
        assertThat(DocBookXmlWriter.toXml(bookInfo)).isEqualTo("<bookinfo>\n  <title>Cardiology</title>\n</bookinfo>\n");
    }
}
