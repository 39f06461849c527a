package com.example.rittdoc.service.compliance;

import com.example.rittdoc.dto.conversion.BookMetadata;
import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.exception.ComplianceTransformException;
import com.example.rittdoc.model.TransformReport;
import com.example.rittdoc.xml.DocBook;
import com.example.rittdoc.xml.DocBookXmlWriter;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the rewrite of the intermediate tree into DTD-legal DocBook.
 */
class DtdComplianceTransformerTest {

    private final DtdComplianceTransformer transformer = new DtdComplianceTransformer();

    private static Element section(String id, String title) {
        Element section = DocBook.element("section");
        if (id != null) {
            section.attr("id", id);
        }
        section.appendChild(DocBook.element("title", title));
        return section;
    }

    private static StructuredChapter sampleChapter() {
        Element chapter = DocBook.element("chapter");
        chapter.appendChild(DocBook.element("title", "The Heart"));
        chapter.appendChild(DocBook.element("p", "Intro text"));

        Element anatomy = section("a", "Anatomy");
        anatomy.appendChild(DocBook.element("p", "Body"));
        Element valves = section("a", "Valves");
        Element mitral = section(null, "Mitral");
        Element listItem = DocBook.element("listitem").appendChild(DocBook.element("p", "Mitral valve"));
        Element entry = DocBook.element("varlistentry")
                .appendChild(DocBook.element("term", "MV"))
                .appendChild(listItem);
        mitral.appendChild(DocBook.element("variablelist").appendChild(entry));
        valves.appendChild(mitral);
        anatomy.appendChild(valves);
        chapter.appendChild(anatomy);
        return new StructuredChapter("ch0001", "chapter1.xhtml", chapter);
    }

    /**
     * Generic sections become numbered ones, loose content lands in an introduction section,
     * the definition list becomes a glossary list and ids are made unique per chapter.
     */
    @Test
    void rewritesChapterIntoLegalForm() {
        StructuredChapter chapter = sampleChapter();
        TransformReport report = new TransformReport();

        transformer.transformChapter(chapter, report);

        assertThat(DocBookXmlWriter.toXml(chapter.getRoot())).isEqualTo(
                "<chapter id=\"ch0001\">\n"
                        + "  <title>The Heart</title>\n"
                        + "  <sect1 id=\"ch0001-intro\">\n"
                        + "    <title>Introduction</title>\n"
                        + "    <para>Intro text</para>\n"
                        + "  </sect1>\n"
                        + "  <sect1 id=\"ch0001-a\">\n"
                        + "    <title>Anatomy</title>\n"
                        + "    <para>Body</para>\n"
                        + "    <sect2 id=\"ch0001-a-2\">\n"
                        + "      <title>Valves</title>\n"
                        + "      <sect3>\n"
                        + "        <title>Mitral</title>\n"
                        + "        <glosslist>\n"
                        + "          <glossentry>\n"
                        + "            <glossterm>MV</glossterm>\n"
                        + "            <glossdef>\n"
                        + "              <para>Mitral valve</para>\n"
                        + "            </glossdef>\n"
                        + "          </glossentry>\n"
                        + "        </glosslist>\n"
                        + "      </sect3>\n"
                        + "    </sect2>\n"
                        + "  </sect1>\n"
                        + "</chapter>\n");
        assertThat(chapter.getRoot().select("p, section, variablelist, varlistentry, term, listitem")).isEmpty();
        assertThat(report.getTotal()).isPositive();
        assertThat(report.getFixes()).containsKeys("variablelist -> glosslist", "section -> sect1",
                "introduction sect1 generated", "id namespaced");
    }

    /**
     * Running over already compliant output changes nothing and records nothing.
     */
    @Test
    void secondPassIsNoOp() {
        StructuredChapter chapter = sampleChapter();
        transformer.transformChapter(chapter, new TransformReport());
        String once = DocBookXmlWriter.toXml(chapter.getRoot());

        TransformReport second = new TransformReport();
        transformer.transformChapter(chapter, second);

        assertThat(DocBookXmlWriter.toXml(chapter.getRoot())).isEqualTo(once);
        assertThat(second.isEmpty()).isTrue();
    }

    /**
     * A section whose only content is an empty list is filled in the first pass, not the second.
     */
    @Test
    void emptyListIsDroppedBeforeSectionsAreChecked() {
        Element chapter = DocBook.element("chapter");
        chapter.appendChild(DocBook.element("title", "Lists"));
        Element sect = section("s", "S");
        sect.appendChild(DocBook.element("itemizedlist"));
        chapter.appendChild(sect);
        StructuredChapter structured = new StructuredChapter("ch0003", "lists.xhtml", chapter);

        TransformReport first = new TransformReport();
        transformer.transformChapter(structured, first);
        String once = DocBookXmlWriter.toXml(chapter);

        assertThat(once).isEqualTo(
                "<chapter id=\"ch0003\">\n"
                        + "  <title>Lists</title>\n"
                        + "  <sect1 id=\"ch0003-s\">\n"
                        + "    <title>S</title>\n"
                        + "    <para/>\n"
                        + "  </sect1>\n"
                        + "</chapter>\n");
        assertThat(first.getFixes()).containsKeys("empty itemizedlist removed", "empty section filled");

        TransformReport second = new TransformReport();
        transformer.transformChapter(structured, second);
        assertThat(DocBookXmlWriter.toXml(chapter)).isEqualTo(once);
        assertThat(second.isEmpty()).isTrue();
    }

    /**
     * A list inside a paragraph splits it, so the text keeps its place around the list.
     */
    @Test
    void blockInsideParaSplitsParagraph() {
        Element chapter = DocBook.element("chapter");
        chapter.appendChild(DocBook.element("title", "Order"));
        Element sect = section("o", "Order");
        Element para = DocBook.element("para", "before ");
        para.appendChild(DocBook.element("itemizedlist")
                .appendChild(DocBook.element("listitem").appendChild(DocBook.element("para", "item"))));
        para.appendText(" after");
        sect.appendChild(para);
        chapter.appendChild(sect);
        StructuredChapter structured = new StructuredChapter("ch0004", "order.xhtml", chapter);

        TransformReport report = new TransformReport();
        transformer.transformChapter(structured, report);

        Element sect1 = chapter.selectFirst("sect1");
        assertThat(sect1.children()).extracting(Element::normalName)
                .containsExactly("title", "para", "itemizedlist", "para");
        assertThat(sect1.child(1).text()).isEqualTo("before");
        assertThat(sect1.child(2).text()).isEqualTo("item");
        assertThat(sect1.child(3).text()).isEqualTo("after");
        assertThat(report.getFixes()).containsKey("itemizedlist lifted out of para");

        String once = DocBookXmlWriter.toXml(chapter);
        TransformReport second = new TransformReport();
        transformer.transformChapter(structured, second);
        assertThat(DocBookXmlWriter.toXml(chapter)).isEqualTo(once);
        assertThat(second.isEmpty()).isTrue();
    }

    @Test
    void blockLeadingParaLeavesNoEmptyParagraph() {
        Element chapter = DocBook.element("chapter");
        chapter.appendChild(DocBook.element("title", "Lead"));
        Element sect = section("l", "Lead");
        Element para = DocBook.element("para");
        para.appendChild(DocBook.element("programlisting", "x = 1"));
        para.appendText("then text");
        sect.appendChild(para);
        chapter.appendChild(sect);

        transformer.transformChapter(new StructuredChapter("ch0005", "lead.xhtml", chapter), new TransformReport());

        assertThat(chapter.selectFirst("sect1").children()).extracting(Element::normalName)
                .containsExactly("title", "programlisting", "para");
        assertThat(chapter.selectFirst("sect1").child(2).text()).isEqualTo("then text");
    }

    /**
     * Six nested sections cannot be expressed and the chapter is left untouched.
     */
    /**
     * Both sections were called "a"; a link to it still lands on the first one, which is reported once.
     */
    @Test
    void linkToRenamedDuplicateIsReported() {
        StructuredChapter chapter = sampleChapter();
        chapter.getRoot().child(1).appendChild(DocBook.element("link", "anatomy").attr("linkend", "ch0001-a"));
        StructuredDocument document = new StructuredDocument();
        document.getChapters().add(chapter);
        transformer.transformChapter(chapter, new TransformReport());

        TransformReport report = new TransformReport();
        transformer.resolveLinks(document, report);
        TransformReport second = new TransformReport();
        transformer.resolveLinks(document, second);

        assertThat(chapter.getRoot().select("[id=ch0001-a-2]")).hasSize(1);
        assertThat(report.getFixes()).containsExactly(entry("link targets renamed duplicate id", 1));
        assertThat(chapter.getRoot().select("link[linkend=ch0001-a]")).hasSize(1);
        assertThat(second.isEmpty()).isTrue();
    }

    /**
     * Links into another chapter survive; a link whose chapter is gone is kept as text.
     */
    @Test
    void danglingLinkBecomesPhrase() {
        Element first = DocBook.element("chapter");
        first.appendChild(DocBook.element("title", "One"));
        first.appendChild(DocBook.element("p", "See ")
                .appendChild(DocBook.element("link", "the ECG").attr("linkend", "ch0002-ecg"))
                .appendChild(DocBook.element("link", "the appendix").attr("linkend", "ch0003-x")));
        Element second = DocBook.element("chapter");
        second.appendChild(DocBook.element("title", "Two"));
        second.appendChild(section("ecg", "ECG").appendChild(DocBook.element("p", "Waves")));
        StructuredDocument document = new StructuredDocument();
        document.getChapters().add(new StructuredChapter("ch0001", "one.xhtml", first));
        document.getChapters().add(new StructuredChapter("ch0002", "two.xhtml", second));

        TransformReport report = transformer.transform(document);

        assertThat(first.select("link").eachAttr("linkend")).containsExactly("ch0002-ecg");
        assertThat(first.select("phrase").eachText()).containsExactly("the appendix");
        assertThat(first.select("phrase").first().hasAttr("linkend")).isFalse();
        assertThat(report.getFixes()).containsEntry("dangling link -> phrase", 1);
    }

    @Test
    void tooDeepNestingIsRejectedWithoutChanges() {
        Element chapter = DocBook.element("chapter");
        chapter.appendChild(DocBook.element("title", "Deep"));
        Element parent = chapter;
        for (int level = 1; level <= 6; level++) {
            Element section = section("s" + level, "Level " + level);
            section.appendChild(DocBook.element("p", "Text " + level));
            parent.appendChild(section);
            parent = section;
        }
        StructuredChapter structured = new StructuredChapter("ch0007", "deep.xhtml", chapter);
        String before = DocBookXmlWriter.toXml(chapter);

        ComplianceTransformException e = assertThrows(ComplianceTransformException.class,
                () -> transformer.transformChapter(structured, new TransformReport()));

        assertThat(e.getChapterId()).isEqualTo("ch0007");
        assertThat(e.getMessage()).contains("6 levels");
        assertThat(DocBookXmlWriter.toXml(chapter)).isEqualTo(before);
    }

    /**
     * Informal figures and tables get the formal form with a leading title and a complete table group.
     */
    @Test
    void completesFiguresAndTables() {
        Element chapter = DocBook.element("chapter");
        chapter.appendChild(DocBook.element("title", "Imaging"));
        Element sect = section("m", "Methods");
        Element imageObject = DocBook.element("imageobject")
                .appendChild(DocBook.element("imagedata").attr("fileref", "img_0001.png"));
        sect.appendChild(DocBook.element("informalfigure")
                .appendChild(DocBook.element("mediaobject").appendChild(imageObject)));
        Element row = DocBook.element("row")
                .appendChild(DocBook.element("entry", "a"))
                .appendChild(DocBook.element("entry", "b"));
        sect.appendChild(DocBook.element("informaltable").appendChild(row));
        sect.appendChild(DocBook.element("figure").appendChild(DocBook.element("title", "Lost image")));
        chapter.appendChild(sect);
        StructuredChapter structured = new StructuredChapter("ch0002", "pages 3-4", chapter);

        transformer.transformChapter(structured, new TransformReport());

        Element table = chapter.selectFirst("table");
        assertThat(table).isNotNull();
        assertThat(table.child(0).normalName()).isEqualTo("title");
        assertThat(table.selectFirst("tgroup").attr("cols")).isEqualTo("2");
        assertThat(table.select("tgroup > tbody > row > entry")).hasSize(2);
        assertThat(chapter.select("figure")).hasSize(2);
        assertThat(chapter.select("figure").get(0).child(0).normalName()).isEqualTo("title");
        assertThat(chapter.select("figure").get(1).select("mediaobject textobject phrase").text())
                .isEqualTo("Image not available");
        assertThat(chapter.select("informalfigure, informaltable")).isEmpty();
    }

    @Test
    void sanitizeIdReplacesIllegalCharacters() {
        assertThat(DtdComplianceTransformer.sanitizeId(" fig 1:a ")).isEqualTo("fig_1_a");
        assertThat(DtdComplianceTransformer.sanitizeId("ecg-term")).isEqualTo("ecg-term");
    }

    /**
     * Missing metadata is filled with placeholders and the bookinfo is only rebuilt when it changes.
     */
    @Test
    void bookInfoGetsPlaceholders() {
        StructuredDocument document = new StructuredDocument();
        BookMetadata metadata = new BookMetadata();
        metadata.setPublicationDate("2019-03-01");
        document.setMetadata(metadata);
        TransformReport report = new TransformReport();

        transformer.transformBookInfo(document, report);

        Element bookInfo = document.getBookInfo();
        assertThat(bookInfo.selectFirst("title").text()).isEqualTo("Untitled Book");
        assertThat(bookInfo.selectFirst("isbn").text()).isEqualTo("UNKNOWN");
        assertThat(bookInfo.selectFirst("authorgroup author personname firstname").text()).isEqualTo("Unknown");
        assertThat(bookInfo.selectFirst("authorgroup author personname surname").text()).isEqualTo("Author");
        assertThat(bookInfo.selectFirst("publisher publishername").text()).isEqualTo("Unknown Publisher");
        assertThat(bookInfo.selectFirst("copyright year").text()).isEqualTo("2019");
        assertThat(report.getFixes()).containsKeys("placeholder title", "placeholder isbn", "bookinfo rebuilt");

        TransformReport second = new TransformReport();
        transformer.transformBookInfo(document, second);
        assertThat(second.isEmpty()).isTrue();
    }

    @Test
    void splitNameHandlesBothOrders() {
        assertThat(DtdComplianceTransformer.splitName("Doe, John")).containsExactly("John", "Doe");
        assertThat(DtdComplianceTransformer.splitName("Mary Ann  Smith")).containsExactly("Mary Ann", "Smith");
        assertThat(DtdComplianceTransformer.splitName("Plato")).containsExactly(null, "Plato");
    }
}
