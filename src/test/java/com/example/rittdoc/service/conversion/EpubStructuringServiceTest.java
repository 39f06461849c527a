package com.example.rittdoc.service.conversion;

import com.example.rittdoc.dto.conversion.EpubPackage;
import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.model.CrossReference;
import com.example.rittdoc.model.ResourceKind;
import com.example.rittdoc.model.ResourceReference;
import com.example.rittdoc.model.SourceFormat;
import com.example.rittdoc.service.extraction.EpubPackageReader;
import com.example.rittdoc.service.reference.ReferenceMapper;
import com.example.rittdoc.support.TestBooks;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for turning EPUB spine documents into intermediate chapters.
 */
class EpubStructuringServiceTest {

    private final EpubStructuringService service = new EpubStructuringService();
    private final ReferenceMapper mapper = new ReferenceMapper(new ObjectMapper());

    @TempDir
    Path tempDir;

    private StructuredDocument document;

    @BeforeEach
    void structureSample() throws Exception {
        EpubPackage epub = new EpubPackageReader().read(TestBooks.sampleEpub(tempDir, true));
        document = service.structure(epub, mapper, tempDir.resolve("media"));
    }

    private Element chapter(String id) {
        return document.findChapter(id).map(StructuredChapter::getRoot).orElseThrow();
    }

    /**
     * Every spine document becomes a chapter, including the glossary that has no heading at all.
     */
    @Test
    void oneChapterPerSpineDocument() {
        assertThat(document.getSourceFormat()).isEqualTo(SourceFormat.EPUB);
        assertThat(document.getMetadata().getTitle()).isEqualTo("Cardiology Basics");
        assertThat(document.getChapters()).extracting(StructuredChapter::getId)
                .containsExactly("ch0001", "ch0002", "ch0003", "ch0004", "ch0005");
        assertThat(document.getChapters()).extracting(c -> c.getRoot().child(0).text())
                .containsExactly("Introduction", "The Heart", "Methods of Imaging", "Methods", "Glossary");
        assertThat(document.getChapters().get(3).getSourcePath()).isEqualTo("OEBPS/text/chapter3.xhtml");
    }

    /**
     * Images get sequential intermediate names, are written to the media directory and empty ones are skipped.
     */
    @Test
    void registersImagesUnderIntermediateNames() {
        ResourceReference heart = mapper.find("OEBPS/images/heart.png").orElseThrow();
        assertThat(heart.getIntermediateName()).isEqualTo("img_0001.png");
        assertThat(heart.getGeometry().getWidth()).isEqualTo(8);
        assertThat(heart.getGeometry().getHeight()).isEqualTo(6);
        assertThat(heart.getReferencedIn()).containsExactly("ch0002");
        assertThat(mapper.find("OEBPS/images/unused.png").orElseThrow().getIntermediateName()).isEqualTo("img_0002.png");
        assertThat(mapper.find("OEBPS/images/empty.png")).isEmpty();
        assertThat(Files.isRegularFile(tempDir.resolve("media/img_0001.png"))).isTrue();
        assertThat(Files.exists(tempDir.resolve("media/img_0003.png"))).isFalse();
    }

    @Test
    void convertsSectionsFiguresAndLists() {
        Element heart = chapter("ch0002");

        assertThat(heart.child(0).id()).isEqualTo("top");
        assertThat(heart.select("> section > title").eachText()).containsExactly("Anatomy", "Physiology");
        assertThat(heart.select("section > section > title").text()).isEqualTo("Valves");
        assertThat(heart.select("section section itemizedlist listitem").eachText()).containsExactly("Mitral", "Aortic");
        Element figure = heart.selectFirst("figure");
        assertThat(figure.id()).isEqualTo("fig1");
        assertThat(figure.selectFirst("title").text()).isEqualTo("Figure 1 The heart");
        assertThat(figure.selectFirst("imagedata").attr("fileref")).isEqualTo("img_0001.png");
        assertThat(figure.select("textobject phrase").text()).isEqualTo("Heart diagram");
        assertThat(heart.selectFirst("emphasis").text()).isEqualTo("four");

        Element imaging = chapter("ch0003");
        assertThat(imaging.selectFirst("table > title").text()).isEqualTo("Table 1 Modalities");
        assertThat(imaging.selectFirst("tgroup").attr("cols")).isEqualTo("2");
        assertThat(imaging.select("thead row")).hasSize(1);
        assertThat(imaging.select("tbody row")).hasSize(2);
        assertThat(imaging.select("blockquote para").text()).isEqualTo("Look before you listen.");

        Element methods = chapter("ch0004");
        assertThat(methods.selectFirst("programlisting").text()).isEqualTo("rate = 60 / interval");
        assertThat(methods.select("section > title").text()).isEqualTo("Sampling");

        Element glossary = chapter("ch0005");
        assertThat(glossary.select("variablelist > varlistentry")).hasSize(2);
        assertThat(glossary.selectFirst("varlistentry").id()).isEqualTo("ecg-term");
        assertThat(glossary.select("varlistentry term").eachText()).containsExactly("ECG", "BP");
    }

    /**
     * Internal links point at the namespaced id of their target chapter; links leaving the book stay ulinks.
     */
    @Test
    void resolvesLinksAcrossChapters() {
        assertThat(chapter("ch0001").selectFirst("link").attr("linkend")).isEqualTo("ch0002-ecg");
        assertThat(chapter("ch0002").selectFirst("link").attr("linkend")).isEqualTo("ch0005-ecg-term");
        assertThat(chapter("ch0004").selectFirst("link").attr("linkend")).isEqualTo("ch0003");
        assertThat(chapter("ch0003").select("ulink").eachAttr("url"))
                .containsExactly("https://example.org/imaging", "missing.xhtml#x");

        List<CrossReference> references = mapper.getCrossReferences();
        assertThat(references).filteredOn(r -> r.getKind() == ResourceKind.LINK && r.getTargetPath() != null)
                .extracting(CrossReference::getTargetPath)
                .containsExactly("OEBPS/chapter1.xhtml", "OEBPS/glossary.xhtml", "OEBPS/chapter2.xhtml");
        assertThat(references).filteredOn(r -> r.getTargetPath() == null)
                .singleElement()
                .satisfies(r -> assertThat(r.getOriginalHref()).isEqualTo("missing.xhtml#x"));
        assertThat(mapper.find("OEBPS/chapter1.xhtml").orElseThrow().getIntermediateName()).isEqualTo("ch0002");
    }
}
