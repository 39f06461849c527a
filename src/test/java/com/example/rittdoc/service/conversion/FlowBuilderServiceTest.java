package com.example.rittdoc.service.conversion;

import com.example.rittdoc.config.HeuristicsConfig;
import com.example.rittdoc.dto.conversion.Paragraph;
import com.example.rittdoc.dto.conversion.TextRun;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for paragraph grouping.
 */
class FlowBuilderServiceTest {

    private final FlowBuilderService flowBuilder = new FlowBuilderService(new HeuristicsConfig());

    private static TextRun run(String text, double y, int page, double size) {
        return TextRun.builder().text(text).x(72).y(y).width(200).height(size).pageNumber(page).fontSize(size).build();
    }

    private static List<String> texts(List<Paragraph> paragraphs) {
        return paragraphs.stream().map(Paragraph::getText).collect(Collectors.toList());
    }

    /**
     * Lines 16pt apart with a 14pt line height continue the same paragraph.
     */
    @Test
    void closeLinesMergeIntoOneParagraph() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("The heart has", 100, 1, 14),
                run("four chambers.", 116, 1, 14)));

        assertThat(texts(paragraphs)).containsExactly("The heart has four chambers.");
        assertThat(paragraphs.get(0).getBoundingBox().getY()).isEqualTo(100.0);
        assertThat(paragraphs.get(0).getBoundingBox().getBottom()).isEqualTo(130.0);
    }

    /**
     * The gap is the empty space between one line's bottom and the next line's top.
     * With 14pt lines the break comes at 28pt of space.
     */
    @Test
    void largeGapStartsNewParagraph() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("First paragraph.", 100, 1, 14),
                run("Second paragraph.", 143, 1, 14)));

        assertThat(texts(paragraphs)).containsExactly("First paragraph.", "Second paragraph.");
    }

    @Test
    void gapBelowTwoLineHeightsKeepsParagraph() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("Spaced out", 100, 1, 12),
                run("but still one paragraph.", 130, 1, 12)));

        assertThat(texts(paragraphs)).containsExactly("Spaced out but still one paragraph.");
    }

    /**
     * Small size differences, such as a slightly larger word, stay in the paragraph. Two points or more end it.
     */
    @Test
    void fontSizeBreakHasItsOwnThreshold() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("Body at eleven", 100, 1, 11),
                run("and a word at twelve and a half", 113, 1, 12.5),
                run("A larger heading", 128, 1, 14.5)));

        assertThat(texts(paragraphs)).containsExactly(
                "Body at eleven and a word at twelve and a half", "A larger heading");
    }

    @Test
    void fontSizeBreakIsConfigurable() {
        HeuristicsConfig strict = new HeuristicsConfig();
        strict.setParagraphFontSizeBreak(1.0);

        List<Paragraph> paragraphs = new FlowBuilderService(strict).buildParagraphs(List.of(
                run("Body at eleven", 100, 1, 11),
                run("and twelve and a half", 113, 1, 12.5)));

        assertThat(paragraphs).hasSize(2);
    }

    /**
     * A page break ends the paragraph even when the next line would sit right below on the same page.
     */
    @Test
    void pageBreakAlwaysEndsParagraph() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("End of page one", 700, 1, 14),
                run("start of page two", 50, 2, 14),
                run("still page two", 66, 2, 14),
                run("tiny gap across pages", 70, 3, 14)));

        assertThat(texts(paragraphs)).containsExactly(
                "End of page one", "start of page two still page two", "tiny gap across pages");
        for (Paragraph paragraph : paragraphs) {
            assertThat(paragraph.getRuns()).allMatch(r -> r.getPageNumber() == paragraph.getPageNumber());
        }
    }

    /**
     * Bullets and caption labels open their own paragraphs and carry a role.
     */
    @Test
    void listItemsAndCaptionsGetRoles() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("Valves include:", 100, 1, 11),
                run("• Mitral", 113, 1, 11),
                run("2. Aortic", 126, 1, 11),
                run("Figure 3 The valves", 139, 1, 11)));

        assertThat(paragraphs).extracting(Paragraph::getRole).containsExactly(
                Paragraph.ParagraphRole.BODY,
                Paragraph.ParagraphRole.LIST_ITEM,
                Paragraph.ParagraphRole.LIST_ITEM,
                Paragraph.ParagraphRole.CAPTION);
    }

    @Test
    void fontSizeChangeStartsNewParagraph() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("Physiology", 100, 1, 20),
                run("The cycle has two phases.", 122, 1, 14)));

        assertThat(texts(paragraphs)).containsExactly("Physiology", "The cycle has two phases.");
        assertThat(paragraphs.get(0).getFontSize()).isEqualTo(20.0);
    }

    @Test
    void blankRunsAreSkipped() {
        List<Paragraph> paragraphs = flowBuilder.buildParagraphs(List.of(
                run("  ", 100, 1, 14),
                run("Text", 116, 1, 14)));

        assertThat(texts(paragraphs)).containsExactly("Text");
        assertThat(flowBuilder.buildParagraphs(List.of())).isEmpty();
    }
}
