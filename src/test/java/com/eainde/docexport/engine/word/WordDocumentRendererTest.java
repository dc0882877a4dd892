package com.eainde.docexport.engine.word;

import com.eainde.docexport.engine.FormattingPlan;
import com.eainde.docexport.engine.FormattingPlanner;
import com.eainde.docexport.engine.ParsedText;
import com.eainde.docexport.engine.RenderReport;
import com.eainde.docexport.registry.PropertyRegistry;
import com.eainde.docexport.registry.Scope;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WordDocumentRendererTest {

    @TempDir
    Path tempDir;

    private final WordDocumentRenderer renderer = new WordDocumentRenderer();
    private final FormattingPlanner planner = new FormattingPlanner();

    @Test
    @DisplayName("title and body paragraphs get their own scope's styling")
    void appliesScopedStyling() throws IOException {
        Path target = tempDir.resolve("styled.docx");
        FormattingPlan plan = planner.plan(PropertyRegistry.WORD,
                Map.of("name", "Arial", "size", 14, "bold", true, "title_alignment", "center"));

        RenderReport report = renderer.render(
                new ParsedText("Report", List.of("First para.", "Second para.")), plan, target);

        try (XWPFDocument document = open(target)) {
            List<XWPFParagraph> paragraphs = document.getParagraphs();
            assertThat(paragraphs).extracting(XWPFParagraph::getText)
                    .containsExactly("Report", "First para.", "Second para.");

            XWPFParagraph title = paragraphs.get(0);
            assertThat(title.getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
            XWPFRun titleRun = title.getRuns().get(0);
            assertThat(titleRun.getFontSizeAsDouble()).isEqualTo(16.0);
            assertThat(titleRun.isBold()).isTrue();

            XWPFRun bodyRun = paragraphs.get(1).getRuns().get(0);
            assertThat(bodyRun.getFontFamily()).isEqualTo("Arial");
            assertThat(bodyRun.getFontSizeAsDouble()).isEqualTo(14.0);
            assertThat(bodyRun.isBold()).isTrue();
            assertThat(paragraphs.get(1).getAlignment()).isEqualTo(ParagraphAlignment.LEFT);
        }
        assertThat(report.applied().get(Scope.BODY))
                .containsEntry("name", "Arial")
                .containsEntry("size", 14);
        assertThat(report.failures()).isEmpty();
    }

    @Test
    @DisplayName("a value the document rejects is recorded and the rest still applies")
    void badColorIsRecorded() throws IOException {
        Path target = tempDir.resolve("color.docx");
        FormattingPlan plan = planner.plan(PropertyRegistry.WORD, Map.of("color", "neon glow", "italic", true));

        RenderReport report = renderer.render(new ParsedText("T", List.of("Body")), plan, target);

        assertThat(report.failures()).singleElement()
                .satisfies(f -> assertThat(f.key()).isEqualTo("color"));
        assertThat(report.applied().get(Scope.BODY)).containsEntry("italic", true).doesNotContainKey("color");
        try (XWPFDocument document = open(target)) {
            assertThat(document.getParagraphs().get(1).getRuns().get(0).isItalic()).isTrue();
        }
    }

    @Test
    void hexColorIsApplied() throws IOException {
        Path target = tempDir.resolve("hex.docx");
        FormattingPlan plan = planner.plan(PropertyRegistry.WORD, Map.of("title_color", "#1f4e79"));

        renderer.render(new ParsedText("Title", List.of()), plan, target);

        try (XWPFDocument document = open(target)) {
            assertThat(document.getParagraphs().get(0).getRuns().get(0).getColor()).isEqualTo("1F4E79");
        }
    }

    @Test
    void lineBreaksInsideAParagraphAreKept() throws IOException {
        Path target = tempDir.resolve("breaks.docx");

        renderer.render(new ParsedText("", List.of("line one\nline two")),
                planner.plan(PropertyRegistry.WORD, Map.of()), target);

        try (XWPFDocument document = open(target)) {
            assertThat(document.getParagraphs()).hasSize(1);
            assertThat(document.getParagraphs().get(0).getText()).contains("line one").contains("line two");
        }
    }

    private static XWPFDocument open(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return new XWPFDocument(in);
        }
    }
}
