package com.eainde.docexport.engine;

import com.eainde.docexport.engine.pdf.PdfDocumentRenderer;
import com.eainde.docexport.engine.word.WordDocumentRenderer;
import com.eainde.docexport.files.TimestampedArtifactPathAllocator;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.Scope;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentFormattingEngineTest {

    @TempDir
    Path tempDir;

    private DocumentFormattingEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine(tempDir, new WordDocumentRenderer(), new PdfDocumentRenderer());
    }

    @Nested
    @DisplayName("successful renders")
    class Success {

        @Test
        @DisplayName("title and two paragraphs survive a Word round trip")
        void wordRoundTrip() throws IOException {
            RenderResult result = engine.render("Report\n\nFirst para.\n\nSecond para.", Map.of(), DocumentKind.WORD);

            assertThat(result.path()).exists().hasExtension("docx");
            try (InputStream in = Files.newInputStream(result.path());
                 XWPFDocument document = new XWPFDocument(in)) {
                assertThat(document.getParagraphs()).hasSize(3);
                assertThat(document.getParagraphs().get(0).getText()).isEqualTo("Report");
            }
        }

        @Test
        void pdfHasSignature() throws IOException {
            RenderResult result = engine.render("Note\n\nBody.", Map.of(), DocumentKind.PDF);

            assertThat(result.path()).hasExtension("pdf");
            assertThat(new String(Files.readAllBytes(result.path()), 0, 4)).isEqualTo("%PDF");
            assertThat(result.appliedProperties().get(Scope.PAGE)).containsEntry("pageSize", "letter");
        }

        @Test
        void nullKindRendersWord() {
            RenderResult result = engine.render("T\n\nBody", Map.of(), null);

            assertThat(result.kind()).isEqualTo(DocumentKind.WORD);
            assertThat(result.path().getFileName().toString()).endsWith(".docx");
        }

        @Test
        @DisplayName("unknown keys are reported as ignored and never applied")
        void unknownKeysIgnored() {
            RenderResult result = engine.render("T\n\nBody", Map.of("glow", "neon", "size", 14), DocumentKind.WORD);

            assertThat(result.ignoredKeys()).containsExactly("glow");
            result.appliedProperties().values().forEach(applied -> assertThat(applied).doesNotContainKey("glow"));
            assertThat(result.applied(Scope.BODY)).containsEntry("size", 14);
            assertThat(result.path()).exists();
        }

        @Test
        @DisplayName("rejected and failed properties are both reported")
        void failuresReported() {
            RenderResult result = engine.render("T\n\nBody",
                    Map.of("size", "enormous", "color", "not-a-color"), DocumentKind.WORD);

            assertThat(result.propertyFailures()).extracting(PropertyFailure::key)
                    .containsExactlyInAnyOrder("size", "color");
            assertThat(result.path()).exists();
        }

        @Test
        @DisplayName("an in-range margin too wide for the page does not abort the PDF")
        void oversizedMarginKeepsOtherPreferences() throws IOException {
            RenderResult result = engine.render("Note\n\nBody.", Map.of("leftMargin", 700, "fontSize", 14), DocumentKind.PDF);

            assertThat(result.path()).exists();
            assertThat(new String(Files.readAllBytes(result.path()), 0, 4)).isEqualTo("%PDF");
            assertThat(result.propertyFailures()).extracting(PropertyFailure::key).containsExactly("leftMargin");
            assertThat(result.applied(Scope.BODY)).containsEntry("fontSize", 14);
        }

        @Test
        void customNameIsUsed() {
            RenderResult result = engine.render("T", Map.of(), DocumentKind.PDF, "../quarterly report.docx");

            assertThat(result.path().getParent()).isEqualTo(tempDir);
            assertThat(result.path().getFileName().toString()).startsWith("quarterly_report_").endsWith(".pdf");
        }
    }

    @Nested
    @DisplayName("render failures")
    class Failures {

        @Test
        @DisplayName("an unusable output directory raises RenderException")
        void unusableDirectory() throws IOException {
            Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
            DocumentFormattingEngine blocked = engine(blocker.resolve("exports"),
                    new WordDocumentRenderer(), new PdfDocumentRenderer());

            assertThatThrownBy(() -> blocked.render("T\n\nBody", Map.of(), DocumentKind.WORD))
                    .isInstanceOf(RenderException.class)
                    .satisfies(e -> assertThat(((RenderException) e).getKind()).isEqualTo(DocumentKind.WORD));
        }

        @Test
        @DisplayName("a renderer failure deletes the partially written file")
        void partialArtifactDeleted() throws IOException {
            DocumentRenderer failing = new DocumentRenderer() {
                @Override
                public DocumentKind kind() {
                    return DocumentKind.PDF;
                }

                @Override
                public RenderReport render(ParsedText text, FormattingPlan plan, Path target) throws IOException {
                    Files.writeString(target, "%PDF-partial");
                    throw new IOException("disk full");
                }
            };
            DocumentFormattingEngine failingEngine = engine(tempDir, new WordDocumentRenderer(), failing);

            assertThatThrownBy(() -> failingEngine.render("T\n\nBody", Map.of(), DocumentKind.PDF))
                    .isInstanceOf(RenderException.class)
                    .hasRootCauseMessage("disk full");
            try (Stream<Path> files = Files.list(tempDir)) {
                assertThat(files).isEmpty();
            }
        }
    }

    @Test
    void requiresARendererForEveryKind() {
        assertThatThrownBy(() -> engine(tempDir, new WordDocumentRenderer()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PDF");
    }

    private static DocumentFormattingEngine engine(Path directory, DocumentRenderer... renderers) {
        return new DocumentFormattingEngine(new SourceTextParser(100), new FormattingPlanner(),
                new TimestampedArtifactPathAllocator(directory, "export"), List.of(renderers));
    }
}
