package com.eainde.docexport.engine.word;

import com.eainde.docexport.engine.DocumentRenderer;
import com.eainde.docexport.engine.FormattingPlan;
import com.eainde.docexport.engine.ParsedText;
import com.eainde.docexport.engine.PropertyApplier;
import com.eainde.docexport.engine.RenderReport;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.Scope;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes {@code .docx} files with Apache POI: one title paragraph followed by one paragraph per
 * body block, each carrying a single run so font properties apply uniformly.
 */
public class WordDocumentRenderer implements DocumentRenderer {

    @Override
    public DocumentKind kind() {
        return DocumentKind.WORD;
    }

    @Override
    public RenderReport render(ParsedText text, FormattingPlan plan, Path target) throws IOException {
        PropertyApplier applier = new PropertyApplier();

        try (XWPFDocument document = new XWPFDocument()) {
            if (text.hasTitle()) {
                writeParagraph(document, text.title(), plan.scope(Scope.TITLE), Scope.TITLE, applier);
            }
            for (String paragraph : text.paragraphs()) {
                writeParagraph(document, paragraph, plan.scope(Scope.BODY), Scope.BODY, applier);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                document.write(out);
            }
        }
        return RenderReport.from(applier);
    }

    private void writeParagraph(XWPFDocument document, String content, Map<String, Object> properties,
                                Scope scope, PropertyApplier applier) {
        XWPFParagraph paragraph = document.createParagraph();
        XWPFRun run = paragraph.createRun();

        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i].strip());
        }

        applier.apply(scope, properties, paragraph, WordPropertyTables.PARAGRAPH);
        applier.apply(scope, properties, run, WordPropertyTables.RUN);
    }
}
