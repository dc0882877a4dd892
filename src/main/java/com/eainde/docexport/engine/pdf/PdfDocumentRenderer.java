package com.eainde.docexport.engine.pdf;

import com.eainde.docexport.engine.DocumentRenderer;
import com.eainde.docexport.engine.FormattingPlan;
import com.eainde.docexport.engine.ParsedText;
import com.eainde.docexport.engine.PropertyApplier;
import com.eainde.docexport.engine.RenderReport;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.PropertyRegistry;
import com.eainde.docexport.registry.Scope;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes PDF files with Apache PDFBox using the standard 14 fonts.
 *
 * <p>Page geometry is applied first so every page, including the first, uses the requested
 * size and margins. Margins that are each in range but together leave no printable area are
 * reverted to their defaults, axis by axis, and reported as property failures. Title and body
 * are independent text styles.</p>
 */
public class PdfDocumentRenderer implements DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentRenderer.class);

    private static final List<String> HORIZONTAL_MARGINS = List.of("leftMargin", "rightMargin");
    private static final List<String> VERTICAL_MARGINS = List.of("topMargin", "bottomMargin");

    @Override
    public DocumentKind kind() {
        return DocumentKind.PDF;
    }

    @Override
    public RenderReport render(ParsedText text, FormattingPlan plan, Path target) throws IOException {
        PropertyApplier applier = new PropertyApplier();

        Map<String, Object> page = plan.scope(Scope.PAGE);
        PdfPageLayout layout = applier.apply(Scope.PAGE, page, new PdfPageLayout(), PdfPropertyTables.PAGE);
        if (!layout.fitsHorizontally()) {
            revertMargins(layout, page, HORIZONTAL_MARGINS, applier);
        }
        if (!layout.fitsVertically()) {
            revertMargins(layout, page, VERTICAL_MARGINS, applier);
        }
        layout.checkPrintableArea();
        PdfTextStyle titleStyle = applier.apply(Scope.TITLE, plan.scope(Scope.TITLE), new PdfTextStyle(), PdfPropertyTables.TEXT);
        PdfTextStyle bodyStyle = applier.apply(Scope.BODY, plan.scope(Scope.BODY), new PdfTextStyle(), PdfPropertyTables.TEXT);

        try (PDDocument document = new PDDocument()) {
            int pages;
            try (PdfPageWriter writer = new PdfPageWriter(document, layout)) {
                if (text.hasTitle()) {
                    writer.writeBlock(text.title(), titleStyle);
                }
                for (String paragraph : text.paragraphs()) {
                    writer.writeBlock(paragraph, bodyStyle);
                }
                pages = writer.pageCount();
            }
            document.save(target.toFile());
            log.debug("Wrote {} page(s) to {}", pages, target);
        }
        return RenderReport.from(applier);
    }

    private void revertMargins(PdfPageLayout layout, Map<String, Object> page, List<String> keys,
                               PropertyApplier applier) {
        String reason = "No printable area left by " + layout.describe();
        Map<String, Object> defaults = PropertyRegistry.PDF.defaults(Scope.PAGE);
        for (String key : keys) {
            Object requested = page.get(key);
            Object fallback = defaults.get(key);
            if (requested != null && !requested.equals(fallback)) {
                PdfPropertyTables.PAGE.setter(key).apply(layout, fallback);
                applier.reject(Scope.PAGE, key, requested, reason);
            }
        }
    }
}
