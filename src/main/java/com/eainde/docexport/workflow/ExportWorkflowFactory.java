package com.eainde.docexport.workflow;

import com.eainde.docexport.analysis.ContentCleaner;
import com.eainde.docexport.analysis.FormattingExtractor;
import com.eainde.docexport.analysis.IntentClassifier;
import com.eainde.docexport.config.ExportProperties;
import com.eainde.docexport.edges.RenderRoutingEdge;
import com.eainde.docexport.engine.DocumentFormattingEngine;
import com.eainde.docexport.files.ArtifactOpener;
import com.eainde.docexport.nodes.AnalyzeIntentNode;
import com.eainde.docexport.nodes.CleanContentNode;
import com.eainde.docexport.nodes.ExtractFormattingNode;
import com.eainde.docexport.nodes.FinalizeNode;
import com.eainde.docexport.nodes.RenderDocumentNode;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.ExportState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.eainde.docexport.nodes.NodeNames.ANALYZE;
import static com.eainde.docexport.nodes.NodeNames.CLEAN;
import static com.eainde.docexport.nodes.NodeNames.EXTRACT_FORMAT;
import static com.eainde.docexport.nodes.NodeNames.FINALIZE;
import static com.eainde.docexport.nodes.NodeNames.PDF_RENDER;
import static com.eainde.docexport.nodes.NodeNames.WORD_RENDER;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Builds a new export graph, with new node instances, for every run.
 *
 * <pre>
 * START → analyze → [clean] → extract_format ─┬─ word_render ─┬→ finalize → END
 *                                             └─ pdf_render  ─┘
 * </pre>
 */
@Component
public class ExportWorkflowFactory {

    private final IntentClassifier classifier;
    private final ContentCleaner cleaner;
    private final FormattingExtractor extractor;
    private final DocumentFormattingEngine engine;
    private final ArtifactOpener opener;
    private final ExportProperties properties;

    public ExportWorkflowFactory(IntentClassifier classifier,
                                 ContentCleaner cleaner,
                                 FormattingExtractor extractor,
                                 DocumentFormattingEngine engine,
                                 ArtifactOpener opener,
                                 ExportProperties properties) {
        this.classifier = classifier;
        this.cleaner = cleaner;
        this.extractor = extractor;
        this.engine = engine;
        this.opener = opener;
        this.properties = properties;
    }

    public ExportWorkflow create(WorkflowOptions options) {
        WorkflowOptions opts = options != null ? options : WorkflowOptions.defaults();
        try {
            return new ExportWorkflow(build(opts));
        } catch (GraphStateException e) {
            throw new IllegalStateException("Export graph is invalid", e);
        }
    }

    private CompiledGraph<ExportState> build(WorkflowOptions options) throws GraphStateException {
        StateGraph<ExportState> workflow = new StateGraph<>(ExportState::new);

        workflow.addNode(ANALYZE, new AnalyzeIntentNode(classifier));
        workflow.addNode(EXTRACT_FORMAT, new ExtractFormattingNode(extractor));
        workflow.addNode(WORD_RENDER, new RenderDocumentNode(engine, DocumentKind.WORD, WORD_RENDER, options.customName()));
        workflow.addNode(PDF_RENDER, new RenderDocumentNode(engine, DocumentKind.PDF, PDF_RENDER, options.customName()));
        workflow.addNode(FINALIZE, new FinalizeNode(opener, properties.isAutoOpen()));

        workflow.addEdge(START, ANALYZE);
        if (options.cleanContent()) {
            workflow.addNode(CLEAN, new CleanContentNode(cleaner));
            workflow.addEdge(ANALYZE, CLEAN);
            workflow.addEdge(CLEAN, EXTRACT_FORMAT);
        } else {
            workflow.addEdge(ANALYZE, EXTRACT_FORMAT);
        }

        workflow.addConditionalEdges(
                EXTRACT_FORMAT,
                new RenderRoutingEdge(),
                Map.of(
                        WORD_RENDER, WORD_RENDER,
                        PDF_RENDER, PDF_RENDER
                )
        );

        workflow.addEdge(WORD_RENDER, FINALIZE);
        workflow.addEdge(PDF_RENDER, FINALIZE);
        workflow.addEdge(FINALIZE, END);

        return workflow.compile();
    }
}
