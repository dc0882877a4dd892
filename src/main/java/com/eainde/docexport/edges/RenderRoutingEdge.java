package com.eainde.docexport.edges;

import com.eainde.docexport.nodes.NodeNames;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.ExportState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Picks the render node for the resolved document kind.
 */
@Log4j2
public class RenderRoutingEdge implements AsyncEdgeAction<ExportState> {

    @Override
    public CompletableFuture<String> apply(ExportState state) {
        String next = route(state.getDocumentKind());
        log.info("Routing to {}", next);
        return CompletableFuture.completedFuture(next);
    }

    /**
     * {@code PDF} goes to the PDF renderer; anything else, {@code null} included, to Word.
     */
    public static String route(DocumentKind kind) {
        return kind == DocumentKind.PDF ? NodeNames.PDF_RENDER : NodeNames.WORD_RENDER;
    }
}
