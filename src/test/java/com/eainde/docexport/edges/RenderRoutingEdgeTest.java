package com.eainde.docexport.edges;

import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.ExportState;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RenderRoutingEdgeTest {

    @Test
    void routesByKind() {
        assertThat(RenderRoutingEdge.route(DocumentKind.PDF)).isEqualTo("pdf_render");
        assertThat(RenderRoutingEdge.route(DocumentKind.WORD)).isEqualTo("word_render");
        assertThat(RenderRoutingEdge.route(null)).isEqualTo("word_render");
    }

    @Test
    void readsKindFromState() {
        ExportState pdf = new ExportState(Map.of(ExportState.DOCUMENT_KIND, DocumentKind.PDF));
        ExportState empty = new ExportState(Map.of());

        assertThat(new RenderRoutingEdge().apply(pdf).join()).isEqualTo("pdf_render");
        assertThat(new RenderRoutingEdge().apply(empty).join()).isEqualTo("word_render");
    }
}
