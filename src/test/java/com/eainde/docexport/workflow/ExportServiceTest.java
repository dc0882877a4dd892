package com.eainde.docexport.workflow;

import com.eainde.docexport.analysis.IntentAnalysis;
import com.eainde.docexport.analysis.IntentClassifier;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageFailure;
import com.eainde.docexport.state.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExportServiceTest {

    @Mock private ExportWorkflowFactory workflowFactory;
    @Mock private IntentClassifier classifier;

    private ExportService service;

    @BeforeEach
    void setUp() {
        service = new ExportService(workflowFactory, classifier);
    }

    @Test
    void exportRunsAFreshWorkflowWithDefaults() {
        ExportWorkflow workflow = mock(ExportWorkflow.class);
        ExportState finalState = new ExportState(Map.of(ExportState.ARTIFACT_PATH, "/tmp/export.docx"));
        when(workflowFactory.create(WorkflowOptions.defaults())).thenReturn(workflow);
        when(workflow.run("Title\n\nBody.", "Export")).thenReturn(finalState);

        assertThat(service.export("Title\n\nBody.", "Export")).isSameAs(finalState);
    }

    @Test
    @DisplayName("review returns the degraded verdict instead of failing")
    void reviewDegrades() {
        when(classifier.classify("save it")).thenReturn(StageResult.degraded(IntentAnalysis.noExport(),
                new StageFailure(FailureKind.CLASSIFICATION, "analyze", "timeout")));

        assertThat(service.review("save it")).isEqualTo(IntentAnalysis.noExport());
    }

    @Test
    void exportIfRequestedSkipsWithoutIntent() {
        when(classifier.classify("thanks!")).thenReturn(
                StageResult.success(new IntentAnalysis(false, DocumentKind.WORD, "Just a thank-you")));

        Optional<ExportState> result = service.exportIfRequested("Some answer", "thanks!");

        assertThat(result).isEmpty();
        verify(workflowFactory, never()).create(any());
    }

    @Test
    @DisplayName("exportIfRequested enables the cleaner when an export is wanted")
    void exportIfRequestedCleans() {
        ExportWorkflow workflow = mock(ExportWorkflow.class);
        ExportState finalState = new ExportState(Map.of());
        when(classifier.classify("pdf please")).thenReturn(
                StageResult.success(new IntentAnalysis(true, DocumentKind.PDF, "Asked for a PDF")));
        when(workflowFactory.create(new WorkflowOptions(true, null))).thenReturn(workflow);
        when(workflow.run("Answer\n\nDetails.", "pdf please")).thenReturn(finalState);

        assertThat(service.exportIfRequested("Answer\n\nDetails.", "pdf please")).containsSame(finalState);
    }
}
