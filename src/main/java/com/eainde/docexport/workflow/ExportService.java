package com.eainde.docexport.workflow;

import com.eainde.docexport.analysis.IntentAnalysis;
import com.eainde.docexport.analysis.IntentClassifier;
import com.eainde.docexport.engine.RenderException;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.StageResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for running exports.
 * <p>
 * Each call builds its own graph through {@link ExportWorkflowFactory}, so concurrent callers
 * never share workflow state.
 * </p>
 *
 * <h3>Variants:</h3>
 * <ul>
 * <li><strong>export:</strong> text that is already clean, exported as the instruction asks.</li>
 * <li><strong>review:</strong> classification only, for deciding whether a chat message asks for an export.</li>
 * <li><strong>exportIfRequested:</strong> review first, then export with the cleaner enabled.</li>
 * </ul>
 */
@Log4j2
@Service
public class ExportService {

    private final ExportWorkflowFactory workflowFactory;
    private final IntentClassifier classifier;

    public ExportService(ExportWorkflowFactory workflowFactory, IntentClassifier classifier) {
        this.workflowFactory = workflowFactory;
        this.classifier = classifier;
    }

    /**
     * @throws RenderException if the document could not be created
     */
    public ExportState export(String sourceText, String instruction) {
        return export(sourceText, instruction, WorkflowOptions.defaults());
    }

    /**
     * @throws RenderException if the document could not be created
     */
    public ExportState export(String sourceText, String instruction, WorkflowOptions options) {
        return workflowFactory.create(options).run(sourceText, instruction);
    }

    /**
     * Classifies an instruction without any source text. Never fails: an unavailable classifier
     * reads as "no export wanted".
     */
    public IntentAnalysis review(String instruction) {
        StageResult<IntentAnalysis> result = classifier.classify(instruction);
        result.failure().ifPresent(failure -> log.warn("Review degraded: {}", failure.message()));
        return result.value();
    }

    /**
     * Chat variant: exports {@code sourceText} with the cleaner enabled only if the instruction
     * asks for an export.
     *
     * @return the final state, or empty when no export was requested
     * @throws RenderException if the document could not be created
     */
    public Optional<ExportState> exportIfRequested(String sourceText, String instruction) {
        IntentAnalysis analysis = review(instruction);
        if (!analysis.exportIntent()) {
            log.info("No export intent detected: {}", analysis.reasoning());
            return Optional.empty();
        }
        return Optional.of(export(sourceText, instruction, WorkflowOptions.defaults().withCleaning(true)));
    }
}
