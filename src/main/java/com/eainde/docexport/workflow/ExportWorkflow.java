package com.eainde.docexport.workflow;

import com.eainde.docexport.engine.RenderException;
import com.eainde.docexport.state.ExportState;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.ThreadContext;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;

import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * One compiled export graph. Obtain a new one from {@link ExportWorkflowFactory} for each run.
 */
@Log4j2
public class ExportWorkflow {

    static final String RUN_ID = "runId";

    private final CompiledGraph<ExportState> graph;

    ExportWorkflow(CompiledGraph<ExportState> graph) {
        this.graph = graph;
    }

    /**
     * Runs the pipeline to completion on the calling thread.
     *
     * @return the final state; {@link ExportState#getFailures()} lists every absorbed failure
     * @throws RenderException if the document could not be created
     */
    public ExportState run(String sourceText, String instruction) {
        String runId = UUID.randomUUID().toString();
        String previousRunId = ThreadContext.get(RUN_ID);
        ThreadContext.put(RUN_ID, runId);
        try {
            log.info("Starting export run");
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();
            ExportState result = graph.invoke(ExportState.initial(sourceText, instruction), config)
                    .orElseThrow(() -> new IllegalStateException("Export graph finished without a state"));
            log.info("Export run finished: intent={}, format={}, failures={}",
                    result.isExportIntent(), result.getDocumentKind().label(), result.getFailures().size());
            return result;
        } catch (Exception e) {
            RuntimeException cause = unwrap(e);
            if (cause instanceof RenderException) {
                log.error("Export run failed: {}", cause.getMessage());
            }
            throw cause;
        } finally {
            if (previousRunId != null) {
                ThreadContext.put(RUN_ID, previousRunId);
            } else {
                ThreadContext.remove(RUN_ID);
            }
        }
    }

    /**
     * Strips the wrappers the graph executor puts around node failures.
     */
    static RuntimeException unwrap(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof RenderException renderException) {
                return renderException;
            }
        }
        Throwable t = error;
        while (t.getCause() != null
                && (t instanceof CompletionException
                || t instanceof ExecutionException
                || t.getClass() == RuntimeException.class)) {
            t = t.getCause();
        }
        return t instanceof RuntimeException runtime ? runtime : new IllegalStateException(t.getMessage(), t);
    }
}
