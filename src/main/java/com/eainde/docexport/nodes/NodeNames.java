package com.eainde.docexport.nodes;

/**
 * Node names of the export graph, also used as the stage of recorded failures.
 *
 * <pre>
 *   analyze        → exportIntent, documentKind, reasoning
 *   clean          → sourceText (optional)
 *   extract_format → preferences
 *   word_render | pdf_render → artifactPath
 *   finalize
 * </pre>
 */
public final class NodeNames {

    private NodeNames() {}

    public static final String ANALYZE = "analyze";
    public static final String CLEAN = "clean";
    public static final String EXTRACT_FORMAT = "extract_format";
    public static final String WORD_RENDER = "word_render";
    public static final String PDF_RENDER = "pdf_render";
    public static final String FINALIZE = "finalize";
}
