package com.eainde.docexport.state;

/**
 * Classes of failure an export run can hit. Only {@link #RENDER} aborts a run.
 */
public enum FailureKind {

    /** Classifier call failed; the run continues with no export intent and the Word kind. */
    CLASSIFICATION,

    /** Cleaner call failed or returned nothing; the original text is kept. */
    CLEANING,

    /** Formatting extraction failed; the run continues with empty preferences. */
    EXTRACTION,

    /** A single recognized property could not be applied; the render continues without it. */
    PROPERTY_APPLICATION,

    /** The document could not be built or written. */
    RENDER,

    /** Opening the finished artifact failed. */
    NOTIFICATION
}
