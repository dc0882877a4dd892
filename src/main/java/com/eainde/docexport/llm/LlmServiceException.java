package com.eainde.docexport.llm;

/** Exception thrown when an LLM call fails or returns an unusable answer. */
public class LlmServiceException extends RuntimeException {

    public LlmServiceException(String message) {
        super(message);
    }

    public LlmServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
