package com.eainde.docexport.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw structured answer of the intent classification call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportIntentResponse(
        @JsonProperty("export_intent") Boolean exportIntent,
        @JsonProperty("format") String format,
        @JsonProperty("reasoning") String reasoning) {
}
