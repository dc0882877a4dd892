package com.eainde.docexport.controller;

import com.eainde.docexport.workflow.ExportService;
import com.eainde.docexport.workflow.WorkflowOptions;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/exports")
@RequiredArgsConstructor
public class ExportController {

    private final ExportService exportService;

    @PostMapping
    public ExportResponse export(@RequestBody ExportRequest request) {
        requireText(request.text(), "text");
        WorkflowOptions options = WorkflowOptions.defaults()
                .withCleaning(Boolean.TRUE.equals(request.clean()))
                .withCustomName(request.name());
        return ExportResponse.from(exportService.export(request.text(), nullToEmpty(request.instruction()), options));
    }

    @PostMapping("/chat")
    public ExportResponse chat(@RequestBody ChatExportRequest request) {
        requireText(request.instruction(), "instruction");
        return exportService.exportIfRequested(nullToEmpty(request.text()), request.instruction())
                .map(ExportResponse::from)
                .orElseGet(() -> ExportResponse.notRequested("No export requested"));
    }

    @PostMapping("/review")
    public ReviewResponse review(@RequestBody ReviewRequest request) {
        requireText(request.instruction(), "instruction");
        return ReviewResponse.from(exportService.review(request.instruction()));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
