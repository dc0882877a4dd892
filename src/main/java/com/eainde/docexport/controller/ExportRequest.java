package com.eainde.docexport.controller;

/**
 * @param text        content to export
 * @param instruction natural-language export request, e.g. "Save as PDF with 1 inch margins"
 * @param name        optional artifact base name
 * @param clean       strip chat meta-commentary before exporting
 */
public record ExportRequest(String text, String instruction, String name, Boolean clean) {
}
