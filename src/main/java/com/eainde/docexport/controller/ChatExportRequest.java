package com.eainde.docexport.controller;

/**
 * @param text        the assistant message that may be exported
 * @param instruction the user's chat message
 */
public record ChatExportRequest(String text, String instruction) {
}
