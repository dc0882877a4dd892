package com.eainde.docexport.controller;

public record ErrorResponse(String error, String message) {
}
