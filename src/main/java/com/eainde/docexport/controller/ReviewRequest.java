package com.eainde.docexport.controller;

public record ReviewRequest(String instruction) {
}
