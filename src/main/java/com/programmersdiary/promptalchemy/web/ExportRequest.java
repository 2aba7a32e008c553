package com.programmersdiary.promptalchemy.web;

public record ExportRequest(String path, String format) {
}
