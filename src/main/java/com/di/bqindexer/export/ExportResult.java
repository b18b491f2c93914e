package com.di.bqindexer.export;

/**
 * Where the export was written and how many samples it holds.
 */
public record ExportResult(String location, long samples) {
}
