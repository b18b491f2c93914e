package com.di.bqindexer.document;

/**
 * A single write against one participant document.
 *
 * <p>Two variants exist: {@link PartialDocumentUpdate} merges top-level fields
 * into the document, {@link SampleMergeUpdate} finds-or-appends one element of
 * the document's {@code samples} array and merges fields into it. Both create
 * the document when it does not exist yet.
 */
public interface IndexOperation {

    /** Id of the participant document this operation targets. */
    String entityId();
}
