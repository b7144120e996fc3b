package com.mailsync.service;

import java.util.List;

/**
 * Outcome of one ingestion batch
 *
 * @param persisted ids now present in the store, including ones that already were
 * @param failed    ids that could not be fetched or written; the cursor must not skip them
 * @param skipped   ids the provider no longer has
 */
public record IngestResult(List<String> persisted, List<String> failed, List<String> skipped) {

    public IngestResult {
        persisted = List.copyOf(persisted);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
