package com.e2eq.l10n.resource;

import com.e2eq.l10n.model.ResourceError;

import java.util.List;

/**
 * Outcome of writing a set of files.
 *
 * @param filesWritten   files whose content was replaced or created
 * @param filesUntouched files that needed no change and were left byte-for-byte identical
 * @param errors         files that could not be written
 */
public record WriteResult(int filesWritten, int filesUntouched, List<ResourceError> errors) {

    public WriteResult {
        errors = List.copyOf(errors);
    }

    public static WriteResult empty() {
        return new WriteResult(0, 0, List.of());
    }
}
