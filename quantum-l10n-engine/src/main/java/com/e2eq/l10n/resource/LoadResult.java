package com.e2eq.l10n.resource;

import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.model.TargetEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entries loaded from a namespace tree plus the files that could not be read.
 */
public record LoadResult(List<TargetEntry> entries, List<ResourceError> errors) {

    public LoadResult {
        entries = List.copyOf(entries);
        errors = List.copyOf(errors);
    }

    public static LoadResult empty() {
        return new LoadResult(List.of(), List.of());
    }

    /**
     * @return file each key lives in, keyed by the raw key as found in the file
     */
    public Map<String, String> keyIndex() {
        Map<String, String> index = new LinkedHashMap<>();
        for (TargetEntry entry : entries) {
            index.putIfAbsent(entry.key(), entry.originFile());
        }
        return index;
    }
}
