package com.e2eq.l10n.corpus;

import com.e2eq.l10n.model.ResourceError;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a corpus export. Format problems found in the TSV file are warnings; only files that
 * could not be read make the export unsuccessful.
 */
@Data
@NoArgsConstructor
public class CorpusReport {
    private int pairs;
    private int skippedIncomplete;
    private int skippedIdentical;
    private int duplicates;
    private List<String> files = new ArrayList<>();
    private List<String> problems = new ArrayList<>();
    private List<ResourceError> errors = new ArrayList<>();

    public int getFailureCount() {
        return errors.size();
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }
}
