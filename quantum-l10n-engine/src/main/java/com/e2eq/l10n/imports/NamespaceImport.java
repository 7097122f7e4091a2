package com.e2eq.l10n.imports;

import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.Namespace;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * What an import did for one namespace.
 */
@Data
@Builder
public class NamespaceImport {
    private Namespace namespace;
    private String csvFile;
    private int applied;
    @Builder.Default
    private List<KeyDiagnostic> rejected = List.of();
    private int filesWritten;
    private int filesUntouched;
}
