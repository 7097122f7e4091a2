package com.e2eq.l10n.imports;

import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.resource.ResourceLayout;

import java.nio.file.Path;
import java.util.Map;

/**
 * @param targetRoot language root the translations are written into
 * @param csvFiles   translated CSV per namespace; namespaces without a file are left alone
 */
public record ImportRequest(Path targetRoot, ResourceLayout layout, Map<Namespace, Path> csvFiles, int parallelism) {

    public ImportRequest {
        csvFiles = Map.copyOf(csvFiles);
    }
}
