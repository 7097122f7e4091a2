package com.e2eq.l10n.corpus;

import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.resource.ResourceLayout;

import java.nio.file.Path;
import java.util.List;

/**
 * @param targetRoot language root the pairs are read from
 * @param outputDir  directory receiving one file per format
 */
public record CorpusRequest(Path targetRoot,
                            ResourceLayout layout,
                            List<Namespace> namespaces,
                            Path outputDir,
                            List<CorpusFormat> formats,
                            int parallelism) {

    public CorpusRequest {
        namespaces = List.copyOf(namespaces);
        formats = List.copyOf(formats);
    }
}
