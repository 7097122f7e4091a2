package com.e2eq.l10n.source;

import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.TreePresence;

import java.io.IOException;

/**
 * Supplies the current source-language entries (language tree, CSV extraction, etc.).
 */
public interface SourceSnapshotProvider {

    /**
     * Returns a human friendly identifier for this provider.
     */
    String getId();

    /**
     * Whether anything was extracted for the namespace.
     */
    TreePresence presence(Namespace namespace);

    SourceSnapshot load(Namespace namespace) throws IOException;
}
