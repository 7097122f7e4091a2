package com.e2eq.l10n.route;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.StructuralStrategy;
import com.e2eq.l10n.resource.ResourceLayout;

import java.util.Map;

/**
 * Chooses the file, relative to the namespace root, that a new entry is written to.
 */
public interface StructuralRouter {

    String route(MergedEntry entry);

    StructuralStrategy strategy();

    /**
     * Creates the router for a strategy.
     *
     * @param referenceIndex key to file index of the reference tree; required for {@link StructuralStrategy#MIRROR_REFERENCE}
     * @throws MergeConfigurationException when the strategy's prerequisites are missing
     */
    static StructuralRouter create(StructuralStrategy strategy, Map<String, String> referenceIndex, ResourceLayout layout) {
        GroupByTypeRouter byType = new GroupByTypeRouter(layout);
        return switch (strategy) {
            case GROUP_BY_TYPE -> byType;
            case MIRROR_SOURCE -> new MirrorSourceRouter(byType);
            case MIRROR_REFERENCE -> {
                if (referenceIndex == null) {
                    throw new MergeConfigurationException(
                            "Structural strategy MIRROR_REFERENCE requires a reference root (quantum.l10n.reference-root)");
                }
                yield new MirrorReferenceRouter(referenceIndex, byType);
            }
        };
    }
}
