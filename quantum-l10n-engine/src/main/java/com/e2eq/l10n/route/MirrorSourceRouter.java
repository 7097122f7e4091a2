package com.e2eq.l10n.route;

import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.StructuralStrategy;
import org.apache.commons.lang3.StringUtils;

/**
 * Mirrors the file layout of the source tree. Entries without provenance are grouped by type.
 */
public class MirrorSourceRouter implements StructuralRouter {

    private final GroupByTypeRouter fallback;

    public MirrorSourceRouter(GroupByTypeRouter fallback) {
        this.fallback = fallback;
    }

    @Override
    public String route(MergedEntry entry) {
        return StringUtils.isBlank(entry.originFile()) ? fallback.route(entry) : entry.originFile();
    }

    @Override
    public StructuralStrategy strategy() {
        return StructuralStrategy.MIRROR_SOURCE;
    }
}
