package com.e2eq.l10n.route;

import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.StructuralStrategy;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Places each key in the file an authoritative reference tree keeps it in. Keys the reference
 * does not know fall back to their own origin file.
 */
public class MirrorReferenceRouter implements StructuralRouter {

    private static final Logger LOG = Logger.getLogger(MirrorReferenceRouter.class);

    private final Map<String, String> referenceIndex;
    private final GroupByTypeRouter fallback;
    private final AtomicInteger misses = new AtomicInteger();

    public MirrorReferenceRouter(Map<String, String> referenceIndex, GroupByTypeRouter fallback) {
        this.referenceIndex = Map.copyOf(referenceIndex);
        this.fallback = fallback;
    }

    @Override
    public String route(MergedEntry entry) {
        String path = referenceIndex.get(entry.key());
        if (path != null) {
            return path;
        }
        misses.incrementAndGet();
        LOG.debugf("%s is not in the reference tree, using %s", entry.key(),
                StringUtils.defaultIfBlank(entry.originFile(), "its type"));
        return StringUtils.isBlank(entry.originFile()) ? fallback.route(entry) : entry.originFile();
    }

    @Override
    public StructuralStrategy strategy() {
        return StructuralStrategy.MIRROR_REFERENCE;
    }

    public int getMissCount() {
        return misses.get();
    }
}
