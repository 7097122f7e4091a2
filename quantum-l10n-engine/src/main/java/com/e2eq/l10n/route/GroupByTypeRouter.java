package com.e2eq.l10n.route;

import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.StructuralStrategy;
import com.e2eq.l10n.resource.ResourceLayout;
import org.apache.commons.lang3.StringUtils;

/**
 * One file per type discriminant: {@code <D>/<D>.xml}.
 */
public class GroupByTypeRouter implements StructuralRouter {

    static final String FALLBACK_TYPE = "Misc";

    private final ResourceLayout layout;

    public GroupByTypeRouter(ResourceLayout layout) {
        this.layout = layout;
    }

    @Override
    public String route(MergedEntry entry) {
        String type = discriminant(entry.tag());
        return type + "/" + layout.fileName(type);
    }

    @Override
    public StructuralStrategy strategy() {
        return StructuralStrategy.GROUP_BY_TYPE;
    }

    /**
     * @return the part of the tag before the first dot, reduced to file-name safe characters
     */
    static String discriminant(String tag) {
        String type = StringUtils.substringBefore(StringUtils.trimToEmpty(tag), ".");
        type = type.replaceAll("[^A-Za-z0-9_]", "_");
        return StringUtils.strip(type, "_").isEmpty() ? FALLBACK_TYPE : type;
    }
}
