package com.e2eq.l10n.plan;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.SourceEntry;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Guards against a source snapshot that scans overlapping trees: the same key offered by both
 * namespaces with different text has no defined precedence.
 */
public final class NamespaceGuard {

    private static final Logger LOG = Logger.getLogger(NamespaceGuard.class);

    private NamespaceGuard() {
    }

    /**
     * @throws MergeConfigurationException when a key appears in both sets with different text
     */
    public static void checkDisjoint(Collection<SourceEntry> typed, Collection<SourceEntry> flat) {
        Map<String, SourceEntry> typedByKey = new HashMap<>();
        for (SourceEntry entry : typed) {
            KeyValidator.KeyCheck check = KeyValidator.check(entry.key());
            if (check.isValid()) {
                typedByKey.putIfAbsent(check.key(), entry);
            }
        }
        int shared = 0;
        for (SourceEntry entry : flat) {
            KeyValidator.KeyCheck check = KeyValidator.check(entry.key());
            if (!check.isValid()) {
                continue;
            }
            SourceEntry other = typedByKey.get(check.key());
            if (other == null) {
                continue;
            }
            if (!Objects.equals(other.text(), entry.text())) {
                throw new MergeConfigurationException(String.format(
                        "Key '%s' is provided by both namespaces with different text ('%s' in %s, '%s' in %s); "
                                + "check that the source snapshot does not scan overlapping trees",
                        check.key(), other.text(), other.originFile(), entry.text(), entry.originFile()));
            }
            shared++;
        }
        if (shared > 0) {
            LOG.debugf("%d key(s) appear in both namespaces with identical text", shared);
        }
    }
}
