package com.e2eq.l10n.classify;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.ConflictPolicy;
import com.e2eq.l10n.model.OperationMode;
import com.e2eq.l10n.model.TreePresence;

import java.util.Objects;

/**
 * Maps the presence of the source and target trees and the requested policy to what a run does
 * for one namespace.
 */
public final class OperationModeResolver {

    private OperationModeResolver() {
    }

    /**
     * @throws MergeConfigurationException when the policy forbids writing over an existing target
     */
    public static OperationMode resolve(TreePresence source, TreePresence target, ConflictPolicy policy) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(policy, "policy");
        if (source == TreePresence.ABSENT) {
            return OperationMode.SKIP;
        }
        if (target == TreePresence.ABSENT) {
            return OperationMode.FIRST_BUILD;
        }
        return switch (policy) {
            case NEW -> throw new MergeConfigurationException(
                    "Target tree already exists; policy NEW only creates new trees. Use MERGE, INCREMENTAL or REBUILD");
            case MERGE -> OperationMode.RECONCILE;
            case INCREMENTAL -> OperationMode.ADDITIVE;
            case REBUILD -> OperationMode.REBUILD;
        };
    }
}
