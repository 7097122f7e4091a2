package com.e2eq.l10n.model;

import lombok.Data;

/**
 * Counters collected while planning one namespace.
 */
@Data
public class MergeStatistics {
    private int sourceCount;
    private int targetCount;
    private int unchangedCount;
    private int updatedCount;
    private int addedCount;
    private int rejectedCount;
    private int emittedCount;

    public void count(MergeAction action) {
        switch (action) {
            case UNCHANGED -> unchangedCount++;
            case UPDATED -> updatedCount++;
            case ADDED -> addedCount++;
        }
    }

    public void reject() {
        rejectedCount++;
    }

    public void emit() {
        emittedCount++;
    }

    /**
     * @return true when the pass found nothing to add or update
     */
    public boolean isSteadyState() {
        return updatedCount == 0 && addedCount == 0;
    }
}
