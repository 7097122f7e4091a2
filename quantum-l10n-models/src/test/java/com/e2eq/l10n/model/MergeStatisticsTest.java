package com.e2eq.l10n.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MergeStatisticsTest {

    @Test
    void countsEachAction() {
        MergeStatistics stats = new MergeStatistics();
        stats.count(MergeAction.UNCHANGED);
        stats.count(MergeAction.UNCHANGED);
        stats.count(MergeAction.UPDATED);
        stats.count(MergeAction.ADDED);
        stats.reject();
        stats.emit();

        assertEquals(2, stats.getUnchangedCount());
        assertEquals(1, stats.getUpdatedCount());
        assertEquals(1, stats.getAddedCount());
        assertEquals(1, stats.getRejectedCount());
        assertEquals(1, stats.getEmittedCount());
        assertFalse(stats.isSteadyState());
    }

    @Test
    void onlyUnchangedIsSteadyState() {
        MergeStatistics stats = new MergeStatistics();
        stats.count(MergeAction.UNCHANGED);
        stats.reject();
        assertTrue(stats.isSteadyState(), "rejected and unchanged entries do not count as changes");
    }
}
