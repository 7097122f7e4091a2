package com.e2eq.l10n.model;

public enum TreePresence {
    ABSENT,
    PRESENT
}
