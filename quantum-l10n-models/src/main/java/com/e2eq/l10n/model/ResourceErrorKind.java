package com.e2eq.l10n.model;

public enum ResourceErrorKind {
    PARSE,
    SERIALIZATION
}
