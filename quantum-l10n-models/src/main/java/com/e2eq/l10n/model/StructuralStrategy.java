package com.e2eq.l10n.model;

/**
 * Layout rule used to pick an output file for entries that have no existing placement.
 */
public enum StructuralStrategy {
    /** Mirror the file each key lives in inside an authoritative source-language reference tree. */
    MIRROR_REFERENCE,

    /** One output file per type discriminant carried in the entry tag. */
    GROUP_BY_TYPE,

    /** Mirror the provenance path of the raw source data. */
    MIRROR_SOURCE
}
