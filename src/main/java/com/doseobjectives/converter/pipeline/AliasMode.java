package com.doseobjectives.converter.pipeline;

/**
 * Where the identifiers of the exported measure items come from.
 */
public enum AliasMode {
    /** Every IDAliases token; the canonical structure id when IDAliases is blank. */
    ID_ALIASES,
    /** Only the first IDAliases token; the canonical structure id when IDAliases is blank. */
    FIRST_ID_ALIAS,
    /** Every "Structure IDs" token, canonical id first. */
    STRUCTURE_IDS,
    /** "Structure IDs" tokens followed by IDAliases tokens. */
    ALL
}
