package com.queryforge.model;

/**
 * Query language family of a target data store. Selects the prompt instructions and safety rules.
 */
public enum DialectFamily {
    RELATIONAL,
    DOCUMENT
}
