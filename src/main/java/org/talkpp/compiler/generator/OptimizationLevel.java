package org.talkpp.compiler.generator;

/**
 * Requested optimization profile. Accepted and carried through configuration; rendering does
 * not depend on it.
 */
public enum OptimizationLevel {
    DEBUG,
    RELEASE,
    SIZE
}
