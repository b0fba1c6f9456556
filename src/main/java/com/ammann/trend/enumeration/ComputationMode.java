/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * How the Sen's slope pool of a finished analysis was built.
 */
public enum ComputationMode {
    /** Every pair was evaluated. */
    FULL,
    /** A seeded random subset of pairs fed the slope pool. */
    FAST
}
