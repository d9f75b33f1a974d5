package com.designlens.core.spatial;

/**
 * Alignment axis. {@link #ROW} buckets by y (members share a row, sorted by x);
 * {@link #COLUMN} buckets by x (members share a column, sorted by y).
 */
public enum Axis {
    ROW,
    COLUMN
}
