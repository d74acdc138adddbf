package com.architecture.migration.impact.dto.impact;

/**
 * Four-level effort classification of an operation, ordered from least to most complex.
 */
public enum MigrationComplexity {
    SIMPLE,
    MEDIUM,
    COMPLEX,
    VERY_COMPLEX
}
