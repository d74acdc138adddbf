package com.architecture.migration.impact.dto.extract;

public enum Accessibility {
    PUBLIC,
    PROTECTED,
    PACKAGE_PRIVATE,
    PRIVATE
}
