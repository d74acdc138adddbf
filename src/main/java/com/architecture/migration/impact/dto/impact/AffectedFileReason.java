package com.architecture.migration.impact.dto.impact;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a file shows up in an impact report. Declaration order is the order reports group by.
 */
@Getter
@RequiredArgsConstructor
public enum AffectedFileReason {
    DIRECTLY_MOVED("Directly moved"),
    DIRECTLY_DELETED("Directly deleted"),
    DECLARES_NAMESPACE("Declares namespace"),
    CONTAINS_USING_DIRECTIVE("Contains using directive"),
    CONTAINS_FULLY_QUALIFIED_REFERENCE("Contains fully qualified reference"),
    CONTAINS_INHERITANCE("Contains inheritance"),
    CONTAINS_TYPE_USAGE("Contains type usage"),
    PROJECT_FILE_UPDATE("Project file update");

    private final String label;
}
