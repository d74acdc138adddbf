package com.architecture.migration.impact.dto.extract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An external package a project depends on, e.g. {@code org.slf4j:slf4j-api}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageDescriptor {
    private String packageId;
    private String version;     // null when managed elsewhere
}
