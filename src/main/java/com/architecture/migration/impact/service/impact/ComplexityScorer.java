package com.architecture.migration.impact.service.impact;

import com.architecture.migration.impact.dto.impact.ImpactReport;
import com.architecture.migration.impact.dto.impact.MigrationComplexity;
import org.springframework.stereotype.Component;

/**
 * Maps the size of an impact report to a complexity level.
 * Any error makes an operation {@link MigrationComplexity#VERY_COMPLEX}; otherwise four
 * bucketed dimensions are summed into a score.
 */
@Component
public class ComplexityScorer {

    /**
     * Score a finished report.
     */
    public MigrationComplexity score(ImpactReport report) {
        return score(report.getAffectedFileCount(),
                report.getAffectedTypeCount(),
                report.getRequiredProjectReferences().size(),
                report.getAffectedProjectCount(),
                !report.getErrors().isEmpty());
    }

    public MigrationComplexity score(int affectedFiles, int affectedTypes, int requiredProjectReferences,
                                     int affectedProjects, boolean hasErrors) {
        if (hasErrors) {
            return MigrationComplexity.VERY_COMPLEX;
        }

        int total = sizeScore(affectedFiles)
                + sizeScore(affectedTypes)
                + projectReferenceScore(requiredProjectReferences)
                + projectSpreadScore(affectedProjects);

        if (total <= 1) {
            return MigrationComplexity.SIMPLE;
        }
        if (total <= 4) {
            return MigrationComplexity.MEDIUM;
        }
        if (total <= 7) {
            return MigrationComplexity.COMPLEX;
        }
        return MigrationComplexity.VERY_COMPLEX;
    }

    /**
     * 0-3 points for file and type counts.
     */
    private int sizeScore(int count) {
        if (count <= 1) return 0;
        if (count <= 5) return 1;
        if (count <= 20) return 2;
        return 3;
    }

    /**
     * 0-2 points for new project references.
     */
    private int projectReferenceScore(int count) {
        if (count == 0) return 0;
        if (count <= 2) return 1;
        return 2;
    }

    /**
     * 0-2 points for the number of projects touched.
     */
    private int projectSpreadScore(int count) {
        if (count <= 1) return 0;
        if (count <= 3) return 1;
        return 2;
    }
}
