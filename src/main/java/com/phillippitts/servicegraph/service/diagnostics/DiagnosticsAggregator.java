package com.phillippitts.servicegraph.service.diagnostics;

import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges graph and field-validation findings into one {@link ResolutionReport}.
 *
 * <p>Fatal issues of both sources are kept side by side without precedence, so a single
 * fix-and-retry cycle can address all of them. The startup order is dropped whenever anything
 * fatal was found.
 */
public final class DiagnosticsAggregator {

    public ResolutionReport aggregate(GraphResult graphResult, List<ValidationIssue> validationIssues) {
        List<ValidationIssue> fatal = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        split(graphResult.issues(), fatal, warnings);
        split(validationIssues, fatal, warnings);

        List<String> order = fatal.isEmpty() ? graphResult.startupOrder() : null;
        return new ResolutionReport(fatal, warnings, order, graphResult.units());
    }

    private static void split(List<ValidationIssue> issues,
                              List<ValidationIssue> fatal,
                              List<ValidationIssue> warnings) {
        for (ValidationIssue issue : issues) {
            if (issue.isFatal()) {
                fatal.add(issue);
            } else {
                warnings.add(issue);
            }
        }
    }
}
