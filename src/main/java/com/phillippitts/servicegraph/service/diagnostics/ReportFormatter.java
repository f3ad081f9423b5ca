package com.phillippitts.servicegraph.service.diagnostics;

import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ValidationIssue;

import java.util.List;

/**
 * Renders a {@link ResolutionReport} as multi-line text for logs and startup failures.
 *
 * <p>Format:
 * <pre>
 * Service configuration validation failed:
 * Fatal issues:
 *   [PORT_COLLISION] gitea: Port 3000 is already used by service 'grafana', ...
 * Warnings:
 *   [SSL_DISABLED_IN_PROD] gitea: Service 'gitea' has SSL disabled ...
 * </pre>
 */
public final class ReportFormatter {

    private static final String INDENT = "  ";

    private ReportFormatter() {}

    public static String format(ResolutionReport report) {
        StringBuilder sb = new StringBuilder();
        if (report.isValid()) {
            sb.append("Service configuration valid. Startup order: ")
                    .append(report.startupOrder().isEmpty() ? "(none)" : String.join(" → ", report.startupOrder()));
        } else {
            sb.append("Service configuration validation failed:");
            appendSection(sb, "Fatal issues:", report.fatal());
        }
        appendSection(sb, "Warnings:", report.warnings());
        return sb.toString();
    }

    public static String summary(ResolutionReport report) {
        return "fatal=" + report.fatal().size() + ", warnings=" + report.warnings().size()
                + ", order=" + (report.startupOrder() == null ? "none" : report.startupOrder());
    }

    private static void appendSection(StringBuilder sb, String title, List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        sb.append('\n').append(title);
        for (ValidationIssue issue : issues) {
            sb.append('\n').append(INDENT)
                    .append('[').append(issue.code()).append("] ")
                    .append(issue.service()).append(": ")
                    .append(issue.message());
        }
    }
}
