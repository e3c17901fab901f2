package com.migrationanalyzer.core.report;

import java.util.List;
import java.util.Map;

import com.migrationanalyzer.core.model.AnalysisReport;
import com.migrationanalyzer.core.model.AnalysisSummary;
import com.migrationanalyzer.core.model.CriticalIssue;
import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.JavaVersionAssessment;
import com.migrationanalyzer.core.model.RefactorOpportunity;
import com.migrationanalyzer.core.model.Severity;

/**
 * Plain-text summary of a report for terminals.
 *
 * <p>Lists the counts, the critical dependency issues, HIGH and CRITICAL findings (at most
 * {@value #MAX_LISTED} of each list) and the notes. The full detail is only in the JSON report.
 */
public class TextReportWriter implements ReportWriter {

    static final int MAX_LISTED = 20;

    private static final String SEPARATOR = "-".repeat(72);

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String render(AnalysisReport report) {
        AnalysisSummary summary = report.summary();
        StringBuilder sb = new StringBuilder();

        sb.append("Migration Readiness Report\n");
        sb.append(SEPARATOR).append('\n');
        sb.append("Health score:            ").append(summary.overallHealthScore()).append("/100\n");
        sb.append("Dependencies:            ").append(summary.totalDependencies())
            .append(" (outdated: ").append(summary.outdatedDependencies())
            .append(", vulnerable: ").append(summary.vulnerableDependencies()).append(")\n");
        sb.append("Source findings:         ").append(summary.businessLogicIssues())
            .append(" (high priority: ").append(summary.highPriorityBusinessLogic()).append(")\n");
        sb.append("Java files:              ").append(summary.javaFiles()).append('\n');
        sb.append("Test files:              ").append(summary.testFiles())
            .append(" (estimated coverage: ").append(summary.testCoveragePercentage()).append("%)\n");
        sb.append("Test frameworks:         ")
            .append(summary.testFrameworks().isEmpty() ? "none" : String.join(", ", summary.testFrameworks()))
            .append('\n');
        sb.append("Refactoring candidates:  ").append(summary.refactoringOpportunities()).append('\n');

        JavaVersionAssessment java = report.javaVersion();
        if (java != null) {
            sb.append("Java version:            ")
                .append(java.declaredVersion() == null ? "unknown" : java.declaredVersion())
                .append(" -> ").append(java.recommendedTarget())
                .append(" [").append(java.severity()).append("] ").append(java.reason()).append('\n');
        }

        if (!summary.findingsByCategory().isEmpty()) {
            sb.append('\n').append("Findings by category\n");
            for (Map.Entry<String, Integer> entry : summary.findingsByCategory().entrySet()) {
                sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }

        List<CriticalIssue> issues = report.dependencies().criticalIssues();
        if (!issues.isEmpty()) {
            sb.append('\n').append("Critical dependency issues\n");
            issues.stream().limit(MAX_LISTED).forEach(issue -> sb.append("  [").append(issue.severity()).append("] ")
                .append(issue.artifact()).append(':').append(issue.version() == null ? "?" : issue.version())
                .append(" - ").append(issue.issue()).append('\n'));
            appendMore(sb, issues.size());
        }

        List<Finding> highFindings = report.businessLogicIssues().stream()
            .filter(f -> f.severity().isAtLeast(Severity.HIGH))
            .toList();
        if (!highFindings.isEmpty()) {
            sb.append('\n').append("High priority findings\n");
            highFindings.stream().limit(MAX_LISTED).forEach(f -> sb.append("  ").append(f.filePath())
                .append(':').append(f.lineNumber()).append(" [").append(f.ruleId()).append("] ")
                .append(f.suggestion()).append('\n'));
            appendMore(sb, highFindings.size());
        }

        List<RefactorOpportunity> refactorings = report.codeRefactoring().issues();
        if (!refactorings.isEmpty()) {
            sb.append('\n').append("Refactoring opportunities\n");
            refactorings.stream().limit(MAX_LISTED).forEach(r -> sb.append("  ").append(r.type().id())
                .append(' ').append(r.filePath()).append(r.lineNumber() == null ? "" : ":" + r.lineNumber())
                .append(" - ").append(r.details()).append('\n'));
            appendMore(sb, refactorings.size());
        }

        if (!summary.notes().isEmpty()) {
            sb.append('\n').append("Notes\n");
            summary.notes().forEach(note -> sb.append("  * ").append(note).append('\n'));
        }
        return sb.toString();
    }

    private static void appendMore(StringBuilder sb, int total) {
        if (total > MAX_LISTED) {
            sb.append("  ... and ").append(total - MAX_LISTED).append(" more\n");
        }
    }
}
