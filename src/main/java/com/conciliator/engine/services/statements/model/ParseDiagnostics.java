package com.conciliator.engine.services.statements.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.conciliator.engine.enums.ReconciliationStatus;
import com.conciliator.engine.enums.StatementIssue;
import com.conciliator.engine.services.statements.quality.DocumentProfile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What happened during one parse, kept for manual review.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseDiagnostics {

    /** Score per evaluated strategy, in evaluation order. */
    @Builder.Default
    private Map<String, Double> strategyScores = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> strategyErrors = new LinkedHashMap<>();

    private String selectedStrategy;
    private double selectedScore;
    private boolean earlyExit;
    private String bankId;
    private String rulesSource;
    private ReconciliationStatus reconciliationStatus;

    @Builder.Default
    private List<StatementIssue> issues = new ArrayList<>();

    private DocumentProfile documentProfile;

    @Builder.Default
    private Map<String, Integer> rejections = new LinkedHashMap<>();

    private int mergedDuplicates;

    public void addIssue(StatementIssue issue) {
        if (issue != null && !issues.contains(issue)) {
            issues.add(issue);
        }
    }

    public boolean hasIssue(StatementIssue issue) {
        return issues.contains(issue);
    }

    public String getDescription() {
        return String.format(
                "ParseDiagnostics{selected=%s, score=%.3f, earlyExit=%s, evaluated=%s, issues=%s}",
                selectedStrategy,
                selectedScore,
                earlyExit,
                strategyScores.keySet(),
                issues);
    }
}
