package com.phillippitts.coordsim.service.session;

import com.phillippitts.coordsim.domain.SessionStatus;
import com.phillippitts.coordsim.domain.WorkflowStage;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of a session, taken under the session lock.
 *
 * @param sessionId          session id
 * @param status             lifecycle status
 * @param currentStage       stage most recently entered
 * @param workflowPlan       planned stages in order
 * @param complexityScore    score computed at creation
 * @param durationSeconds    age of the session
 * @param progress           fraction of planned stages finished, in [0,1]
 * @param performanceMetrics elapsed milliseconds keyed by stage wire name
 * @param confidenceScores   confidences keyed by stage wire name, plus "overall"
 * @param errorCount         number of recorded errors
 * @param warningCount       number of recorded warnings
 * @param resultsCount       number of compiled results
 */
public record SessionStatusView(
        String sessionId,
        SessionStatus status,
        WorkflowStage currentStage,
        List<WorkflowStage> workflowPlan,
        double complexityScore,
        double durationSeconds,
        double progress,
        Map<String, Long> performanceMetrics,
        Map<String, Double> confidenceScores,
        int errorCount,
        int warningCount,
        int resultsCount
) {}
