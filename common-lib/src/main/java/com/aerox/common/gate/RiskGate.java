package com.aerox.common.gate;

import com.aerox.common.model.DecisionMatrix;
import com.aerox.common.model.RiskCategory;
import com.aerox.common.model.RiskScores;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies a scored company into green / yellow / red.
 *
 * <h3>Rule order</h3>
 * <ol>
 *   <li>{@code intent ≥ blockIntent} → RED. Fraud risk is a hard veto; capacity is not consulted.</li>
 *   <li>{@code intent < approveIntent} AND {@code capacity ≥ approveCapacity} → GREEN</li>
 *   <li>otherwise → YELLOW</li>
 * </ol>
 *
 * <p>Total over [0,1]², pure and thread-safe.
 */
public final class RiskGate {

    private RiskGate() {}

    public static RiskCategory categorize(double intentScore, double capacityScore, DecisionMatrix matrix) {
        if (intentScore >= matrix.blockIntentThreshold()) {
            return RiskCategory.RED;
        }
        if (intentScore < matrix.approveIntentThreshold()
                && capacityScore >= matrix.approveCapacityThreshold()) {
            return RiskCategory.GREEN;
        }
        return RiskCategory.YELLOW;
    }

    public static RiskCategory categorize(RiskScores scores, DecisionMatrix matrix) {
        return categorize(scores.intentScore(), scores.capacityScore(), matrix);
    }

    /**
     * Lists every threshold the scores violate, intent first.
     * Used to explain a block; empty when neither threshold is crossed.
     */
    public static List<String> blockReasons(RiskScores scores, DecisionMatrix matrix) {
        List<String> reasons = new ArrayList<>(2);
        if (scores.intentScore() >= matrix.blockIntentThreshold()) {
            reasons.add(String.format(Locale.ROOT, "High intent score (%.2f)", scores.intentScore()));
        }
        if (scores.capacityScore() < matrix.approveCapacityThreshold()) {
            reasons.add(String.format(Locale.ROOT, "Low capacity score (%.2f)", scores.capacityScore()));
        }
        return reasons;
    }
}
