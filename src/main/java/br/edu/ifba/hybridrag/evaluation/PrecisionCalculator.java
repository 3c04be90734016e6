package br.edu.ifba.hybridrag.evaluation;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * Precision metrics over binary relevance judgments.
 */
public final class PrecisionCalculator {

    private PrecisionCalculator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Relevant judgments among ranks 1..k, divided by k.
     */
    public static double precisionAtK(@NotNull List<RetrievalJudgment> judgments, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        long relevant = judgments.stream()
            .filter(j -> j.rank() <= k)
            .filter(RetrievalJudgment::isRelevant)
            .count();
        return (double) relevant / k;
    }

    /**
     * Relevant judgments divided by all judgments, 0 when there are none.
     */
    public static double overallPrecision(@NotNull List<RetrievalJudgment> judgments) {
        if (judgments.isEmpty()) {
            return 0.0;
        }
        long relevant = judgments.stream().filter(RetrievalJudgment::isRelevant).count();
        return (double) relevant / judgments.size();
    }

    /**
     * Averages per-query metrics over every query that has at least one judgment.
     *
     * @param runs one judgment list per query
     * @param totalJudgments number of stored judgment rows, reported as is
     */
    @NotNull
    public static RetrievalEvalSummary summarize(@NotNull Collection<List<RetrievalJudgment>> runs, long totalJudgments) {
        double overall = 0.0;
        double p5 = 0.0;
        double p10 = 0.0;
        int queries = 0;

        for (List<RetrievalJudgment> run : runs) {
            if (run.isEmpty()) {
                continue;
            }
            overall += overallPrecision(run);
            p5 += precisionAtK(run, 5);
            p10 += precisionAtK(run, 10);
            queries++;
        }

        if (queries == 0) {
            return new RetrievalEvalSummary(0.0, 0.0, 0.0, totalJudgments);
        }
        return new RetrievalEvalSummary(
            round3(overall / queries),
            round3(p5 / queries),
            round3(p10 / queries),
            totalJudgments
        );
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
