package io.github.drompincen.clawtrigger.runtime.trigger;

public record EvaluationSummary(boolean skipped, int due, int dispatched, int recovered, int cleaned) {

    public static final EvaluationSummary SKIPPED = new EvaluationSummary(true, 0, 0, 0, 0);
}
