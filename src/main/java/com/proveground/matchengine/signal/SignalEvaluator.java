package com.proveground.matchengine.signal;

/**
 * Scores one (student, listing) pair on one dimension.
 * Implementations are stateless and side-effect free; missing inputs yield
 * {@link SignalOutcome#neutral(SignalType, String)} instead of an exception.
 */
public interface SignalEvaluator {

    SignalType getType();

    SignalOutcome evaluate(EvaluationContext context);
}
