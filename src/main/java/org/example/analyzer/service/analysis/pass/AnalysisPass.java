package org.example.analyzer.service.analysis.pass;

import org.example.analyzer.model.PassId;
import org.example.analyzer.service.llm.EngineUnavailableException;
import org.example.analyzer.service.llm.InferenceGateway;

/**
 * One extraction task applied to one work unit.
 *
 * Implementations never throw for bad model output; they return a default output
 * flagged as degraded instead. The only exception that crosses this boundary is
 * {@link EngineUnavailableException}.
 *
 * @param <I> unit input
 * @param <O> unit output
 */
public interface AnalysisPass<I, O> {

    PassId passId();

    default String displayName() {
        return passId().displayName();
    }

    /**
     * Whether this implementation calls the inference engine. Heuristic implementations
     * ignore the gateway argument and may be given {@code null}.
     */
    default boolean usesModel() {
        return true;
    }

    PassResult<O> execute(InferenceGateway model, I input, PassConfig config);
}
