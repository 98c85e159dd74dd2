package org.example.analyzer.service.analysis.pass;

/**
 * Output of one pass over one work unit.
 *
 * @param degraded true when the output is a default produced after the model failed to deliver
 * @param attempts number of inference calls made, 0 for heuristic or short-circuited units
 */
public record PassResult<O>(
    O output,
    boolean degraded,
    int attempts
) {
    public static <O> PassResult<O> of(O output, int attempts) {
        return new PassResult<>(output, false, attempts);
    }

    public static <O> PassResult<O> degraded(O output, int attempts) {
        return new PassResult<>(output, true, attempts);
    }
}
