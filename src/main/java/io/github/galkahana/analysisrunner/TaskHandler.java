package io.github.galkahana.analysisrunner;

/**
 * Work performed for every {@link Task} of one {@code type}, registered under that type in a
 * {@link HandlerRegistry}. Receives the task's {@code data} and returns the result payload.
 * <p>
 * A thrown exception fails only this task (after the task's retries are used up); an {@link Error}
 * takes down the worker running it.
 *
 * @param <I> Task payload type
 * @param <O> Result payload type
 */
@FunctionalInterface
public interface TaskHandler<I, O> {
    O apply(I input) throws Exception;
}
