package com.deepansh.memorychat.agent;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Timing and error boundary shared by every stage.
 *
 * Stage bodies report expected failures by returning {@link AgentOutput#failure}.
 * This class is the only place allowed to catch {@code Exception} broadly: an
 * unexpected fault is logged with the session context and turned into an
 * {@link ErrorKind#UNHANDLED_ERROR} output, so nothing escapes into the coordinator.
 */
@Slf4j
public abstract class AbstractAgent<T> implements Agent<T> {

    @Override
    public final AgentOutput<T> execute(AgentInput input) {
        return guarded(input, this::process);
    }

    protected abstract AgentOutput<T> process(AgentInput input);

    /**
     * Runs {@code body} inside the boundary. Subclasses with more than one entry
     * point (e.g. a streaming variant) route each through here.
     */
    protected final AgentOutput<T> guarded(AgentInput input, Function<AgentInput, AgentOutput<T>> body) {
        long start = System.nanoTime();
        AgentOutput<T> output;
        try {
            output = body.apply(input);
            if (output == null) {
                output = AgentOutput.failure(name() + " produced no output", ErrorKind.UNHANDLED_ERROR);
            }
        } catch (Exception e) {
            log.error("{} failed unexpectedly [sessionId={}, mode={}]",
                    name(), input.getSessionId(), input.getPrivacyMode(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            output = AgentOutput.failure(message, ErrorKind.UNHANDLED_ERROR);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        log.debug("{} finished [sessionId={}, success={}, tokens={}, latency={}ms]",
                name(), input.getSessionId(), output.isSuccess(), output.getTokensUsed(), elapsedMs);
        return output.withExecutionTimeMs(elapsedMs);
    }
}
