package com.deepansh.memorychat.agent;

/**
 * A single pipeline stage. Implementations must not let exceptions escape
 * {@link #execute(AgentInput)}; see {@link AbstractAgent}.
 */
public interface Agent<T> {

    AgentName name();

    AgentOutput<T> execute(AgentInput input);
}
