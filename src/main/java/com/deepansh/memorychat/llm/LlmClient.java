package com.deepansh.memorychat.llm;

import com.deepansh.memorychat.model.LlmResponse;
import com.deepansh.memorychat.model.LlmStreamChunk;
import com.deepansh.memorychat.model.Message;

import java.util.List;
import java.util.function.Consumer;

/**
 * Chat-completion provider.
 *
 * Both operations throw {@link com.deepansh.memorychat.exception.ProviderTransientException}
 * for failures worth retrying and {@link com.deepansh.memorychat.exception.ProviderFatalException}
 * for everything else.
 */
public interface LlmClient {

    LlmResponse complete(List<Message> messages, double temperature, int maxTokens);

    /**
     * Blocks until the completion is finished, pushing each text delta to {@code sink}
     * as it arrives. The last chunk delivered always has {@code done=true}.
     */
    void stream(List<Message> messages, double temperature, int maxTokens, Consumer<LlmStreamChunk> sink);
}
