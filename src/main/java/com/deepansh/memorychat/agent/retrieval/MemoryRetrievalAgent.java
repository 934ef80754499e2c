package com.deepansh.memorychat.agent.retrieval;

import com.deepansh.memorychat.agent.AbstractAgent;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.agent.TokenEstimator;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.exception.MemoryStoreException;
import com.deepansh.memorychat.memory.MemoryNamespace;
import com.deepansh.memorychat.memory.MemoryRecord;
import com.deepansh.memorychat.memory.MemoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fetches the top-K memories for the active profile and renders them as a
 * numbered block for the system prompt.
 *
 * Best-effort: a store failure yields an empty result plus a warning, never a
 * failed stage.
 */
@Component
@Slf4j
public class MemoryRetrievalAgent extends AbstractAgent<RetrievalResult> {

    private final MemoryStore memoryStore;
    private final int topK;

    public MemoryRetrievalAgent(MemoryStore memoryStore, OrchestratorProperties properties) {
        this.memoryStore = memoryStore;
        this.topK = properties.getRetrieval().getTopK();
    }

    @Override
    public AgentName name() {
        return AgentName.MEMORY_RETRIEVAL;
    }

    @Override
    protected AgentOutput<RetrievalResult> process(AgentInput input) {
        if (!input.getPrivacyMode().allowsRetrieval()) {
            return AgentOutput.success(RetrievalResult.empty(List.of()), 0);
        }
        if (input.getMessage() == null || input.getMessage().isBlank()) {
            return AgentOutput.success(RetrievalResult.empty(List.of("No query text; memory retrieval skipped")), 0);
        }

        String namespace = MemoryNamespace.of(input.getUserId(), input.getProfileId());
        List<MemoryRecord> records;
        try {
            records = memoryStore.search(namespace, input.getMessage(), topK);
        } catch (MemoryStoreException e) {
            log.warn("Memory retrieval failed, continuing without memories [sessionId={}, namespace={}]: {}",
                    input.getSessionId(), namespace, e.getMessage());
            return AgentOutput.success(
                    RetrievalResult.empty(List.of("Memory retrieval unavailable; replying without stored memories")), 0);
        }

        List<RetrievedMemory> memories = records.stream()
                .filter(r -> r.text() != null && !r.text().isBlank())
                .map(r -> new RetrievedMemory(r.id(), r.text()))
                .toList();
        String context = format(memories);

        log.info("Retrieved {} memories [sessionId={}, namespace={}]", memories.size(), input.getSessionId(), namespace);
        return AgentOutput.success(new RetrievalResult(memories, context, List.of()), TokenEstimator.estimate(context));
    }

    static String format(List<RetrievedMemory> memories) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < memories.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". ").append(memories.get(i).text());
        }
        return sb.toString();
    }
}
