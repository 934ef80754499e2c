package com.deepansh.memorychat.agent.memory;

import com.deepansh.memorychat.agent.AbstractAgent;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.exception.MemoryStoreException;
import com.deepansh.memorychat.exception.ProviderException;
import com.deepansh.memorychat.memory.MemoryMetadata;
import com.deepansh.memorychat.memory.MemoryNamespace;
import com.deepansh.memorychat.memory.MemoryStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts memories from the finished exchange and appends them to the
 * profile's namespace. Never fails the turn: extraction or store problems end
 * up as warnings and {@code count} reflects only what was actually saved.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MemoryManagerAgent extends AbstractAgent<ExtractionResult> {

    private final MemoryExtractor extractor;
    private final MemoryStore memoryStore;

    @Override
    public AgentName name() {
        return AgentName.MEMORY_MANAGER;
    }

    @Override
    protected AgentOutput<ExtractionResult> process(AgentInput input) {
        if (!input.getPrivacyMode().allowsStorage()) {
            return AgentOutput.success(ExtractionResult.empty(List.of()), 0);
        }
        if (input.getAssistantReply() == null || input.getAssistantReply().isBlank()) {
            return AgentOutput.success(
                    ExtractionResult.empty(List.of("No assistant reply; memory extraction skipped")), 0);
        }

        MemoryExtractor.Extraction extraction;
        try {
            extraction = extractor.extract(input.getMessage(), input.getAssistantReply());
        } catch (ProviderException | CallNotPermittedException e) {
            log.warn("Memory extraction unavailable [sessionId={}]: {}", input.getSessionId(), e.getMessage());
            return AgentOutput.success(
                    ExtractionResult.empty(List.of("Memory extraction unavailable; nothing was saved this turn")), 0);
        }

        String namespace = MemoryNamespace.of(input.getUserId(), input.getProfileId());
        List<SavedMemory> saved = new ArrayList<>();
        int failed = 0;

        for (ExtractedMemory memory : extraction.memories()) {
            MemoryMetadata metadata = new MemoryMetadata(
                    memory.memoryType().value(), memory.importanceScore(), memory.tags(), input.getSessionId());
            try {
                String id = memoryStore.add(namespace, memory.content(), metadata);
                saved.add(new SavedMemory(id, memory));
            } catch (MemoryStoreException e) {
                failed++;
                log.warn("Failed to store memory [sessionId={}, namespace={}]: {}",
                        input.getSessionId(), namespace, e.getMessage());
            }
        }

        List<String> warnings = new ArrayList<>();
        if (failed > 0) {
            warnings.add(failed + " of " + extraction.memories().size() + " memories could not be saved");
        }

        log.info("Memory extraction complete [sessionId={}, namespace={}, candidates={}, saved={}]",
                input.getSessionId(), namespace, extraction.memories().size(), saved.size());
        return AgentOutput.success(new ExtractionResult(saved, warnings), extraction.tokensUsed());
    }
}
