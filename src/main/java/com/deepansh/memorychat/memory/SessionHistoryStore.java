package com.deepansh.memorychat.memory;

import com.deepansh.memorychat.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed conversation window for a session.
 *
 * - Key pattern: memorychat:session:{sessionId}:history
 * - Stored as a single JSON array, rewritten on every append
 * - TTL reset on every write so idle sessions expire
 * - Only the last N user/assistant messages are kept
 *
 * History is a convenience for callers that do not send their own. A Redis
 * outage degrades to an empty window; it never fails a turn.
 */
@Component
@Slf4j
public class SessionHistoryStore {

    private static final String KEY_PREFIX = "memorychat:session:";
    private static final String KEY_SUFFIX = ":history";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final long ttlMinutes;
    private final int maxMessages;

    public SessionHistoryStore(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               @Value("${memorychat.memory.history.ttl-minutes:60}") long ttlMinutes,
                               @Value("${memorychat.memory.history.max-messages:20}") int maxMessages) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttlMinutes = ttlMinutes;
        this.maxMessages = maxMessages;
    }

    /**
     * Returns the stored window, oldest first. Empty when the session is
     * unknown, expired or unreadable.
     */
    public List<Message> load(String sessionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(sessionId));
        } catch (DataAccessException e) {
            log.warn("Could not load history for session={}: {}", sessionId, e.getMessage());
            return new ArrayList<>();
        }

        if (json == null) {
            log.debug("No stored history for session: {}", sessionId);
            return new ArrayList<>();
        }

        try {
            List<Message> messages = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} history messages for session: {}", messages.size(), sessionId);
            return messages;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize history for session: {}. Returning empty.", sessionId, e);
            return new ArrayList<>();
        }
    }

    /**
     * Appends one exchange to the stored window and resets its TTL.
     */
    public void append(String sessionId, String userMessage, String assistantReply) {
        List<Message> messages = load(sessionId);
        messages.add(Message.user(userMessage));
        messages.add(Message.assistant(assistantReply));
        save(sessionId, messages);
    }

    public void clear(String sessionId) {
        redisTemplate.delete(buildKey(sessionId));
        log.info("Cleared history for session: {}", sessionId);
    }

    void save(String sessionId, List<Message> messages) {
        List<Message> windowed = applyWindow(messages);
        try {
            String json = objectMapper.writeValueAsString(windowed);
            redisTemplate.opsForValue().set(buildKey(sessionId), json, Duration.ofMinutes(ttlMinutes));
            log.debug("Saved {} history messages for session: {} (TTL: {}m)", windowed.size(), sessionId, ttlMinutes);
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Failed to save history for session: {}", sessionId, e);
        }
    }

    List<Message> applyWindow(List<Message> messages) {
        List<Message> conversational = messages.stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .toList();
        if (conversational.size() <= maxMessages) {
            return conversational;
        }
        return conversational.subList(conversational.size() - maxMessages, conversational.size());
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
