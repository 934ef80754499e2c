package com.deepansh.memorychat.memory;

import com.deepansh.memorychat.exception.MemoryStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Session lifecycle backed by MongoDB.
 *
 * One findAndModify per turn: $setOnInsert binds userId, profileId and
 * createdAt on the first turn only, $inc counts turns (0 to 1 on insert).
 * The two operators never touch the same field, which MongoDB rejects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionService {

    private final SessionMetadataRepository sessionRepo;
    private final MongoTemplate mongoTemplate;

    /**
     * Records a new turn and returns the session as it is after the update.
     * The returned profileId is the one the session was opened with.
     */
    public SessionMetadata recordTurn(String sessionId, String userId, String profileId) {
        Instant now = Instant.now();
        Query query = new Query(Criteria.where("_id").is(sessionId));

        Update update = new Update()
                .setOnInsert("userId", userId)
                .setOnInsert("profileId", profileId)
                .setOnInsert("createdAt", now)
                .set("updatedAt", now)
                .inc("turnCount", 1);

        FindAndModifyOptions options = FindAndModifyOptions.options()
                .upsert(true)
                .returnNew(true);

        SessionMetadata result;
        try {
            result = mongoTemplate.findAndModify(query, update, options, SessionMetadata.class);
        } catch (DataAccessException e) {
            throw new MemoryStoreException("Failed to record turn for session " + sessionId, e);
        }

        if (result == null) {
            log.warn("findAndModify returned null for session={}, building fallback", sessionId);
            return SessionMetadata.builder()
                    .sessionId(sessionId)
                    .userId(userId)
                    .profileId(profileId)
                    .turnCount(1)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        }

        log.debug("Turn recorded [sessionId={}, userId={}, profileId={}, turnCount={}]",
                sessionId, userId, result.getProfileId(), result.getTurnCount());
        return result;
    }

    public List<SessionMetadata> getSessionsForUser(String userId) {
        return sessionRepo.findByUserIdOrderByUpdatedAtDesc(userId);
    }
}
