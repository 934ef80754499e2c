package com.deepansh.memorychat.memory;

import com.deepansh.memorychat.exception.MemoryStoreException;
import com.deepansh.memorychat.text.Keywords;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * MongoDB-backed memory store.
 *
 * Search is lexical: the query is reduced to its significant words, candidates
 * matching any of them are fetched from the namespace, and ranked by number of
 * matched words, then importance, then recency. A query with no significant
 * words returns the most recent memories.
 *
 * Each namespace is capped; the oldest entries are evicted first on add.
 */
@Component
@Slf4j
public class MongoMemoryStore implements MemoryStore {

    private static final int MAX_QUERY_TERMS = 10;
    private static final int CANDIDATE_MULTIPLIER = 10;

    private final MemoryDocumentRepository repository;
    private final MongoTemplate mongoTemplate;

    @Value("${memorychat.memory.max-per-namespace:500}")
    private int maxPerNamespace;

    public MongoMemoryStore(MemoryDocumentRepository repository, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<MemoryRecord> search(String namespace, String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> terms = Keywords.significant(query, MAX_QUERY_TERMS);

        try {
            if (terms.isEmpty()) {
                return repository.findByNamespaceOrderByCreatedAtDesc(namespace, PageRequest.of(0, limit))
                        .stream()
                        .map(MemoryDocument::toRecord)
                        .toList();
            }

            Criteria anyTerm = new Criteria().orOperator(terms.stream()
                    .map(t -> Criteria.where("content").regex(t, "i"))
                    .toArray(Criteria[]::new));
            Query mongoQuery = new Query(new Criteria().andOperator(
                    Criteria.where("namespace").is(namespace), anyTerm))
                    .limit(limit * CANDIDATE_MULTIPLIER);

            List<MemoryDocument> candidates = mongoTemplate.find(mongoQuery, MemoryDocument.class);
            List<MemoryRecord> ranked = candidates.stream()
                    .sorted(Comparator
                            .comparingLong((MemoryDocument d) -> Keywords.countMatching(d.getContent(), terms))
                            .reversed()
                            .thenComparing(MemoryDocument::getImportanceScore, Comparator.reverseOrder())
                            .thenComparing(d -> d.getCreatedAt() != null ? d.getCreatedAt() : Instant.EPOCH,
                                    Comparator.reverseOrder()))
                    .limit(limit)
                    .map(MemoryDocument::toRecord)
                    .toList();

            log.debug("Memory search [namespace={}, terms={}, candidates={}, returned={}]",
                    namespace, terms, candidates.size(), ranked.size());
            return ranked;

        } catch (DataAccessException e) {
            throw new MemoryStoreException("Memory search failed for namespace " + namespace, e);
        }
    }

    @Override
    public String add(String namespace, String text, MemoryMetadata metadata) {
        try {
            enforceCapIfNeeded(namespace);

            MemoryDocument saved = repository.save(MemoryDocument.builder()
                    .namespace(namespace)
                    .content(text)
                    .memoryType(metadata.memoryType())
                    .importanceScore(metadata.importanceScore())
                    .tags(metadata.tags())
                    .sourceSessionId(metadata.sessionId())
                    .build());

            log.info("Stored memory [id={}, namespace={}, type={}, importance={}]",
                    saved.getId(), namespace, metadata.memoryType(), metadata.importanceScore());
            return saved.getId();

        } catch (DataAccessException e) {
            throw new MemoryStoreException("Memory write failed for namespace " + namespace, e);
        }
    }

    private void enforceCapIfNeeded(String namespace) {
        long count = repository.countByNamespace(namespace);
        if (count >= maxPerNamespace) {
            int toDelete = (int) (count - maxPerNamespace + 1);
            List<MemoryDocument> oldest = repository.findByNamespaceOrderByCreatedAtAsc(
                    namespace, PageRequest.of(0, toDelete));
            repository.deleteAll(oldest);
            log.warn("Memory cap hit for namespace {}. Evicted {} oldest entries.", namespace, oldest.size());
        }
    }
}
