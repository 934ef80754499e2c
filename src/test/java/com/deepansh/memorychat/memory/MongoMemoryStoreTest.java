package com.deepansh.memorychat.memory;

import com.deepansh.memorychat.exception.MemoryStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoMemoryStoreTest {

    private static final String NS = "alice:personal";

    @Mock MemoryDocumentRepository repository;
    @Mock MongoTemplate mongoTemplate;

    @InjectMocks MongoMemoryStore store;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(store, "maxPerNamespace", 3);
    }

    @Test
    void search_ranksByMatchedTermsThenImportanceThenRecency() {
        MemoryDocument oneTermImportant = doc("1", "User enjoys hiking", 0.9, Instant.parse("2024-01-01T00:00:00Z"));
        MemoryDocument twoTerms = doc("2", "User enjoys hiking in the mountains", 0.3, Instant.parse("2024-01-01T00:00:00Z"));
        MemoryDocument oneTermNewer = doc("3", "Went hiking last week", 0.9, Instant.parse("2024-06-01T00:00:00Z"));
        when(mongoTemplate.find(any(Query.class), eq(MemoryDocument.class)))
                .thenReturn(List.of(oneTermImportant, twoTerms, oneTermNewer));

        List<MemoryRecord> results = store.search(NS, "hiking in the mountains?", 3);

        assertThat(results).extracting(MemoryRecord::id).containsExactly("2", "3", "1");
    }

    @Test
    void search_respectsLimit() {
        when(mongoTemplate.find(any(Query.class), eq(MemoryDocument.class))).thenReturn(List.of(
                doc("1", "likes coffee", 0.5, Instant.now()),
                doc("2", "coffee every morning", 0.5, Instant.now())));

        assertThat(store.search(NS, "coffee", 1)).hasSize(1);
    }

    @Test
    void search_queryWithoutSignificantWords_returnsMostRecent() {
        when(repository.findByNamespaceOrderByCreatedAtDesc(eq(NS), any(Pageable.class)))
                .thenReturn(List.of(doc("9", "latest memory", 0.5, Instant.now())));

        List<MemoryRecord> results = store.search(NS, "hi", 5);

        assertThat(results).extracting(MemoryRecord::text).containsExactly("latest memory");
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void search_zeroLimit_returnsEmptyWithoutQuerying() {
        assertThat(store.search(NS, "coffee", 0)).isEmpty();
        verifyNoInteractions(mongoTemplate, repository);
    }

    @Test
    void search_storeUnavailable_throwsMemoryStoreException() {
        when(mongoTemplate.find(any(Query.class), eq(MemoryDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> store.search(NS, "coffee", 5))
                .isInstanceOf(MemoryStoreException.class)
                .hasMessageContaining(NS);
    }

    @Test
    void add_savesDocumentWithMetadata() {
        when(repository.countByNamespace(NS)).thenReturn(0L);
        when(repository.save(any(MemoryDocument.class))).thenAnswer(inv -> {
            MemoryDocument d = inv.getArgument(0);
            d.setId("new-id");
            return d;
        });

        String id = store.add(NS, "User likes tea",
                new MemoryMetadata("preference", 0.7, List.of("tea"), "s1"));

        assertThat(id).isEqualTo("new-id");
        ArgumentCaptor<MemoryDocument> captor = ArgumentCaptor.forClass(MemoryDocument.class);
        verify(repository).save(captor.capture());
        MemoryDocument saved = captor.getValue();
        assertThat(saved.getNamespace()).isEqualTo(NS);
        assertThat(saved.getMemoryType()).isEqualTo("preference");
        assertThat(saved.getImportanceScore()).isEqualTo(0.7);
        assertThat(saved.getTags()).containsExactly("tea");
        assertThat(saved.getSourceSessionId()).isEqualTo("s1");
        verify(repository, never()).deleteAll(any());
    }

    @Test
    void add_atCap_evictsOldestFirst() {
        List<MemoryDocument> oldest = List.of(doc("old", "old memory", 0.1, Instant.EPOCH));
        when(repository.countByNamespace(NS)).thenReturn(3L);
        when(repository.findByNamespaceOrderByCreatedAtAsc(eq(NS), any(Pageable.class))).thenReturn(oldest);
        when(repository.save(any(MemoryDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        store.add(NS, "fresh", new MemoryMetadata("fact", 0.5, null, "s1"));

        verify(repository).deleteAll(oldest);
    }

    @Test
    void add_storeUnavailable_throwsMemoryStoreException() {
        when(repository.countByNamespace(NS)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> store.add(NS, "x", new MemoryMetadata("fact", 0.5, null, "s1")))
                .isInstanceOf(MemoryStoreException.class);
    }

    private static MemoryDocument doc(String id, String content, double importance, Instant createdAt) {
        return MemoryDocument.builder()
                .id(id)
                .namespace(NS)
                .content(content)
                .memoryType("fact")
                .importanceScore(importance)
                .createdAt(createdAt)
                .build();
    }
}
