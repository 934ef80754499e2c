package com.deepansh.memorychat.memory;

import com.deepansh.memorychat.exception.MemoryStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    @Mock SessionMetadataRepository sessionRepo;
    @Mock MongoTemplate mongoTemplate;

    @InjectMocks SessionService sessionService;

    @Test
    void recordTurn_returnsUpdatedSession() {
        SessionMetadata existing = SessionMetadata.builder()
                .sessionId("s1").userId("alice").profileId("work").turnCount(4).build();
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(SessionMetadata.class))).thenReturn(existing);

        SessionMetadata result = sessionService.recordTurn("s1", "alice", "personal");

        assertThat(result.getProfileId()).isEqualTo("work");
        assertThat(result.getTurnCount()).isEqualTo(4);
    }

    @Test
    void recordTurn_upsertsAndIncrementsTurnCount() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(SessionMetadata.class)))
                .thenReturn(SessionMetadata.builder().sessionId("s1").turnCount(1).build());

        sessionService.recordTurn("s1", "alice", null);

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        ArgumentCaptor<FindAndModifyOptions> options = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        verify(mongoTemplate).findAndModify(any(Query.class), update.capture(), options.capture(),
                eq(SessionMetadata.class));
        assertThat(options.getValue().isUpsert()).isTrue();
        assertThat(options.getValue().isReturnNew()).isTrue();
        assertThat(update.getValue().modifies("turnCount")).isTrue();
        assertThat(update.getValue().modifies("userId")).isTrue();
    }

    @Test
    void recordTurn_nullResult_buildsFallback() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(SessionMetadata.class))).thenReturn(null);

        SessionMetadata result = sessionService.recordTurn("s1", "alice", "personal");

        assertThat(result.getSessionId()).isEqualTo("s1");
        assertThat(result.getProfileId()).isEqualTo("personal");
        assertThat(result.getTurnCount()).isEqualTo(1);
    }

    @Test
    void recordTurn_storeUnavailable_throwsMemoryStoreException() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(SessionMetadata.class)))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> sessionService.recordTurn("s1", "alice", null))
                .isInstanceOf(MemoryStoreException.class)
                .hasMessageContaining("s1");
    }

    @Test
    void getSessionsForUser_delegatesToRepository() {
        List<SessionMetadata> sessions = List.of(SessionMetadata.builder().sessionId("s1").build());
        when(sessionRepo.findByUserIdOrderByUpdatedAtDesc("alice")).thenReturn(sessions);

        assertThat(sessionService.getSessionsForUser("alice")).isSameAs(sessions);
    }
}
