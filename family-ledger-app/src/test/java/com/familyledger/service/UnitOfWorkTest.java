package com.familyledger.service;

import com.familyledger.LedgerFixtures;
import com.familyledger.config.EngineConfig;
import com.familyledger.exception.InvalidRelationshipException;
import com.familyledger.exception.StorageUnavailableException;
import com.familyledger.model.EntityFilter;
import com.familyledger.model.EntityKind;
import com.familyledger.repository.EntityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.time.Duration;

import static com.familyledger.LedgerFixtures.ALICE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = {"/reset.sql", "/accounts.sql"}, executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class UnitOfWorkTest {

    @Autowired
    private EntityStore entityStore;

    @Autowired
    private EngineConfig engineConfig;

    @SpyBean
    private EntityRepository entityRepository;

    private LedgerFixtures alice;

    @BeforeEach
    void setUp() {
        alice = new LedgerFixtures(entityStore, ALICE);
    }

    @Test
    void persistentStorageFaultSurfacesAsUnavailableAfterBoundedRetries() {
        doThrow(new DataAccessResourceFailureException("connection refused"))
            .when(entityRepository).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());

        assertThatThrownBy(() -> alice.person("Chris"))
            .isInstanceOf(StorageUnavailableException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);

        verify(entityRepository, times(3)).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());
    }

    @Test
    void retriesWaitTheConfiguredBackoffBetweenAttempts() {
        doThrow(new DataAccessResourceFailureException("connection refused"))
            .when(entityRepository).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());

        long started = System.nanoTime();
        assertThatThrownBy(() -> alice.person("Chris"))
            .isInstanceOf(StorageUnavailableException.class)
            .hasMessageContaining("3 attempts");
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isGreaterThanOrEqualTo(engineConfig.getStorageRetryBackoff().multipliedBy(2));
    }

    @Test
    void transientFaultIsRetriedUntilItClears() {
        doThrow(new CannotAcquireLockException("lock timeout"))
            .doCallRealMethod()
            .when(entityRepository).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());

        long id = alice.person("Chris");

        assertThat(entityStore.get(ALICE, EntityKind.PERSON, id).getString("givenName")).isEqualTo("Chris");
        verify(entityRepository, times(2)).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());
    }

    @Test
    void nonTransientStorageErrorIsNotRetried() {
        doThrow(new DataIntegrityViolationException("constraint"))
            .when(entityRepository).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());

        assertThatThrownBy(() -> alice.person("Chris")).isInstanceOf(DataIntegrityViolationException.class);

        verify(entityRepository, times(1)).insert(eq(EntityKind.PERSON), anyLong(), anyMap(), any());
    }

    @Test
    void domainErrorIsNotRetriedAndWritesNothing() {
        long chris = alice.person("Chris");

        assertThatThrownBy(() -> alice.parent(chris, chris)).isInstanceOf(InvalidRelationshipException.class);

        verify(entityRepository, never()).insert(eq(EntityKind.RELATIONSHIP), anyLong(), anyMap(), any());
        assertThat(entityStore.list(ALICE, EntityKind.RELATIONSHIP, EntityFilter.withTombstoned())).isEmpty();
    }

    @Test
    void failedAttemptLeavesNoPartialWrite() {
        long chris = alice.person("Chris");
        doThrow(new DataAccessResourceFailureException("connection reset"))
            .when(entityRepository).markDeleted(eq(EntityKind.PERSON), eq(chris), anyLong(), any());

        assertThatThrownBy(() -> entityStore.softDelete(ALICE, EntityKind.PERSON, chris))
            .isInstanceOf(StorageUnavailableException.class);

        assertThat(entityStore.get(ALICE, EntityKind.PERSON, chris).deleted()).isFalse();
    }

    @Test
    void classifiesTransientFaults() {
        assertThat(UnitOfWork.isTransient(new CannotAcquireLockException("lock"))).isTrue();
        assertThat(UnitOfWork.isTransient(new DataAccessResourceFailureException("down"))).isTrue();
        assertThat(UnitOfWork.isTransient(new DataIntegrityViolationException("dup"))).isFalse();
        assertThat(UnitOfWork.isTransient(new IllegalStateException("bug"))).isFalse();
    }
}
