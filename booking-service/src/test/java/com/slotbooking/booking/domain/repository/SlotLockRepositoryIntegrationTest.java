package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.SlotLock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test for the single-statement slot lock upsert: a live lock held by another
 * session is never overwritten, an expired one is taken over, and the holder may refresh.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@EntityScan("com.slotbooking.booking.domain.model")
@Testcontainers(disabledWithoutDocker = true)
class SlotLockRepositoryIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("booking_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    private static final Long PROVIDER_ID = 1L;
    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);
    private static final LocalTime START = LocalTime.of(10, 0);
    private static final LocalTime END = LocalTime.of(11, 0);
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 8, 0);

    @Autowired
    private SlotLockRepository repository;

    private int acquire(String session, LocalDateTime now, int ttlMinutes) {
        return repository.tryAcquire(UUID.randomUUID(), PROVIDER_ID, DATE, START, END, session,
                now.plusMinutes(ttlMinutes), now);
    }

    @Test
    @DisplayName("second session cannot take a live lock: exactly one of many attempts succeeds")
    void tryAcquire_contested() {
        int successes = 0;
        for (int i = 0; i < 5; i++) {
            successes += acquire("session-" + i, NOW, 10);
        }

        SlotLock lock = repository.findByProviderIdAndSlotDateAndStartTimeAndEndTime(PROVIDER_ID, DATE, START, END)
                .orElseThrow();
        assertThat(successes).isEqualTo(1);
        assertThat(lock.getSessionId()).isEqualTo("session-0");
    }

    @Test
    @DisplayName("an expired lock is taken over by another session")
    void tryAcquire_takesOverExpired() {
        assertThat(acquire("session-a", NOW, 10)).isEqualTo(1);

        int updated = acquire("session-b", NOW.plusMinutes(11), 10);

        SlotLock lock = repository.findByProviderIdAndSlotDateAndStartTimeAndEndTime(PROVIDER_ID, DATE, START, END)
                .orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(lock.getSessionId()).isEqualTo("session-b");
        assertThat(lock.getLockedUntil()).isEqualTo(NOW.plusMinutes(21));
    }

    @Test
    @DisplayName("the holder refreshes its own lock and keeps the lock id")
    void tryAcquire_refreshKeepsId() {
        acquire("session-a", NOW, 10);
        UUID originalId = repository.findByProviderIdAndSlotDateAndStartTimeAndEndTime(PROVIDER_ID, DATE, START, END)
                .orElseThrow().getId();

        int updated = acquire("session-a", NOW.plusMinutes(5), 10);

        SlotLock lock = repository.findByProviderIdAndSlotDateAndStartTimeAndEndTime(PROVIDER_ID, DATE, START, END)
                .orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(lock.getId()).isEqualTo(originalId);
        assertThat(lock.getLockedUntil()).isEqualTo(NOW.plusMinutes(15));
    }

    @Test
    @DisplayName("sweep deletes only expired locks")
    void deleteExpired() {
        acquire("session-a", NOW, 10);
        repository.tryAcquire(UUID.randomUUID(), PROVIDER_ID, DATE, END, END.plusHours(1), "session-b",
                NOW.plusMinutes(30), NOW);

        int deleted = repository.deleteExpired(NOW.plusMinutes(15));

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findActive(PROVIDER_ID, DATE, DATE, NOW.plusMinutes(15))).hasSize(1);
    }
}
