package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.model.AvailabilityWindow;
import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.AvailabilityWindowRepository;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.BookingStateTransitionRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.domain.strategy.PessimisticBookingGuard;
import com.slotbooking.booking.exception.SlotConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two customers race for overlapping ranges through the real coordinator and the provider
 * row lock against PostgreSQL. Slot locks and the cache are mocked out.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@EntityScan("com.slotbooking.booking.domain.model")
@Import({BookingCoordinator.class, PessimisticBookingGuard.class, PricingPolicy.class,
        ConfirmationCodeGenerator.class, BookingCoordinatorConcurrencyIntegrationTest.FixedClock.class})
@Testcontainers(disabledWithoutDocker = true)
class BookingCoordinatorConcurrencyIntegrationTest {

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

    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 9);

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private BookingCoordinator coordinator;
    @Autowired
    private ProviderRepository providerRepository;
    @Autowired
    private AvailabilityWindowRepository windowRepository;
    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private BookingStateTransitionRepository transitionRepository;

    @MockBean
    private SlotLockService slotLockService;
    @MockBean
    private AvailabilityCache availabilityCache;

    private CreateBookingCommand command(Long providerId, long customerId, String start, String end) {
        return CreateBookingCommand.builder()
                .providerId(providerId)
                .customerId(customerId)
                .date(MONDAY)
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .servicePrice(new BigDecimal("60.00"))
                .build();
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("two customers booking overlapping ranges at once: one commits, the other gets a slot conflict")
    void createBooking_concurrentOverlap() throws Exception {
        Long providerId = providerRepository.saveAndFlush(Provider.builder()
                .displayName("Studio A")
                .timezone("UTC")
                .active(true)
                .createdAt(LocalDateTime.of(2026, 3, 1, 9, 0))
                .build()).getId();
        windowRepository.saveAndFlush(AvailabilityWindow.builder()
                .providerId(providerId)
                .dayOfWeek(DayOfWeek.MONDAY)
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(17, 0))
                .active(true)
                .build());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Booking>> results = new ArrayList<>();
            for (CreateBookingCommand command : List.of(
                    command(providerId, 5L, "14:00", "15:00"),
                    command(providerId, 6L, "14:30", "15:30"))) {
                Callable<Booking> attempt = () -> {
                    start.await();
                    return coordinator.createBooking(command);
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            List<Booking> committed = new ArrayList<>();
            List<Throwable> rejected = new ArrayList<>();
            for (Future<Booking> result : results) {
                try {
                    committed.add(result.get());
                } catch (ExecutionException e) {
                    rejected.add(e.getCause());
                }
            }

            assertThat(committed).hasSize(1);
            assertThat(rejected).hasSize(1);
            assertThat(rejected.get(0)).isInstanceOf(SlotConflictException.class);
            assertThat(bookingRepository.findOccupying(providerId, MONDAY, MONDAY, BookingStatus.SLOT_RELEASING))
                    .extracting(Booking::getId)
                    .containsExactly(committed.get(0).getId());
        } finally {
            pool.shutdownNow();
            transitionRepository.deleteAll();
            bookingRepository.deleteAll();
            windowRepository.deleteAll();
            providerRepository.deleteAll();
        }
    }
}
