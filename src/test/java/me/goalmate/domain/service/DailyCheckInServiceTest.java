package me.goalmate.domain.service;

import me.goalmate.domain.model.DailyCheckInResult;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.PersistenceFailureException;
import me.goalmate.infrastructure.config.GoalMateProperties;
import me.goalmate.port.outbound.CheckInLogPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DailyCheckInServiceTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-03-10T09:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private GoalMateSession session;
    private CheckInLogPort checkInLogPort;
    private ActivityLogService activityLogService;
    private DailyCheckInService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC);
        GoalMateProperties properties = new GoalMateProperties();
        session = new GoalMateSession();
        checkInLogPort = mock(CheckInLogPort.class);
        activityLogService = new ActivityLogService(session, properties);
        LevelingService levelingService = new LevelingService(session, activityLogService, clock);
        service = new DailyCheckInService(session, checkInLogPort, new InFlightRegistry(properties, clock),
                levelingService, activityLogService, properties, clock);
    }

    @Test
    void shouldCommitAfterLogConfirmsWrite() {
        when(checkInLogPort.recordCheckIn("local-user", FIXED_INSTANT))
                .thenReturn(CompletableFuture.completedFuture(null));

        DailyCheckInResult result = service.checkIn().join();

        assertEquals(TODAY, result.date());
        assertEquals(10, result.award().amount());
        assertTrue(service.isCheckedInToday());
        assertEquals(10, session.getProfile().getExperience());
        assertEquals(1, activityLogService.getCheckInLog().get(0).getCount());
        verify(checkInLogPort).recordCheckIn(eq("local-user"), eq(FIXED_INSTANT));
    }

    @Test
    void shouldWithholdStateWhenWriteFails() {
        when(checkInLogPort.recordCheckIn(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        CompletionException error = assertThrows(CompletionException.class, () -> service.checkIn().join());

        assertInstanceOf(PersistenceFailureException.class, error.getCause());
        assertEquals(DailyCheckInService.FAILURE_MESSAGE, error.getCause().getMessage());
        assertFalse(service.isCheckedInToday());
        assertEquals(0, session.getProfile().getExperience());
        assertTrue(activityLogService.getCheckInLog().isEmpty());
    }

    @Test
    void shouldAllowRetryAfterFailure() {
        when(checkInLogPort.recordCheckIn(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertThrows(CompletionException.class, () -> service.checkIn().join());
        service.checkIn().join();

        assertTrue(service.isCheckedInToday());
    }

    @Test
    void shouldTreatSynchronousPortErrorAsFailure() {
        when(checkInLogPort.recordCheckIn(any(), any())).thenThrow(new IllegalStateException("closed"));

        CompletionException error = assertThrows(CompletionException.class, () -> service.checkIn().join());

        assertInstanceOf(PersistenceFailureException.class, error.getCause());
    }

    @Test
    void shouldRejectSecondCheckInSameDay() {
        when(checkInLogPort.recordCheckIn(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        service.checkIn().join();

        assertThrows(IllegalStateException.class, () -> service.checkIn());
    }

    @Test
    void shouldRejectCheckInWhileOneIsPending() {
        when(checkInLogPort.recordCheckIn(any(), any())).thenReturn(new CompletableFuture<>());
        service.checkIn();

        assertThrows(IllegalStateException.class, () -> service.checkIn());
    }
}
