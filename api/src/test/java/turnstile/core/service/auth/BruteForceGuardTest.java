package turnstile.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.MutableClock;
import turnstile.adapter.out.store.memory.InMemoryLimiterStateStore;
import turnstile.core.model.auth.BruteForceEntry;
import turnstile.core.model.auth.LockoutPolicy;

@DisplayName("BruteForceGuard")
class BruteForceGuardTest {

    private static final String IP = "ip";

    private MutableClock clock;
    private InMemoryLimiterStateStore<BruteForceEntry> store;
    private BruteForceGuard guard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(1_700_000_000_000L);
        store = new InMemoryLimiterStateStore<>();
        guard = new BruteForceGuard(LockoutPolicy.ofMillis(3, 900_000, 3_600_000), store, clock);
    }

    @Nested
    @DisplayName("Recording failures")
    class FailureTests {

        @Test
        @DisplayName("should lock after three failures")
        void shouldLockAfterMaxFailures() {
            assertEquals(2, guard.recordFailure(IP));
            assertEquals(1, guard.recordFailure(IP));
            assertFalse(guard.isLocked(IP));
            assertEquals(0, guard.recordFailure(IP));

            assertTrue(guard.isLocked(IP));
            var remaining = guard.getLockoutTimeRemaining(IP);
            assertTrue(remaining > 0 && remaining <= 900_000, "remaining " + remaining);
        }

        @Test
        @DisplayName("should start a new sequence after the reset window")
        void shouldRestartAfterResetWindow() {
            guard.recordFailure(IP);
            guard.recordFailure(IP);

            clock.advance(Duration.ofMinutes(61));

            assertEquals(2, guard.recordFailure(IP));
            assertEquals(1, guard.getFailureCount(IP));
        }

        @Test
        @DisplayName("should keep counting inside the reset window")
        void shouldKeepCountingInsideWindow() {
            guard.recordFailure(IP);
            clock.advance(Duration.ofMinutes(59));

            assertEquals(1, guard.recordFailure(IP));
        }

        @Test
        @DisplayName("should never report negative remaining attempts")
        void shouldClampRemaining() {
            for (var i = 0; i < 5; i++) {
                guard.recordFailure(IP);
            }

            assertEquals(0, guard.recordFailure(IP));
        }

        @Test
        @DisplayName("should keep keys independent")
        void shouldIsolateKeys() {
            guard.recordFailure(IP);
            guard.recordFailure(IP);
            guard.recordFailure(IP);

            assertFalse(guard.isLocked("other"));
            assertEquals(0, guard.getLockoutTimeRemaining("other"));
        }
    }

    @Nested
    @DisplayName("Lock lifecycle")
    class LifecycleTests {

        @BeforeEach
        void lock() {
            guard.recordFailure(IP);
            guard.recordFailure(IP);
            guard.recordFailure(IP);
        }

        @Test
        @DisplayName("should clear everything on success")
        void shouldClearOnSuccess() {
            guard.recordSuccess(IP);

            assertFalse(guard.isLocked(IP));
            assertEquals(0, guard.getFailureCount(IP));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should unlock after the lockout without a new failure")
        void shouldUnlockAfterLockout() {
            clock.advance(Duration.ofMinutes(15));

            assertFalse(guard.isLocked(IP));
            assertEquals(0, guard.getLockoutTimeRemaining(IP));
        }

        @Test
        @DisplayName("should keep the failure count when a lock expires")
        void shouldKeepFailuresAfterExpiry() {
            clock.advance(Duration.ofMinutes(16));
            assertFalse(guard.isLocked(IP));

            assertEquals(3, guard.getFailureCount(IP));
            assertEquals(0, guard.recordFailure(IP));
            assertTrue(guard.isLocked(IP));
        }

        @Test
        @DisplayName("should count down the remaining lockout")
        void shouldCountDownLockout() {
            clock.advance(Duration.ofMinutes(5));

            assertEquals(600_000, guard.getLockoutTimeRemaining(IP));
        }
    }

    @Nested
    @DisplayName("Lock transitions")
    class TransitionTests {

        @Test
        @DisplayName("should report the failure that starts a lockout")
        void shouldReportLockStart() {
            assertFalse(guard.registerFailure(IP).lockStarted());
            assertFalse(guard.registerFailure(IP).lockStarted());

            var outcome = guard.registerFailure(IP);

            assertTrue(outcome.lockStarted());
            assertEquals(3, outcome.failureCount());
            assertEquals(0, outcome.remainingAttempts());
        }

        @Test
        @DisplayName("should not start a new lockout while already locked")
        void shouldNotRestartWhileLocked() {
            guard.recordFailure(IP);
            guard.recordFailure(IP);
            guard.recordFailure(IP);

            var outcome = guard.registerFailure(IP);

            assertFalse(outcome.lockStarted());
            assertEquals(4, outcome.failureCount());
            assertEquals(0, outcome.remainingAttempts());
        }

        @Test
        @DisplayName("should start a new lockout after the previous one expired")
        void shouldRelockAfterExpiry() {
            guard.recordFailure(IP);
            guard.recordFailure(IP);
            guard.recordFailure(IP);
            clock.advance(Duration.ofMinutes(16));

            assertTrue(guard.registerFailure(IP).lockStarted());
        }
    }

    @Test
    @DisplayName("should retain entries through the longer of lockout and reset window")
    void shouldRetainThroughLongestPeriod() {
        assertEquals(
                Duration.ofHours(1), BruteForceGuard.retention(LockoutPolicy.ofMillis(3, 900_000, 3_600_000)));
        assertEquals(
                Duration.ofHours(2), BruteForceGuard.retention(LockoutPolicy.ofMillis(3, 7_200_000, 3_600_000)));
    }
}
