package com.openforge.storeagent.action;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.config.AppConfig;
import com.openforge.storeagent.config.JpaConfig;
import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import com.openforge.storeagent.repository.PendingActionRepository;
import com.openforge.storeagent.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Decisions and the expiry sweep racing on the same row, each through its
 * own transaction. Every race must end with exactly one winner.
 */
@DataJpaTest
@Import(JpaConfig.class)
class ActionQueueConcurrencyTest {

    private static final Instant START  = Instant.parse("2026-03-01T10:00:00Z");
    private static final int     ROUNDS = 10;

    @Autowired
    private PendingActionRepository repository;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private ActionQueueService queue;
    private ExecutorService    pool;

    @BeforeEach
    void setUp() {
        queue = new ActionQueueService(repository,
                new ActionQueueProperties(Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofMinutes(5)),
                objectMapper, new MutableClock(START));
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        repository.deleteAll();
    }

    private PendingAction enqueueRefund() {
        return queue.enqueue(11L, null, 7L, "issue_refund",
                objectMapper.createObjectNode().put("order_id", "1001").put("amount", 25.00));
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("racing approve and reject leave exactly one decision")
    void approveAgainstReject() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            PendingAction action = enqueueRefund();

            int wins = race(
                    () -> queue.approve(action.getId(), "admin-7"),
                    () -> queue.reject(action.getId(), "admin-9"));

            assertThat(wins).isEqualTo(1);
            PendingAction decided = queue.get(action.getId());
            assertThat(decided.getStatus()).isIn(ActionStatus.APPROVED, ActionStatus.REJECTED);
            if (decided.getStatus() == ActionStatus.APPROVED) {
                assertThat(decided.getRejectedBy()).isNull();
            } else {
                assertThat(decided.getApprovedBy()).isNull();
            }
        }
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("an approval racing the expiry sweep either approves or expires, never both")
    void approveAgainstSweep() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            PendingAction action = enqueueRefund();
            Instant afterTtl = action.getExpiresAt().plusSeconds(1);

            int wins = race(
                    () -> queue.approve(action.getId(), "admin-7"),
                    () -> {
                        if (queue.sweepExpired(afterTtl) != 1) {
                            throw new InvalidTransitionException(action.getId(), ActionStatus.APPROVED, ActionStatus.EXPIRED);
                        }
                        return null;
                    });

            assertThat(wins).isEqualTo(1);
            PendingAction settled = queue.get(action.getId());
            assertThat(settled.getStatus()).isIn(ActionStatus.APPROVED, ActionStatus.EXPIRED);
            assertThat(settled.getApprovedBy() != null).isEqualTo(settled.getStatus() == ActionStatus.APPROVED);
        }
    }

    /** Starts both calls together and returns how many of them succeeded. */
    private int race(Callable<?> first, Callable<?> second) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        Future<?> a = pool.submit(() -> {
            start.await();
            return first.call();
        });
        Future<?> b = pool.submit(() -> {
            start.await();
            return second.call();
        });
        start.countDown();
        return succeeded(a) + succeeded(b);
    }

    private static int succeeded(Future<?> future) throws Exception {
        try {
            future.get(30, TimeUnit.SECONDS);
            return 1;
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(InvalidTransitionException.class);
            return 0;
        }
    }
}
