package com.ospicorp.sgs.series.client;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private final RetryPolicy policy = RetryPolicy.defaults();

  @Test
  void retriesTransientFailuresWithinBudget() {
    RetryState first = RetryState.initial().nextAttempt().failedWith(ErrorKind.THROTTLED);
    assertTrue(policy.canRetry(first));

    RetryState second = first.nextAttempt().failedWith(ErrorKind.SERVER_ERROR);
    assertTrue(policy.canRetry(second));

    RetryState third = second.nextAttempt().failedWith(ErrorKind.TIMEOUT);
    assertEquals(3, third.attemptNumber());
    assertFalse(policy.canRetry(third));
  }

  @Test
  void terminalFailuresAreNeverRetried() {
    for (ErrorKind kind : List.of(ErrorKind.NOT_FOUND, ErrorKind.BAD_REQUEST,
        ErrorKind.CLIENT_ERROR, ErrorKind.INVALID_PAYLOAD)) {
      assertFalse(policy.canRetry(RetryState.initial().nextAttempt().failedWith(kind)), kind.name());
    }
  }

  @Test
  void backoffFollowsScheduleAndSticksToLastStep() {
    assertEquals(Duration.ofSeconds(1), policy.delayAfter(1));
    assertEquals(Duration.ofSeconds(2), policy.delayAfter(2));
    assertEquals(Duration.ofSeconds(5), policy.delayAfter(3));
    assertEquals(Duration.ofSeconds(5), policy.delayAfter(7));
  }

  @Test
  void rejectsEmptySchedule() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, List.of()));
    assertEquals(1, new RetryPolicy(0, RetryPolicy.DEFAULT_BACKOFF).maxAttempts());
  }
}
