package com.mk.fx.qa.load.ramp.executors.step;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class StepRampParametersTest {

  private static StepRampParameters params(int start, int max, int inc) {
    return new StepRampParameters(start, max, inc, Duration.ofSeconds(1), Duration.ZERO);
  }

  @Test
  void steps_from200To2000By100_hasNineteenSteps() {
    var steps = params(200, 2000, 100).steps();

    assertEquals(19, steps.size());
    assertEquals(200, steps.get(0));
    assertEquals(300, steps.get(1));
    assertEquals(2000, steps.get(18));
  }

  @Test
  void steps_neverExceedMaxUsers_whenIncrementDoesNotDivideRange() {
    assertEquals(List.of(1, 5, 9), params(1, 10, 4).steps());
  }

  @Test
  void steps_singleStep_whenStartEqualsMax() {
    assertEquals(List.of(7), params(7, 7, 3).steps());
  }

  @Test
  void steps_singleStep_whenIncrementLargerThanRange() {
    assertEquals(List.of(5), params(5, 6, Integer.MAX_VALUE).steps());
  }

  @Test
  void steps_followArithmeticLaw() {
    var p = params(3, 50, 7);
    var steps = p.steps();

    for (int i = 0; i < steps.size(); i++) {
      assertEquals(3 + i * 7, steps.get(i));
      assertTrue(steps.get(i) <= 50);
    }
    assertTrue(steps.get(steps.size() - 1) + 7 > 50);
  }

  @Test
  void zeroDurations_areAccepted() {
    var p = new StepRampParameters(1, 1, 1, Duration.ZERO, Duration.ZERO);
    assertEquals(List.of(1), p.steps());
  }

  @Test
  void invalidCounts_throwIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> params(0, 10, 1));
    assertThrows(IllegalArgumentException.class, () -> params(10, 9, 1));
    assertThrows(IllegalArgumentException.class, () -> params(1, 10, 0));
  }

  @Test
  void negativeDurations_throwIllegalArgument() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StepRampParameters(1, 1, 1, Duration.ofMillis(-1), Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StepRampParameters(1, 1, 1, Duration.ZERO, Duration.ofMillis(-1)));
  }

  @Test
  void nullDurations_throwNpe() {
    assertThrows(
        NullPointerException.class, () -> new StepRampParameters(1, 1, 1, null, Duration.ZERO));
    assertThrows(
        NullPointerException.class, () -> new StepRampParameters(1, 1, 1, Duration.ZERO, null));
  }
}
