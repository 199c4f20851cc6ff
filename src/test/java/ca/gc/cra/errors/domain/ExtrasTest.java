package ca.gc.cra.errors.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExtrasTest {

  @Test
  void emptyHasZeroValues() {
    assertTrue(Extras.EMPTY.isEmpty());
    assertEquals(Duration.ZERO, Extras.EMPTY.delay());
    assertEquals("", Extras.EMPTY.stackTrace());
    assertTrue(Extras.EMPTY.links().isEmpty());
    assertTrue(Extras.EMPTY.tags().isEmpty());
  }

  @Test
  void withersReturnCopiesAndLeaveReceiverUntouched() {
    Extras base = Extras.EMPTY.withTags("db");
    Extras derived = base
        .withDelay(Duration.ofSeconds(3))
        .withLinks("https://runbooks/db")
        .withStackTrace("at Foo.bar")
        .withTags("primary");

    assertEquals(List.of("db"), base.tags());
    assertTrue(base.links().isEmpty());
    assertEquals(Duration.ZERO, base.delay());
    assertEquals(List.of("db", "primary"), derived.tags());
    assertEquals(List.of("https://runbooks/db"), derived.links());
    assertEquals(Duration.ofSeconds(3), derived.delay());
    assertEquals("at Foo.bar", derived.stackTrace());
    assertFalse(derived.isEmpty());
  }

  @Test
  void listsOnlyGrowInOrder() {
    Extras extras = Extras.EMPTY.withLinks("a", "b").withLinks().withLinks("c");

    assertEquals(List.of("a", "b", "c"), extras.links());
    assertThrows(UnsupportedOperationException.class, () -> extras.links().remove(0));
  }

  @Test
  void equalityIsDeep() {
    Extras left = Extras.EMPTY.withTags("x").withDelay(Duration.ofMillis(5));
    Extras right = Extras.of(Duration.ofMillis(5), List.of(), null, List.of("x"));

    assertEquals(left, right);
    assertEquals(left.hashCode(), right.hashCode());
    assertNotEquals(left, left.withTags("y"));
  }

  @Test
  void nullsNormaliseOrAreRejected() {
    assertEquals(Extras.EMPTY, Extras.EMPTY.withDelay(null).withStackTrace(null));
    assertThrows(NullPointerException.class, () -> Extras.EMPTY.withTags("a", null));
    assertThrows(NullPointerException.class, () -> Extras.of(null, null, null, List.of()));
  }
}
