package ca.gc.cra.errors.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class CanonicalTest {
  private static final Canonical NOT_FOUND = Canonical.builder()
      .namespace("svc")
      .code("not-found")
      .message("missing")
      .build();
  private static final Canonical CONFLICT = Canonical.builder()
      .namespace("svc")
      .code("conflict")
      .message("already exists")
      .flags(Flags.RETRYABLE)
      .build();

  @Test
  void rendersNamespaceCodeMessageAndCause() {
    Canonical error = NOT_FOUND.wrap(new IOException("disk full"));

    assertEquals("[svc:not-found] missing\n-> disk full", error.getMessage());
    assertEquals(error.getMessage(), error.toString());
    assertEquals("[svc:not-found] missing", NOT_FOUND.getMessage());
  }

  @Test
  void rendersNestedCausesRecursively() {
    Canonical error = NOT_FOUND.wrap(CONFLICT.wrap(new IOException("disk full")));

    assertEquals("[svc:not-found] missing\n-> [svc:conflict] already exists\n-> disk full", error.getMessage());
  }

  @Test
  void keyJoinsNamespaceAndCode() {
    assertEquals("svc/not-found", NOT_FOUND.key());
    assertEquals("cra/errors/unknown", Canonical.UNKNOWN.key());
  }

  @Test
  void zeroValueIsRecognised() {
    assertTrue(Canonical.ZERO.isZero());
    assertTrue(Canonical.builder().build().isZero());
    assertFalse(NOT_FOUND.isZero());
    assertFalse(Canonical.ZERO.wrap(new IOException("x")).isZero());
  }

  @Test
  void wrapNullReturnsReceiver() {
    assertSame(NOT_FOUND, NOT_FOUND.wrap(null));
  }

  @Test
  void zeroWrapOfClassifiedErrorReturnsDeepCopy() {
    Canonical classified = NOT_FOUND.wrap(CONFLICT.wrap(new IOException("disk full")));

    Canonical copy = Canonical.ZERO.wrap(classified);

    assertNotSame(classified, copy);
    assertTrue(copy.equal(classified));
    Throwable copiedCause = copy.wrapped().orElseThrow();
    Throwable originalCause = classified.wrapped().orElseThrow();
    assertNotSame(originalCause, copiedCause);
    assertEquals(originalCause, copiedCause);
    assertSame(((Canonical) originalCause).wrapped().orElseThrow(),
        ((Canonical) copiedCause).wrapped().orElseThrow(), "foreign causes are shared");
  }

  @Test
  void zeroWrapOfForeignErrorKeepsEmptyIdentity() {
    IOException foreign = new IOException("boom");

    Canonical wrapped = Canonical.ZERO.wrap(foreign);

    assertEquals("", wrapped.code().value());
    assertEquals("", wrapped.namespace().value());
    assertSame(foreign, wrapped.wrapped().orElseThrow());
    assertSame(foreign, wrapped.getCause());
    assertEquals("[:] \n-> boom", wrapped.getMessage());
  }

  @Test
  void zeroWrapFindsClassifiedErrorBehindForeignWrapper() {
    RuntimeException outer = new RuntimeException("outer", CONFLICT);

    assertTrue(Canonical.ZERO.wrap(outer).equal(CONFLICT));
  }

  @Test
  void equalityIgnoresWrappedCause() {
    Canonical first = NOT_FOUND.wrap(new IOException("a"));
    Canonical second = NOT_FOUND.wrap(new IllegalStateException("b"));

    assertTrue(first.equal(second));
    assertTrue(first.is(second));
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertTrue(Errors.is(first, NOT_FOUND));
  }

  @Test
  void equalityComparesEveryClassificationField() {
    assertFalse(NOT_FOUND.equal(NOT_FOUND.withFlags(Flags.TIMEOUT)));
    assertFalse(NOT_FOUND.equal(NOT_FOUND.withTags("x")));
    assertFalse(NOT_FOUND.equal(CONFLICT));
    assertFalse(NOT_FOUND.equal(new IOException("[svc:not-found] missing")));
    assertFalse(NOT_FOUND.equal(null));
    assertNotEquals(NOT_FOUND, CONFLICT);
  }

  @Test
  void copyIsEqualAndIndependent() {
    Canonical original = NOT_FOUND.withTags("a").wrap(CONFLICT);

    Canonical copy = original.copy();
    Canonical tagged = copy.withTags("b");

    assertTrue(copy.equal(original));
    assertEquals(List.of("a"), original.extras().tags());
    assertEquals(List.of("a", "b"), tagged.extras().tags());
  }

  @Test
  void withFlagsMergesBits() {
    Canonical flagged = NOT_FOUND.withFlags(Flags.RETRYABLE).withFlags(Flags.TIMEOUT);

    assertEquals(6, flagged.flags().value());
    assertTrue(flagged.isRetryable());
    assertTrue(flagged.isTimeout());
    assertTrue(NOT_FOUND.flags().isEmpty());
  }

  @Test
  void withBuildersPreserveCause() {
    IOException cause = new IOException("disk full");
    Canonical error = NOT_FOUND.wrap(cause);

    assertSame(cause, error.withTags("t").getCause());
    assertSame(cause, error.withFlags(Flags.TIMEOUT).getCause());
    assertSame(cause, error.withExtras(Extras.EMPTY.withLinks("l")).getCause());
    assertEquals(List.of("l"), error.withExtras(Extras.EMPTY.withLinks("l")).extras().links());
  }

  @Test
  void classificationQueriesReadFlags() {
    assertTrue(CONFLICT.isRetryable());
    assertFalse(CONFLICT.isTimeout());
    assertFalse(CONFLICT.isTransient());
    assertTrue(Canonical.UNKNOWN.isTransient());
  }

  @Test
  void wrapfFormatsForeignCause() {
    Canonical error = NOT_FOUND.wrapf("user %s in %d", "bob", 3);

    assertEquals("[svc:not-found] missing\n-> user bob in 3", error.getMessage());
  }

  @Test
  void wrapfKeepsTrailingThrowableAsCause() {
    IOException io = new IOException("denied");

    Canonical error = NOT_FOUND.wrapf("read %s failed", "config", io);

    Throwable formatted = error.wrapped().orElseThrow();
    assertEquals("read config failed", formatted.getMessage());
    assertSame(io, formatted.getCause());
  }

  @Test
  void asGroupListsChainInWrapOrder() {
    Canonical third = Canonical.builder().namespace("svc").code("c").message("third").build();
    Canonical second = Canonical.builder().namespace("svc").code("b").message("second").build();
    Canonical first = Canonical.builder().namespace("svc").code("a").message("first").build();
    Canonical chain = first.wrap(second.wrap(third));

    List<Throwable> members = chain.asGroup().slice();

    assertEquals(3, members.size());
    assertTrue(first.equal(members.get(0)));
    assertTrue(second.equal(members.get(1)));
    assertTrue(third.equal(members.get(2)));
  }

  @Test
  void asGroupIncludesForeignTerminalOnce() {
    IllegalStateException foreign = new IllegalStateException("io");

    Group group = NOT_FOUND.wrap(foreign).asGroup();

    assertEquals(2, group.size());
    Canonical terminal = group.errors().get(1);
    assertTrue(terminal.equal(Canonical.UNKNOWN));
    assertSame(foreign, terminal.getCause());
  }

  @Test
  void asGroupStopsWhenForeignCausePointsBack() {
    IllegalStateException foreign = new IllegalStateException("loop");
    Canonical error = NOT_FOUND.wrap(foreign);
    foreign.initCause(error);

    Group group = error.asGroup();

    assertEquals(2, group.size());
    assertSame(error, group.errors().get(1));
  }

  @Test
  void asGroupOfUnwrappedErrorHoldsItself() {
    assertEquals(List.of(NOT_FOUND), NOT_FOUND.asGroup().slice());
  }

  @Test
  void plainFormatIsSingleLine() {
    Canonical error = NOT_FOUND.wrap(CONFLICT);

    assertEquals(error.getMessage(), String.format("%s", error));
    assertEquals(error.getMessage().toUpperCase(Locale.ROOT), String.format(Locale.ROOT, "%S", error));
  }

  @Test
  void alternateFormatUnrollsWholeChain() {
    Canonical error = NOT_FOUND.wrap(CONFLICT);

    String verbose = String.format("%#s", error);

    assertEquals("\n* [svc:not-found] missing\n-> [svc:conflict] already exists\n"
        + "* [svc:conflict] already exists\n\n", verbose);
    assertEquals(error.asGroup().getMessage(), verbose);
  }

  @Test
  void formatHonoursWidthAndPrecision() {
    Canonical shortError = Canonical.builder().namespace("a").code("b").message("c").build();

    assertEquals("     [a:b] c", String.format("%12s", shortError));
    assertEquals("[a:b] c     |", String.format("%-12s|", shortError));
    assertEquals("[a:b]", String.format("%.5s", shortError));
  }

  @Test
  void noStackTraceIsCaptured() {
    assertEquals(0, NOT_FOUND.wrap(new IOException("x")).getStackTrace().length);
  }
}
