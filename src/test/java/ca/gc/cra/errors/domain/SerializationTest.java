package ca.gc.cra.errors.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SerializationTest {
  private static final Canonical THROTTLED = Canonical.builder()
      .namespace("svc")
      .code("throttled")
      .message("slow down")
      .flags(Flags.RETRYABLE)
      .extras(Extras.EMPTY.withDelay(Duration.ofSeconds(3)).withTags("edge"))
      .build();

  @Test
  void canonicalSurvivesJavaSerialization() throws Exception {
    Canonical error = THROTTLED.wrap(new IOException("socket closed"));

    Canonical copy = (Canonical) roundTrip(error);

    assertTrue(copy.equal(error));
    assertEquals(error.getMessage(), copy.getMessage());
    assertSame(Flags.RETRYABLE, copy.flags());
    assertEquals(Duration.ofSeconds(3), copy.extras().delay());
    assertInstanceOf(IOException.class, copy.getCause());
  }

  @Test
  void groupRendersWithDefaultFormatterAfterDeserialization() throws Exception {
    Canonical other = Canonical.builder().namespace("svc").code("gone").message("removed").build();
    Group group = Group.withFormatter(members -> "custom", THROTTLED, other);

    Group copy = (Group) roundTrip(group);

    assertEquals(2, copy.size());
    assertTrue(copy.errors().get(0).equal(THROTTLED));
    assertEquals(GroupFormatter.DEFAULT.format(List.of(THROTTLED, other)), copy.getMessage());
  }

  private static Object roundTrip(Object value) throws IOException, ClassNotFoundException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(value);
    }
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      return in.readObject();
    }
  }
}
