package ca.gc.cra.errors.infrastructure.json;

import ca.gc.cra.errors.domain.Canonical;
import ca.gc.cra.errors.domain.Extras;
import ca.gc.cra.errors.domain.Flags;
import ca.gc.cra.errors.domain.Group;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Streams canonical errors and groups to and from their JSON wire shape.
 * <p><strong>Why:</strong> Services exchange classified failures with clients and other services; the field names
 * are a stable contract.</p>
 * <p><strong>Role:</strong> Infrastructure adapter over the domain types using the Jackson streaming API.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write {@code {"code","namespace","message","flags"?,"extras"?}}; the wrapped cause is never written.</li>
 *   <li>Write flags as a base-2 string and extras fields only when non-zero; {@code delay} is in nanoseconds.</li>
 *   <li>Write groups as {@code {"errors":[...]}}; formatters are behaviour and are not written.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}; safe to share.</p>
 * <p><strong>Performance:</strong> Single pass in both directions; no intermediate tree.</p>
 * <p><strong>Observability:</strong> No logs; malformed input raises {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class ErrorJsonCodec {
  static final String CODE = "code";
  static final String NAMESPACE = "namespace";
  static final String MESSAGE = "message";
  static final String FLAGS = "flags";
  static final String EXTRAS = "extras";
  static final String DELAY = "delay";
  static final String LINKS = "links";
  static final String STACK_TRACE = "stack_trace";
  static final String TAGS = "tags";
  static final String ERRORS = "errors";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Serialises a canonical error.
   *
   * @param error error to write; must not be {@code null}
   * @return JSON object text
   * @throws IllegalArgumentException when the delay is too long to express in nanoseconds
   */
  public String write(Canonical error) {
    Objects.requireNonNull(error, "error");
    StringWriter out = new StringWriter(128);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeCanonical(gen, error);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialise error " + error.key(), ex);
    }
    return out.toString();
  }

  /**
   * Serialises a group.
   *
   * @param group group to write; must not be {@code null}
   * @return JSON object text
   * @throws IllegalArgumentException when a member's delay is too long to express in nanoseconds
   */
  public String write(Group group) {
    Objects.requireNonNull(group, "group");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeArrayFieldStart(ERRORS);
      for (Canonical error : group) {
        writeCanonical(gen, error);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialise error group", ex);
    }
    return out.toString();
  }

  /**
   * Parses a canonical error; unknown fields are skipped.
   *
   * @param json JSON object text; must not be {@code null}
   * @return parsed error, without a wrapped cause
   * @throws IllegalArgumentException when the payload is malformed
   */
  public Canonical readCanonical(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      Canonical error = readCanonical(parser, parser.nextToken());
      requireEnd(parser);
      return error;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid error payload", ex);
    }
  }

  /**
   * Parses a group; unknown fields are skipped.
   *
   * @param json JSON object text; must not be {@code null}
   * @return new group using the default formatter
   * @throws IllegalArgumentException when the payload is malformed
   */
  public Group readGroup(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      List<Canonical> members = new ArrayList<>();
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if (ERRORS.equals(field) && value == JsonToken.START_ARRAY) {
          JsonToken token;
          while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            members.add(readCanonical(parser, token));
          }
        } else if (ERRORS.equals(field) && value != JsonToken.VALUE_NULL) {
          throw new IllegalArgumentException("errors must be an array");
        } else {
          parser.skipChildren();
        }
      }
      requireEnd(parser);
      return Group.of(members.toArray(new Throwable[0]));
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid error group payload", ex);
    }
  }

  private void writeCanonical(JsonGenerator gen, Canonical error) throws IOException {
    gen.writeStartObject();
    gen.writeStringField(CODE, error.code().value());
    gen.writeStringField(NAMESPACE, error.namespace().value());
    gen.writeStringField(MESSAGE, error.message());
    if (!error.flags().isEmpty()) {
      gen.writeStringField(FLAGS, error.flags().toString());
    }
    Extras extras = error.extras();
    if (!extras.isEmpty()) {
      gen.writeObjectFieldStart(EXTRAS);
      if (!extras.delay().isZero()) {
        gen.writeNumberField(DELAY, delayNanos(error));
      }
      writeStrings(gen, LINKS, extras.links());
      if (!extras.stackTrace().isEmpty()) {
        gen.writeStringField(STACK_TRACE, extras.stackTrace());
      }
      writeStrings(gen, TAGS, extras.tags());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static long delayNanos(Canonical error) {
    try {
      return error.extras().delay().toNanos();
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("delay of " + error.key() + " does not fit in nanoseconds", ex);
    }
  }

  private static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
    if (values.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  private Canonical readCanonical(JsonParser parser, JsonToken start) throws IOException {
    expect(start, JsonToken.START_OBJECT);
    Canonical.Builder builder = Canonical.builder();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case CODE -> builder.code(text(parser, value, field));
        case NAMESPACE -> builder.namespace(text(parser, value, field));
        case MESSAGE -> builder.message(text(parser, value, field));
        case FLAGS -> {
          String bits = text(parser, value, field);
          builder.flags(bits == null ? Flags.NONE : Flags.parse(bits));
        }
        case EXTRAS -> builder.extras(value == JsonToken.VALUE_NULL ? Extras.EMPTY : readExtras(parser, value));
        default -> parser.skipChildren();
      }
    }
    return builder.build();
  }

  private Extras readExtras(JsonParser parser, JsonToken start) throws IOException {
    expect(start, JsonToken.START_OBJECT);
    Extras extras = Extras.EMPTY;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case DELAY -> {
          if (value != JsonToken.VALUE_NUMBER_INT) {
            throw new IllegalArgumentException("delay must be an integer number of nanoseconds");
          }
          extras = extras.withDelay(Duration.ofNanos(parser.getLongValue()));
        }
        case LINKS -> extras = extras.withLinks(readStrings(parser, value, field));
        case STACK_TRACE -> extras = extras.withStackTrace(text(parser, value, field));
        case TAGS -> extras = extras.withTags(readStrings(parser, value, field));
        default -> parser.skipChildren();
      }
    }
    return extras;
  }

  private static String[] readStrings(JsonParser parser, JsonToken start, String field) throws IOException {
    if (start == JsonToken.VALUE_NULL) {
      return new String[0];
    }
    if (start != JsonToken.START_ARRAY) {
      throw new IllegalArgumentException(field + " must be an array of strings");
    }
    List<String> values = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token != JsonToken.VALUE_STRING) {
        throw new IllegalArgumentException(field + " must be an array of strings");
      }
      values.add(parser.getText());
    }
    return values.toArray(new String[0]);
  }

  private static String text(JsonParser parser, JsonToken token, String field) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token != JsonToken.VALUE_STRING) {
      throw new IllegalArgumentException(field + " must be a string but found " + token);
    }
    return parser.getText();
  }

  private static void expect(JsonToken actual, JsonToken expected) {
    if (actual != expected) {
      throw new IllegalArgumentException("Expected " + expected + " but found " + actual);
    }
  }

  private static void requireEnd(JsonParser parser) throws IOException {
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
  }
}
