package ca.gc.cra.errors.config;

import ca.gc.cra.errors.domain.Canonical;
import ca.gc.cra.errors.domain.Extras;
import ca.gc.cra.errors.domain.Flags;
import ca.gc.cra.errors.domain.Namespace;
import ca.gc.cra.errors.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads error kinds declared in a YAML catalogue.
 *
 * <pre>
 * namespace: billing
 * errors:
 *   upstream-timeout:
 *     message: ledger did not answer
 *     flags: [retryable, timeout]
 *     delay: PT2S
 *     links: [https://runbooks/ledger]
 *     tags: [ledger]
 * </pre>
 *
 * <p>{@code namespace} defaults to {@link Canonical#DEFAULT_NAMESPACE}. Every entry under {@code errors} may be
 * empty; {@code delay} is an ISO-8601 duration or a number of seconds, fractions allowed.</p>
 *
 * @since 0.1.0
 */
public final class TaxonomyLoader {
  private static final Logger log = LoggerFactory.getLogger(TaxonomyLoader.class);

  static final int MAX_IDENTIFIER_LENGTH = 128;
  private static final Set<String> ENTRY_KEYS =
      Set.of("message", "flags", "delay", "links", "tags", "stack_trace");

  private TaxonomyLoader() {}

  /**
   * Loads a catalogue from {@code path}.
   *
   * @param path location of the YAML catalogue
   * @return the catalogue, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Taxonomy> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      log.debug("Taxonomy catalogue {} not found", path);
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses a catalogue from an open reader.
   *
   * @param reader YAML source; not closed by this method
   * @param source label used in diagnostics
   * @return parsed catalogue
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Taxonomy parse(Reader reader, String source) {
    Objects.requireNonNull(reader, "reader");
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse taxonomy YAML at " + source, ex);
    }
    if (document == null) {
      return new Taxonomy(Namespace.of(Canonical.DEFAULT_NAMESPACE), Map.of());
    }
    Map<String, Object> root = asMap(document, "root");
    Object rawNamespace = root.get("namespace");
    Namespace namespace = Namespace.of(rawNamespace == null
        ? Canonical.DEFAULT_NAMESPACE
        : Strings.requireNamespace("namespace", rawNamespace.toString(), MAX_IDENTIFIER_LENGTH));

    Map<String, Canonical> kinds = new LinkedHashMap<>();
    Object errors = root.get("errors");
    if (errors != null) {
      for (Map.Entry<String, Object> entry : asMap(errors, "errors").entrySet()) {
        String code = Strings.requireCode("errors key", entry.getKey(), MAX_IDENTIFIER_LENGTH);
        kinds.put(code, toKind(namespace, code, entry.getValue()));
      }
    }
    log.debug("Loaded {} error kinds for namespace {} from {}", kinds.size(), namespace, source);
    return new Taxonomy(namespace, kinds);
  }

  private static Canonical toKind(Namespace namespace, String code, Object node) {
    Canonical.Builder builder = Canonical.builder().namespace(namespace).code(code);
    if (node == null) {
      return builder.build();
    }
    String context = "errors." + code;
    Map<String, Object> entry = asMap(node, context);
    for (String key : entry.keySet()) {
      if (!ENTRY_KEYS.contains(key)) {
        throw new IllegalArgumentException(context + " contains unsupported key " + key);
      }
    }
    Object message = entry.get("message");
    if (message != null) {
      builder.message(message.toString());
    }
    builder.flags(parseFlags(entry.get("flags"), context + ".flags"));

    Extras extras = Extras.EMPTY
        .withDelay(parseDelay(entry.get("delay"), context + ".delay"))
        .withLinks(asStrings(entry.get("links"), context + ".links"))
        .withTags(asStrings(entry.get("tags"), context + ".tags"));
    Object stackTrace = entry.get("stack_trace");
    if (stackTrace != null) {
      extras = extras.withStackTrace(stackTrace.toString());
    }
    return builder.extras(extras).build();
  }

  static Flags parseFlags(Object node, String context) {
    Flags flags = Flags.NONE;
    for (String name : asStrings(node, context)) {
      switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "unknown" -> flags = flags.set(Flags.UNKNOWN);
        case "retryable" -> flags = flags.set(Flags.RETRYABLE);
        case "timeout" -> flags = flags.set(Flags.TIMEOUT);
        default -> throw new IllegalArgumentException(context + " contains unknown flag " + name);
      }
    }
    return flags;
  }

  static Duration parseDelay(Object node, String context) {
    if (node == null) {
      return Duration.ZERO;
    }
    if (node instanceof Number number) {
      try {
        BigDecimal nanos = new BigDecimal(number.toString()).movePointRight(9).setScale(0, RoundingMode.HALF_UP);
        return Duration.ofNanos(nanos.longValueExact());
      } catch (NumberFormatException | ArithmeticException ex) {
        throw new IllegalArgumentException(
            context + " must be a finite number of seconds within range: " + node, ex);
      }
    }
    try {
      return Duration.parse(node.toString().trim());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(context + " must be an ISO-8601 duration: " + node, ex);
    }
  }

  private static String[] asStrings(Object node, String context) {
    if (node == null) {
      return new String[0];
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> values = new ArrayList<>(raw.size());
    for (Object item : raw) {
      if (item == null) {
        throw new IllegalArgumentException(context + " must not contain empty entries");
      }
      values.add(item.toString());
    }
    return values.toArray(new String[0]);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
