package ca.gc.cra.errors.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Callback used by {@link Group} to turn its members into text.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface GroupFormatter {

  /**
   * Default layout: empty for no members, the member text verbatim for one member, otherwise one
   * {@code "* "} bullet per member wrapped in blank lines.
   */
  GroupFormatter DEFAULT = errors -> {
    switch (errors.size()) {
      case 0:
        return "";
      case 1:
        return errors.get(0).getMessage();
      default:
        String points = errors.stream()
            .map(e -> "* " + e.getMessage())
            .collect(Collectors.joining("\n"));
        return "\n" + points + "\n\n";
    }
  };

  /**
   * Renders the members of a group.
   *
   * @param errors group members in order; never {@code null}
   * @return rendered text
   */
  String format(List<Canonical> errors);
}
