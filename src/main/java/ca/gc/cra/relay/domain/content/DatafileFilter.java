package ca.gc.cra.relay.domain.content;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Predicate over {@link Datafile}s built from {@code <attribute>__<action>} filter names such as
 * {@code name__icontains} or {@code size_bytes__gte}.
 *
 * <p>Text attributes ({@code id}, {@code name}, {@code location}, {@code checksum}) accept
 * {@code equals}, {@code contains}, {@code not_contains}, {@code icontains}, {@code starts_with} and
 * {@code ends_with}. Ordered attributes ({@code size_bytes}, {@code last_modified}) accept
 * {@code equals}, {@code lt}, {@code lte}, {@code gt} and {@code gte}. The {@code tags} group
 * accepts exact {@code contains}/{@code not_contains}, the any-tag matches {@code starts_with},
 * {@code ends_with} and {@code any_tag_contains}, and {@code subtags_contain}, which matches a
 * single colon-separated component. {@code metadata} accepts {@code has_key}.</p>
 *
 * <p>Filter names are checked when the filter is built, so a misspelt attribute or action fails
 * before any file is tested.</p>
 *
 * @since 0.1.0
 */
public final class DatafileFilter implements Predicate<Datafile> {
  private static final Set<String> TEXT_ACTIONS =
      Set.of("equals", "contains", "not_contains", "icontains", "starts_with", "ends_with");
  private static final Set<String> ORDERED_ACTIONS = Set.of("equals", "lt", "lte", "gt", "gte");
  private static final Set<String> TAG_ACTIONS =
      Set.of("contains", "not_contains", "starts_with", "ends_with", "any_tag_contains", "subtags_contain");

  private final String filterName;
  private final Predicate<Datafile> predicate;

  private DatafileFilter(String filterName, Predicate<Datafile> predicate) {
    this.filterName = filterName;
    this.predicate = predicate;
  }

  /**
   * Builds a single filter.
   *
   * @param filterName {@code <attribute>__<action>}
   * @param value value compared against the attribute
   * @return filter
   * @throws IllegalArgumentException for an unknown attribute or action, or a value of the wrong type
   */
  public static DatafileFilter of(String filterName, Object value) {
    Objects.requireNonNull(filterName, "filterName");
    int split = filterName.indexOf("__");
    if (split <= 0 || split + 2 >= filterName.length()) {
      throw new IllegalArgumentException("Invalid filter name '" + filterName
          + "': expected <attribute>__<action>");
    }
    String attribute = filterName.substring(0, split);
    String action = filterName.substring(split + 2);
    return new DatafileFilter(filterName, build(attribute, action, value));
  }

  /**
   * Builds the conjunction of several filters; an empty map matches every file.
   *
   * @param filters filter names mapped to their values
   * @return filter matching files that satisfy all of them
   */
  public static DatafileFilter allOf(Map<String, ?> filters) {
    Predicate<Datafile> combined = file -> true;
    for (Map.Entry<String, ?> entry : filters.entrySet()) {
      combined = combined.and(of(entry.getKey(), entry.getValue()));
    }
    return new DatafileFilter(String.join(",", filters.keySet()), combined);
  }

  @Override
  public boolean test(Datafile file) {
    return predicate.test(file);
  }

  @Override
  public String toString() {
    return "DatafileFilter[" + filterName + "]";
  }

  private static Predicate<Datafile> build(String attribute, String action, Object value) {
    switch (attribute) {
      case "id":
        return text(action, value, Datafile::id);
      case "name":
        return text(action, value, Datafile::name);
      case "location":
        return text(action, value, file -> file.location().toString());
      case "checksum":
        return text(action, value, Datafile::checksum);
      case "size_bytes":
        return ordered(action, requireNumber(attribute, value), file -> file.sizeBytes());
      case "last_modified":
        return ordered(action, requireInstant(value), file -> file.lastModified());
      case "tags":
        return tags(action, value);
      case "metadata":
        if (!"has_key".equals(action)) {
          throw unknownAction(attribute, action, Set.of("has_key"));
        }
        String key = requireString(attribute, value);
        return file -> file.metadata().containsKey(key);
      default:
        throw new IllegalArgumentException("Datafiles cannot be filtered by '" + attribute + "'");
    }
  }

  private static Predicate<Datafile> text(
      String action, Object value, Function<Datafile, String> attribute) {
    if (!TEXT_ACTIONS.contains(action)) {
      throw unknownAction("text", action, TEXT_ACTIONS);
    }
    String expected = requireString(action, value);
    switch (action) {
      case "equals":
        return file -> attribute.apply(file).equals(expected);
      case "contains":
        return file -> attribute.apply(file).contains(expected);
      case "not_contains":
        return file -> !attribute.apply(file).contains(expected);
      case "icontains":
        String lower = expected.toLowerCase(Locale.ROOT);
        return file -> attribute.apply(file).toLowerCase(Locale.ROOT).contains(lower);
      case "starts_with":
        return file -> attribute.apply(file).startsWith(expected);
      default:
        return file -> attribute.apply(file).endsWith(expected);
    }
  }

  private static <T extends Comparable<T>> Predicate<Datafile> ordered(
      String action, T bound, Function<Datafile, T> attribute) {
    if (!ORDERED_ACTIONS.contains(action)) {
      throw unknownAction("ordered", action, ORDERED_ACTIONS);
    }
    switch (action) {
      case "equals":
        return file -> attribute.apply(file).compareTo(bound) == 0;
      case "lt":
        return file -> attribute.apply(file).compareTo(bound) < 0;
      case "lte":
        return file -> attribute.apply(file).compareTo(bound) <= 0;
      case "gt":
        return file -> attribute.apply(file).compareTo(bound) > 0;
      default:
        return file -> attribute.apply(file).compareTo(bound) >= 0;
    }
  }

  private static Predicate<Datafile> tags(String action, Object value) {
    if (!TAG_ACTIONS.contains(action)) {
      throw unknownAction("tags", action, TAG_ACTIONS);
    }
    String expected = requireString(action, value);
    switch (action) {
      case "contains":
        return file -> file.tags().contains(expected);
      case "not_contains":
        return file -> !file.tags().contains(expected);
      case "starts_with":
        return file -> Tags.anyStartsWith(file.tags(), expected);
      case "ends_with":
        return file -> Tags.anyEndsWith(file.tags(), expected);
      case "any_tag_contains":
        return file -> Tags.anyContains(file.tags(), expected);
      default:
        return file -> Tags.subtags(file.tags()).contains(expected);
    }
  }

  private static Long requireNumber(String attribute, Object value) {
    if (!(value instanceof Number number)) {
      throw new IllegalArgumentException(attribute + " filters need a number, got " + describe(value));
    }
    return number.longValue();
  }

  private static Instant requireInstant(Object value) {
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof String text) {
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("last_modified filters need an ISO-8601 instant, got '" + text + "'", ex);
      }
    }
    throw new IllegalArgumentException("last_modified filters need an instant, got " + describe(value));
  }

  private static String requireString(String context, Object value) {
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException(context + " filters need a string, got " + describe(value));
    }
    return text;
  }

  private static IllegalArgumentException unknownAction(String kind, String action, Collection<String> options) {
    return new IllegalArgumentException("There is no '" + action + "' filter for " + kind
        + " attributes; options are " + List.copyOf(new TreeSet<>(options)));
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
