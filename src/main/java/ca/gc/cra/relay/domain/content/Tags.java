package ca.gc.cra.relay.domain.content;

import ca.gc.cra.relay.domain.error.InvalidTagException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Validates and normalizes tag sets attached to datafiles and datasets.
 * <p>A tag starts and ends with {@code [a-z0-9]} and may contain {@code :} sub-tag separators or
 * hyphens, for example {@code system:32} or {@code mega-man:torso:component:12}.</p>
 *
 * @since 0.1.0
 */
public final class Tags {
  private static final Pattern TAG_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9:\\-]*(?<![:-])$");

  private Tags() {}

  /**
   * Validates every tag and returns an immutable, sorted copy.
   *
   * @param tags candidate tags; {@code null} yields an empty set
   * @return immutable validated tag set
   * @throws InvalidTagException when a tag violates the grammar
   */
  public static Set<String> validated(Collection<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return Set.of();
    }
    TreeSet<String> sorted = new TreeSet<>();
    for (String tag : tags) {
      sorted.add(requireValid(tag));
    }
    return Set.copyOf(sorted);
  }

  /**
   * Validates a single tag.
   *
   * @param tag candidate tag
   * @return the tag unchanged
   * @throws InvalidTagException when the tag is null or violates the grammar
   */
  public static String requireValid(String tag) {
    if (tag == null || !TAG_PATTERN.matcher(tag).matches()) {
      throw new InvalidTagException(String.valueOf(tag));
    }
    return tag;
  }

  /**
   * Splits a tag into its colon-separated sub-tags ({@code a:b:c} yields {@code a}, {@code b}, {@code c}).
   *
   * @param tag validated tag
   * @return immutable set of sub-tags
   */
  public static Set<String> subtags(String tag) {
    return Set.copyOf(Arrays.asList(requireValid(tag).split(":")));
  }

  /**
   * Collects the sub-tags of every tag in a group.
   *
   * @param tags validated tags
   * @return immutable union of their sub-tags
   */
  public static Set<String> subtags(Collection<String> tags) {
    Set<String> all = new TreeSet<>();
    for (String tag : tags) {
      all.addAll(subtags(tag));
    }
    return Set.copyOf(all);
  }

  /** Returns whether any tag in the group starts with {@code prefix}. */
  public static boolean anyStartsWith(Collection<String> tags, String prefix) {
    return tags.stream().anyMatch(tag -> tag.startsWith(prefix));
  }

  /** Returns whether any tag in the group ends with {@code suffix}. */
  public static boolean anyEndsWith(Collection<String> tags, String suffix) {
    return tags.stream().anyMatch(tag -> tag.endsWith(suffix));
  }

  /** Returns whether any tag in the group contains {@code fragment}. */
  public static boolean anyContains(Collection<String> tags, String fragment) {
    return tags.stream().anyMatch(tag -> tag.contains(fragment));
  }
}
