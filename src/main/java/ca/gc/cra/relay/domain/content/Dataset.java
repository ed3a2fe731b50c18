package ca.gc.cra.relay.domain.content;

import ca.gc.cra.relay.domain.error.DuplicateNameException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Named, unordered collection of {@link Datafile}s whose names are unique.
 *
 * @param id unique identifier
 * @param name dataset name
 * @param files member datafiles
 * @param tags validated tags
 * @since 0.1.0
 */
public record Dataset(String id, String name, Set<Datafile> files, Set<String> tags) {

  public Dataset {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    files = files == null ? Set.of() : Set.copyOf(files);
    Set<String> seen = new HashSet<>();
    for (Datafile file : files) {
      if (!seen.add(file.name())) {
        throw new DuplicateNameException(name, file.name());
      }
    }
    tags = Tags.validated(tags);
  }

  /**
   * Looks up a member datafile by name.
   *
   * @param fileName datafile name
   * @return the datafile when present
   */
  public Optional<Datafile> file(String fileName) {
    return files.stream().filter(f -> f.name().equals(fileName)).findFirst();
  }

  /**
   * Selects the member datafiles matching a filter.
   *
   * @param filter datafile predicate, usually a {@link DatafileFilter}
   * @return matching files, ordered by name
   */
  public List<Datafile> files(Predicate<Datafile> filter) {
    Objects.requireNonNull(filter, "filter");
    return files.stream()
        .filter(filter)
        .sorted(Comparator.comparing(Datafile::name))
        .toList();
  }

  /**
   * Selects the member datafiles satisfying every named filter, for example
   * {@code Map.of("name__ends_with", ".csv", "tags__subtags_contain", "turbine")}.
   *
   * @param filters {@code <attribute>__<action>} names mapped to values
   * @return matching files, ordered by name
   * @throws IllegalArgumentException when a filter name or value is invalid
   */
  public List<Datafile> files(Map<String, ?> filters) {
    return files(DatafileFilter.allOf(filters));
  }

  /**
   * Returns whether the dataset carries {@code tag} either whole or as a colon-separated sub-tag.
   *
   * @param tag tag or sub-tag
   * @return {@code true} on a match
   */
  public boolean hasTag(String tag) {
    return tags.contains(tag) || Tags.subtags(tags).contains(tag);
  }
}
