package ca.gc.cra.relay.domain.content;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Set of {@link Dataset}s keyed by a logical key such as {@code input} or {@code diagnostics}.
 *
 * @param id unique identifier
 * @param createdAt creation time
 * @param datasets datasets by logical key; iteration order is preserved
 * @since 0.1.0
 */
public record Manifest(String id, Instant createdAt, Map<String, Dataset> datasets) {

  public Manifest {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(datasets, "datasets");
    Map<String, Dataset> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Dataset> entry : datasets.entrySet()) {
      if (entry.getKey() == null || entry.getKey().isBlank()) {
        throw new IllegalArgumentException("Manifest dataset keys must not be blank");
      }
      copy.put(entry.getKey(), entry.getValue());
    }
    datasets = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the dataset registered under {@code key}.
   *
   * @param key logical dataset key
   * @return dataset when present
   */
  public Optional<Dataset> dataset(String key) {
    return Optional.ofNullable(datasets.get(key));
  }
}
