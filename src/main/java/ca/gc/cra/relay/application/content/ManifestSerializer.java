package ca.gc.cra.relay.application.content;

import ca.gc.cra.relay.domain.content.Datafile;
import ca.gc.cra.relay.domain.content.Dataset;
import ca.gc.cra.relay.domain.content.Manifest;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts manifests to and from a transport-safe structure of maps, lists, and strings.
 *
 * <p>Only absolute URIs cross the bus: a relative location is rejected in both directions so
 * local paths never leak between services. Field names use the wire's snake_case.</p>
 *
 * @since 0.1.0
 */
public final class ManifestSerializer {

  private ManifestSerializer() {}

  /**
   * Serializes a manifest.
   *
   * @param manifest manifest to serialize
   * @return JSON-compatible map
   */
  public static Map<String, Object> serialize(Manifest manifest) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", manifest.id());
    out.put("created_at", manifest.createdAt().toString());
    Map<String, Object> datasets = new LinkedHashMap<>();
    for (Map.Entry<String, Dataset> entry : manifest.datasets().entrySet()) {
      datasets.put(entry.getKey(), entry.getValue() == null ? null : serializeDataset(entry.getValue()));
    }
    out.put("datasets", datasets);
    return out;
  }

  /**
   * Serializes a dataset.
   *
   * @param dataset dataset to serialize
   * @return JSON-compatible map
   */
  public static Map<String, Object> serializeDataset(Dataset dataset) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", dataset.id());
    out.put("name", dataset.name());
    List<Map<String, Object>> files = new ArrayList<>();
    dataset.files().stream()
        .sorted(Comparator.comparing(Datafile::name))
        .forEach(file -> files.add(serializeDatafile(file)));
    out.put("files", files);
    out.put("tags", sorted(dataset.tags()));
    return out;
  }

  /**
   * Serializes a datafile.
   *
   * @param datafile datafile to serialize
   * @return JSON-compatible map
   */
  public static Map<String, Object> serializeDatafile(Datafile datafile) {
    if (!datafile.location().isAbsolute()) {
      throw new IllegalArgumentException("Refusing to serialize relative location " + datafile.location());
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", datafile.id());
    out.put("name", datafile.name());
    out.put("location", datafile.location().toString());
    out.put("size_bytes", datafile.sizeBytes());
    out.put("checksum", datafile.checksum());
    out.put("last_modified", datafile.lastModified().toString());
    out.put("metadata", new LinkedHashMap<>(datafile.metadata()));
    out.put("tags", sorted(datafile.tags()));
    return out;
  }

  /**
   * Deserializes a manifest.
   *
   * @param raw structure produced by {@link #serialize(Manifest)}
   * @return manifest
   * @throws IllegalArgumentException when fields are missing, ill-typed, or a location is relative
   */
  public static Manifest deserialize(Object raw) {
    Map<String, Object> map = asMap(raw, "manifest");
    Map<String, Object> rawDatasets = asMap(require(map, "datasets", "manifest"), "manifest.datasets");
    Map<String, Dataset> datasets = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : rawDatasets.entrySet()) {
      Object value = entry.getValue();
      datasets.put(entry.getKey(), value == null ? null : deserializeDataset(value));
    }
    return new Manifest(
        string(map, "id", "manifest"),
        instant(map, "created_at", "manifest"),
        datasets);
  }

  /**
   * Deserializes a dataset.
   *
   * @param raw structure produced by {@link #serializeDataset(Dataset)}
   * @return dataset
   */
  public static Dataset deserializeDataset(Object raw) {
    Map<String, Object> map = asMap(raw, "dataset");
    Object files = require(map, "files", "dataset");
    if (!(files instanceof Collection<?> fileList)) {
      throw new IllegalArgumentException("dataset.files must be a list");
    }
    Set<Datafile> datafiles = new HashSet<>();
    for (Object file : fileList) {
      datafiles.add(deserializeDatafile(file));
    }
    return new Dataset(string(map, "id", "dataset"), string(map, "name", "dataset"), datafiles,
        stringSet(map.get("tags"), "dataset.tags"));
  }

  /**
   * Deserializes a datafile.
   *
   * @param raw structure produced by {@link #serializeDatafile(Datafile)}
   * @return datafile
   */
  public static Datafile deserializeDatafile(Object raw) {
    Map<String, Object> map = asMap(raw, "datafile");
    URI location;
    try {
      location = new URI(string(map, "location", "datafile"));
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("datafile.location is not a valid URI", ex);
    }
    if (!location.isAbsolute()) {
      throw new IllegalArgumentException("datafile.location must be an absolute URI: " + location);
    }
    Object size = require(map, "size_bytes", "datafile");
    if (!(size instanceof Number number)) {
      throw new IllegalArgumentException("datafile.size_bytes must be a number");
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    Object rawMetadata = map.get("metadata");
    if (rawMetadata != null) {
      for (Map.Entry<String, Object> entry : asMap(rawMetadata, "datafile.metadata").entrySet()) {
        metadata.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
      }
    }
    return new Datafile(
        string(map, "id", "datafile"),
        string(map, "name", "datafile"),
        location,
        number.longValue(),
        string(map, "checksum", "datafile"),
        instant(map, "last_modified", "datafile"),
        metadata,
        stringSet(map.get("tags"), "datafile.tags"));
  }

  private static List<String> sorted(Set<String> values) {
    List<String> list = new ArrayList<>(values);
    list.sort(Comparator.naturalOrder());
    return list;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object raw, String context) {
    if (!(raw instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(context + " must be an object");
    }
    for (Object key : map.keySet()) {
      if (!(key instanceof String)) {
        throw new IllegalArgumentException(context + " contains a non-string key");
      }
    }
    return (Map<String, Object>) map;
  }

  private static Object require(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException(context + "." + key + " is required");
    }
    return value;
  }

  private static String string(Map<String, Object> map, String key, String context) {
    Object value = require(map, key, context);
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException(context + "." + key + " must be a string");
    }
    return text;
  }

  private static Instant instant(Map<String, Object> map, String key, String context) {
    try {
      return Instant.parse(string(map, key, context));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(context + "." + key + " must be an ISO-8601 instant", ex);
    }
  }

  private static Set<String> stringSet(Object raw, String context) {
    if (raw == null) {
      return Set.of();
    }
    if (!(raw instanceof Collection<?> values)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    Set<String> out = new HashSet<>();
    for (Object value : values) {
      if (!(value instanceof String text)) {
        throw new IllegalArgumentException(context + " must contain strings");
      }
      out.add(text);
    }
    return out;
  }
}
