package ca.gc.cra.relay.domain.content;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DatafileFilterTest {
  private static final Instant MARCH = Instant.parse("2024-03-01T12:00:00Z");
  private static final Instant JUNE = Instant.parse("2024-06-01T12:00:00Z");

  private final Datafile windCsv = file("wind_speeds.CSV", 2_048, MARCH,
      Set.of("turbine:blade:3", "raw"), Map.of("sensor", "anemometer"));
  private final Datafile pressureJson = file("pressure.json", 64, JUNE,
      Set.of("mega-man:torso", "processed"), Map.of());
  private final Datafile notes = file("notes.txt", 512, JUNE, Set.of(), Map.of());
  private final Dataset dataset =
      new Dataset("d1", "readings", Set.of(windCsv, pressureJson, notes), Set.of("site:north-sea"));

  @Test
  void textActionsMatchFileNames() {
    assertEquals(List.of(windCsv), dataset.files(Map.of("name__icontains", "csv")));
    assertEquals(List.of(windCsv), dataset.files(Map.of("name__starts_with", "wind")));
    assertEquals(List.of(pressureJson), dataset.files(Map.of("name__ends_with", ".json")));
    assertEquals(List.of(notes, pressureJson), dataset.files(Map.of("name__not_contains", "_")));
    assertTrue(dataset.files(Map.of("name__contains", "csv")).isEmpty());
  }

  @Test
  void orderedActionsCompareSizesAndTimes() {
    assertEquals(List.of(pressureJson), dataset.files(Map.of("size_bytes__lt", 512)));
    assertEquals(List.of(notes, pressureJson), dataset.files(Map.of("size_bytes__lte", 512)));
    assertEquals(List.of(windCsv), dataset.files(Map.of("size_bytes__gte", 2_048L)));
    assertEquals(List.of(notes, pressureJson),
        dataset.files(Map.of("last_modified__gt", "2024-04-01T00:00:00Z")));
    assertEquals(List.of(windCsv), dataset.files(Map.of("last_modified__equals", MARCH)));
  }

  @Test
  void tagActionsSeeWholeTagsAnyTagPrefixesAndSubtags() {
    assertEquals(List.of(windCsv), dataset.files(Map.of("tags__contains", "raw")));
    assertTrue(dataset.files(Map.of("tags__contains", "blade")).isEmpty());
    assertEquals(List.of(windCsv), dataset.files(Map.of("tags__subtags_contain", "blade")));
    assertEquals(List.of(pressureJson), dataset.files(Map.of("tags__starts_with", "mega")));
    assertEquals(List.of(windCsv), dataset.files(Map.of("tags__ends_with", ":3")));
    assertEquals(List.of(pressureJson), dataset.files(Map.of("tags__any_tag_contains", "man:tor")));
  }

  @Test
  void filtersCombineAsConjunction() {
    Map<String, Object> filters = Map.of("size_bytes__gt", 32, "tags__not_contains", "raw");

    assertEquals(List.of(notes, pressureJson), dataset.files(filters));
    assertEquals(List.of(windCsv, notes, pressureJson), dataset.files(Map.of()));
  }

  @Test
  void metadataKeysCanBeRequired() {
    assertEquals(List.of(windCsv), dataset.files(Map.of("metadata__has_key", "sensor")));
  }

  @Test
  void datasetTagsMatchWholeOrBySubtag() {
    assertTrue(dataset.hasTag("site:north-sea"));
    assertTrue(dataset.hasTag("north-sea"));
    assertFalse(dataset.hasTag("north"));
  }

  @Test
  void malformedFiltersFailWhenBuilt() {
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("name", "x"));
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("name__", "x"));
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("colour__equals", "red"));
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("name__lt", "x"));
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("size_bytes__icontains", 3));
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("size_bytes__lt", "big"));
    assertThrows(IllegalArgumentException.class, () -> DatafileFilter.of("last_modified__lt", "yesterday"));
  }

  private static Datafile file(String name, long size, Instant modified, Set<String> tags, Map<String, String> metadata) {
    return new Datafile(name, name, URI.create("file:///data/" + name), size, "AAAAAA==", modified, metadata, tags);
  }
}
