package io.flowtrace.query.core;

import static org.junit.jupiter.api.Assertions.*;

import io.flowtrace.parser.api.TraceEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RowSorterTest {

  private static TraceEvent event(String key, Object value, int id) {
    Map<String, Object> m = new HashMap<>();
    if (key != null) m.put(key, value);
    m.put("id", (long) id);
    return TraceEvent.of(m);
  }

  @Test
  void compareValuesHandlesNullsNumbersAndStrings() {
    assertEquals(0, RowSorter.compareValues(null, null));
    assertTrue(RowSorter.compareValues(null, 1L) < 0);
    assertTrue(RowSorter.compareValues(1L, null) > 0);
    assertTrue(RowSorter.compareValues(2L, 10.5) < 0);
    assertEquals(0, RowSorter.compareValues(3L, 3.0));
    assertTrue(RowSorter.compareValues("a", "b") < 0);
    assertTrue(RowSorter.compareValues(10L, "9") < 0);
    assertTrue(RowSorter.compareValues(true, 1L) > 0);
    assertTrue(RowSorter.compareValues(false, true) < 0);
    assertTrue(RowSorter.compareValues("a", true) > 0);
  }

  @Test
  void mixedNumbersAndTextFormATotalOrder() {
    // 9 < 10 numerically, while "5" sits between them as text
    assertTrue(RowSorter.compareValues(9L, 10L) < 0);
    assertTrue(RowSorter.compareValues(10L, "5") < 0);
    assertTrue(RowSorter.compareValues(9L, "5") < 0);
  }

  @Test
  void sortsLargeMixedColumnWithoutContractViolation() {
    for (long seed = 0; seed < 100; seed++) {
      Random random = new Random(seed);
      List<TraceEvent> events = new ArrayList<>();
      for (int i = 0; i < 300; i++) {
        Object v =
            random.nextBoolean()
                ? (Object) (long) random.nextInt(1000)
                : String.valueOf(random.nextInt(1000));
        events.add(event("v", v, i));
      }

      List<TraceEvent> desc = RowSorter.sortedByField(events, "v", false);
      List<TraceEvent> asc = RowSorter.sortedByField(events, "v", true);

      assertEquals(events.size(), asc.size());
      for (int i = 1; i < asc.size(); i++) {
        assertTrue(RowSorter.compareValues(asc.get(i - 1).get("v"), asc.get(i).get("v")) <= 0);
        assertTrue(RowSorter.compareValues(desc.get(i - 1).get("v"), desc.get(i).get("v")) >= 0);
      }
    }
  }

  @Test
  void sortsCopyStablyAscendingAndDescending() {
    TraceEvent a = event("d", 5L, 1);
    TraceEvent b = event("d", 1L, 2);
    TraceEvent c = event("d", 5L, 3);
    TraceEvent missing = event(null, null, 4);
    List<TraceEvent> input = Arrays.asList(a, b, c, missing);

    assertEquals(List.of(missing, b, a, c), RowSorter.sortedByField(input, "d", true));
    assertEquals(List.of(a, c, b, missing), RowSorter.sortedByField(input, "d", false));
    assertEquals(List.of(a, b, c, missing), input);
  }

  @Test
  void sortsByTimestampTreatingMissingAsZero() {
    TraceEvent late = event("ts", 20L, 1);
    TraceEvent none = event(null, null, 2);
    TraceEvent early = event("ts", "5", 3);
    assertEquals(
        List.of(none, early, late), RowSorter.sortedByTimestamp(List.of(late, none, early), "ts"));
  }

  @Test
  void projectsSelectedFields() {
    TraceEvent e = TraceEvent.of(Map.of("a", 1L, "b", Map.of("c", "x")));
    Map<String, Object> row = RowProjector.project(e, List.of("b.c", "a", "zzz"));
    assertEquals(List.of("b.c", "a", "zzz"), List.copyOf(row.keySet()));
    assertEquals("x", row.get("b.c"));
    assertEquals(1L, row.get("a"));
    assertNull(row.get("zzz"));
    assertEquals(e.asMap(), RowProjector.project(e, List.of()));
    assertEquals(e.asMap(), RowProjector.project(e, null));
  }
}
