package io.flowtrace.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

class ValuesTest {

  private static final Map<String, Object> ROOT =
      Map.of("a", Map.of("b", Map.of("c", 42L)), "s", "text", "list", List.of(1L, 2L));

  @Test
  void resolvesDottedPathsThroughNestedMaps() {
    assertEquals(42L, Values.get(ROOT, "a.b.c"));
    assertEquals(Map.of("c", 42L), Values.get(ROOT, "a.b"));
    assertEquals("text", Values.get(ROOT, "s"));
  }

  @Test
  void missingSegmentsResolveToNull() {
    assertNull(Values.get(ROOT, "a.x.c"));
    assertNull(Values.get(ROOT, "s.length"));
    assertNull(Values.get(ROOT, "list.0"));
    assertNull(Values.get(ROOT, ""));
    assertNull(Values.get(null, "a"));
  }

  @Test
  void rendersTextLikeTheSourceRecord() {
    assertEquals("100", Values.toText(100L));
    assertEquals("100", Values.toText(100.0));
    assertEquals("1.5", Values.toText(1.5));
    assertEquals("true", Values.toText(true));
    assertEquals("abc", Values.toText("abc"));
    assertNull(Values.toText(null));
    assertEquals("", Values.toTextOrEmpty(null));
    assertEquals("[1,2]", Values.toText(List.of(1L, 2L)));

    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("k", "v");
    nested.put("n", null);
    assertEquals("{\"k\":\"v\",\"n\":null}", Values.toText(nested));
  }

  @Test
  void coercesNumbersWithoutThrowing() {
    assertEquals(12.0, Values.toNumber(12L));
    assertEquals(12.5, Values.toNumber(" 12.5 "));
    assertEquals(-3e2, Values.toNumber("-3e2"));
    assertEquals(1.0, Values.toNumber(true));
    assertEquals(0.0, Values.toNumber(false));
    assertTrue(Double.isNaN(Values.toNumber(null)));
    assertTrue(Double.isNaN(Values.toNumber("")));
    assertTrue(Double.isNaN(Values.toNumber("12ms")));
    assertTrue(Double.isNaN(Values.toNumber("NaN")));
    assertTrue(Double.isNaN(Values.toNumber("0x1F")));
    assertTrue(Double.isNaN(Values.toNumber(Map.of())));
    assertTrue(Double.isNaN(Values.toNumber(List.of(1L))));
  }

  @Test
  void splitsPathsKeepingEmptySegments() {
    assertEquals(List.of("a", "b"), Arrays.asList(Values.splitPath("a.b")));
    assertEquals(List.of("a", ""), Arrays.asList(Values.splitPath("a.")));
  }

  @Property
  void numericTextRoundTripsThroughCoercion(@ForAll long value) {
    assertEquals((double) value, Values.toNumber(Long.toString(value)));
  }

  @Property
  void coercionNeverThrows(@ForAll String text) {
    assertDoesNotThrow(() -> Values.toNumber(text));
    assertDoesNotThrow(() -> Values.toText(text));
  }
}
