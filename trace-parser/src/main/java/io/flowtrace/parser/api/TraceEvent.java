package io.flowtrace.parser.api;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One structured trace record. Field order follows the source record; the event and every nested
 * map or list it holds are unmodifiable.
 */
public final class TraceEvent {
  public static final String TIMESTAMP = "timestamp";
  public static final String KIND = "event";

  private static final Gson GSON = new GsonBuilder().serializeNulls().create();

  private final Map<String, Object> fields;

  private TraceEvent(Map<String, Object> fields) {
    this.fields = fields;
  }

  /** Creates an event from a field map; the map is deep-copied. */
  public static TraceEvent of(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    return new TraceEvent(freezeMap(fields));
  }

  /** Raw value at a dotted path, or {@code null} when any segment is missing. */
  public Object get(String path) {
    return Values.get(fields, path);
  }

  /** True when the dotted path resolves to a non-null value. */
  public boolean has(String path) {
    return get(path) != null;
  }

  public Optional<String> text(String path) {
    return Optional.ofNullable(Values.toText(get(path)));
  }

  public OptionalDouble number(String path) {
    double d = Values.toNumber(get(path));
    return Double.isNaN(d) ? OptionalDouble.empty() : OptionalDouble.of(d);
  }

  public Optional<Boolean> bool(String path) {
    return get(path) instanceof Boolean b ? Optional.of(b) : Optional.empty();
  }

  @SuppressWarnings("unchecked")
  public Optional<Map<String, Object>> map(String path) {
    Object value = get(path);
    return value instanceof Map<?, ?> m ? Optional.of((Map<String, Object>) m) : Optional.empty();
  }

  @SuppressWarnings("unchecked")
  public Optional<List<Object>> list(String path) {
    return get(path) instanceof List<?> l ? Optional.of((List<Object>) l) : Optional.empty();
  }

  /** Timestamp in epoch millis; absent or non-numeric timestamps read as 0. */
  public double timestampOrZero(String timestampField) {
    return number(timestampField).orElse(0);
  }

  public double timestampOrZero() {
    return timestampOrZero(TIMESTAMP);
  }

  /** Event kind discriminator such as ENTER, EXIT or EXCEPTION. */
  public Optional<String> kind() {
    return text(KIND);
  }

  /** Top-level field names in source order. */
  public Set<String> fieldNames() {
    return fields.keySet();
  }

  public int size() {
    return fields.size();
  }

  /** Unmodifiable view of the top-level fields. */
  public Map<String, Object> asMap() {
    return fields;
  }

  public String toJson() {
    return GSON.toJson(fields);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof TraceEvent other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return toJson();
  }

  private static Map<String, Object> freezeMap(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
    for (Map.Entry<?, ?> e : source.entrySet()) {
      copy.put(String.valueOf(e.getKey()), freeze(e.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> m) return freezeMap(m);
    if (value instanceof List<?> l) {
      List<Object> copy = new ArrayList<>(l.size());
      for (Object o : l) copy.add(freeze(o));
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
