package io.intellixity.strata.persistence.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Built-in column types.
 * <p>
 * Decoders are lenient about the driver representation: SQLite hands back integers for booleans
 * and epoch milliseconds for timestamps, Postgres hands back {@link java.sql.Timestamp}.
 */
public final class ColumnTypes {
  private static final ObjectMapper JSON = new ObjectMapper();

  // "2024-01-31 10:15:30", "2024-01-31 10:15:30.123", "2024-01-31T10:15:30"
  private static final DateTimeFormatter LOCAL_TS = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendLiteral('T').optionalEnd()
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .parseDefaulting(ChronoField.NANO_OF_SECOND, 0)
      .toFormatter();

  private ColumnTypes() {}

  public static ColumnType<String> string() {
    return of("string", String.class, raw -> {
      if (raw instanceof byte[] b) return new String(b, StandardCharsets.UTF_8);
      return String.valueOf(raw);
    });
  }

  public static ColumnType<Integer> integer() {
    return of("int", Integer.class, raw -> (raw instanceof Number n) ? n.intValue() : Integer.parseInt(String.valueOf(raw).trim()));
  }

  public static ColumnType<Long> longType() {
    return of("long", Long.class, raw -> (raw instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(raw).trim()));
  }

  public static ColumnType<Double> doubleType() {
    return of("double", Double.class, raw -> (raw instanceof Number n) ? n.doubleValue() : Double.parseDouble(String.valueOf(raw).trim()));
  }

  public static ColumnType<BigDecimal> decimal() {
    return of("decimal", BigDecimal.class, raw -> {
      if (raw instanceof BigDecimal d) return d;
      if (raw instanceof Long || raw instanceof Integer) return BigDecimal.valueOf(((Number) raw).longValue());
      return new BigDecimal(String.valueOf(raw).trim());
    });
  }

  public static ColumnType<Boolean> bool() {
    return of("bool", Boolean.class, raw -> {
      if (raw instanceof Boolean b) return b;
      if (raw instanceof Number n) return n.longValue() != 0;
      String s = String.valueOf(raw).trim();
      return s.equalsIgnoreCase("true") || s.equalsIgnoreCase("t") || s.equals("1");
    });
  }

  /** Stored as the canonical 36-character text form. */
  public static ColumnType<UUID> uuid() {
    return of("uuid", UUID.class, raw -> (raw instanceof UUID u) ? u : UUID.fromString(String.valueOf(raw).trim()),
        UUID::toString);
  }

  public static ColumnType<byte[]> bytes() {
    return of("bytes", byte[].class, raw -> {
      if (raw instanceof byte[] b) return b;
      return String.valueOf(raw).getBytes(StandardCharsets.UTF_8);
    });
  }

  /** Bound as an {@link Instant}; the JDBC layer turns it into a timestamp. */
  public static ColumnType<Instant> instant() {
    return of("instant", Instant.class, ColumnTypes::toInstant);
  }

  public static <E extends Enum<E>> ColumnType<E> enumType(Class<E> type) {
    Objects.requireNonNull(type, "type");
    return of("enum:" + type.getSimpleName(), type, raw -> Enum.valueOf(type, String.valueOf(raw).trim()), Enum::name);
  }

  /** Stored as a JSON document in a text column. */
  public static <V> ColumnType<V> json(Class<V> type) {
    Objects.requireNonNull(type, "type");
    return of("json:" + type.getSimpleName(), type, raw -> {
      String text = (raw instanceof byte[] b) ? new String(b, StandardCharsets.UTF_8) : String.valueOf(raw);
      try {
        return JSON.readValue(text, type);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Failed to decode JSON column as " + type.getName(), e);
      }
    }, value -> {
      try {
        return JSON.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Failed to JSON-encode " + value.getClass().getName(), e);
      }
    });
  }

  static Instant toInstant(Object raw) {
    if (raw instanceof Instant i) return i;
    if (raw instanceof java.sql.Timestamp ts) return ts.toInstant();
    if (raw instanceof java.util.Date d) return Instant.ofEpochMilli(d.getTime());
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof ZonedDateTime zdt) return zdt.toInstant();
    if (raw instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
    if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());

    String s = String.valueOf(raw).trim();
    if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) return Instant.ofEpochMilli(Long.parseLong(s));
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException notInstant) {
      try {
        return OffsetDateTime.parse(s).toInstant();
      } catch (DateTimeParseException notOffset) {
        return LocalDateTime.parse(s, LOCAL_TS).toInstant(ZoneOffset.UTC);
      }
    }
  }

  private static <V> ColumnType<V> of(String id, Class<V> javaType, Function<Object, V> decoder) {
    return new Simple<>(id, javaType, decoder, v -> v);
  }

  private static <V> ColumnType<V> of(String id, Class<V> javaType, Function<Object, V> decoder,
                                      Function<V, Object> encoder) {
    return new Simple<>(id, javaType, decoder, encoder);
  }

  private record Simple<V>(String id, Class<V> javaType, Function<Object, V> decoder,
                           Function<V, Object> encoder) implements ColumnType<V> {
    @Override public V decode(Object raw) { return raw == null ? null : decoder.apply(raw); }
    @Override public Object encode(V value) { return value == null ? null : encoder.apply(value); }
    @Override public String toString() { return id; }
  }
}
