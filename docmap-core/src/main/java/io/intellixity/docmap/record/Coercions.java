package io.intellixity.docmap.record;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/** Converts values read from a store into the Java type a record field declares. */
public final class Coercions {
  private Coercions() {}

  /**
   * Coerce {@code raw} to {@code target}.
   *
   * @throws IllegalArgumentException if no conversion exists
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static Object coerce(Object raw, Class<?> target) {
    if (raw == null) return null;
    Class<?> boxed = box(target);
    if (boxed.isInstance(raw)) return raw;

    if (raw instanceof Number n && Number.class.isAssignableFrom(boxed)) return number(n, boxed);
    if (boxed == String.class) {
      if (raw instanceof CharSequence cs) return cs.toString();
      if (raw instanceof Enum<?> e) return e.name();
    }
    if (boxed.isEnum() && raw instanceof CharSequence cs) {
      return Enum.valueOf((Class<? extends Enum>) boxed, cs.toString());
    }
    if (boxed == Instant.class) {
      if (raw instanceof Date d) return d.toInstant();
      if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
      if (raw instanceof CharSequence cs) return Instant.parse(cs);
    }
    if (boxed == Date.class && raw instanceof Instant i) return Date.from(i);
    if (raw instanceof Collection<?> c) {
      if (boxed.isAssignableFrom(ArrayList.class)) return new ArrayList<>(c);
      if (boxed.isAssignableFrom(LinkedHashSet.class)) return new LinkedHashSet<>(c);
    }
    if (raw instanceof Map<?, ?> m && boxed.isAssignableFrom(LinkedHashMap.class)) return new LinkedHashMap<>(m);

    throw new IllegalArgumentException("cannot convert " + raw.getClass().getName() + " to " + target.getName());
  }

  /** Integer targets reject overflow and fractions; floating targets reject overflow to infinity. */
  private static Object number(Number n, Class<?> boxed) {
    if (boxed == Number.class) return n;
    if (boxed == Double.class) return n.doubleValue();
    if (boxed == Float.class) {
      float f = n.floatValue();
      if (Float.isInfinite(f) && !Double.isInfinite(n.doubleValue())) {
        throw new IllegalArgumentException("value " + n + " is out of range for float");
      }
      return f;
    }
    BigDecimal d = decimal(n);
    try {
      if (boxed == Integer.class) return d.intValueExact();
      if (boxed == Long.class) return d.longValueExact();
      if (boxed == Short.class) return d.shortValueExact();
      if (boxed == Byte.class) return d.byteValueExact();
      if (boxed == BigInteger.class) return d.toBigIntegerExact();
      if (boxed == BigDecimal.class) return d;
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("value " + n + " does not fit " + boxed.getSimpleName(), e);
    }
    throw new IllegalArgumentException("unsupported numeric type " + boxed.getName());
  }

  private static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal b) return b;
    if (n instanceof BigInteger i) return new BigDecimal(i);
    if (n instanceof Double || n instanceof Float) {
      double v = n.doubleValue();
      if (Double.isNaN(v) || Double.isInfinite(v)) throw new IllegalArgumentException("value " + n + " is not a finite number");
    }
    return new BigDecimal(n.toString());
  }

  static Class<?> box(Class<?> t) {
    if (!t.isPrimitive()) return t;
    if (t == int.class) return Integer.class;
    if (t == long.class) return Long.class;
    if (t == double.class) return Double.class;
    if (t == float.class) return Float.class;
    if (t == boolean.class) return Boolean.class;
    if (t == short.class) return Short.class;
    if (t == byte.class) return Byte.class;
    if (t == char.class) return Character.class;
    return t;
  }
}
