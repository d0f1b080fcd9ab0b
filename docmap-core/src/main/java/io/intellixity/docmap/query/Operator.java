package io.intellixity.docmap.query;

import java.util.Locale;

/** Comparison operators understood by document stores, with their wire symbols. */
public enum Operator {
  EQ("=="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),

  IN("in"),
  NOT_IN("not-in"),

  /** Array field contains the value. */
  ARRAY_CONTAINS("array-contains"),
  /** Array field contains at least one of the values. */
  ARRAY_CONTAINS_ANY("array-contains-any");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** True for operators whose value is a collection of candidates. */
  public boolean takesList() {
    return this == IN || this == NOT_IN || this == ARRAY_CONTAINS_ANY;
  }

  /** Parses a symbol ({@code ">="}) or an enum name ({@code "GE"}, case-insensitive). */
  public static Operator parse(String raw) {
    if (raw == null || raw.isBlank()) throw new IllegalArgumentException("operator is required");
    String s = raw.trim();
    for (Operator op : values()) {
      if (op.symbol.equals(s)) return op;
    }
    if ("=".equals(s)) return EQ;
    try {
      return Operator.valueOf(s.toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown operator: " + raw, e);
    }
  }
}
