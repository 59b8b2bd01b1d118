package com.ospicorp.sgs.series.model;

import com.ospicorp.sgs.series.exception.InvalidParametersException;

/**
 * How a caller points at a series: either its numeric SGS id or a catalog name/alias.
 */
public sealed interface SeriesRef permits SeriesRef.NumericId, SeriesRef.Name {

  static SeriesRef of(long id) {
    return new NumericId(id);
  }

  static SeriesRef of(String name) {
    return new Name(name);
  }

  /**
   * Builds a reference from loosely typed input such as a decoded JSON field.
   */
  static SeriesRef from(Object raw) {
    if (raw instanceof SeriesRef ref) {
      return ref;
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      return new NumericId(((Number) raw).longValue());
    }
    if (raw instanceof String name) {
      return new Name(name);
    }
    String type = raw == null ? "null" : raw.getClass().getSimpleName();
    throw new InvalidParametersException(
        "Series reference must be an integer id or a catalog name, got " + type,
        InvalidParametersException.INVALID_REFERENCE);
  }

  record NumericId(long id) implements SeriesRef {
    @Override
    public String toString() {
      return Long.toString(id);
    }
  }

  record Name(String name) implements SeriesRef {
    public Name {
      if (name == null) {
        throw new InvalidParametersException("Series name must not be null",
            InvalidParametersException.INVALID_REFERENCE);
      }
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
