package com.ospicorp.sgs.series.exception;

/**
 * Raised when the upstream reports an unknown series id, or when a name cannot be
 * resolved through the catalog.
 */
public class SeriesNotFoundException extends SgsException {
  private final Long seriesId;
  private final String name;

  private SeriesNotFoundException(String message, Long seriesId, String name) {
    super(message);
    this.seriesId = seriesId;
    this.name = name;
  }

  public static SeriesNotFoundException forId(long seriesId) {
    return new SeriesNotFoundException(
        "Series " + seriesId + " was not found upstream", seriesId, null);
  }

  public static SeriesNotFoundException forName(String name) {
    return new SeriesNotFoundException("Series '" + name + "' is not in the catalog. "
        + "Use listCatalog() to see the available series.", null, name);
  }

  /** Numeric id reported missing, or {@code null} for a failed name lookup. */
  public Long seriesId() {
    return seriesId;
  }

  public String name() {
    return name;
  }
}
