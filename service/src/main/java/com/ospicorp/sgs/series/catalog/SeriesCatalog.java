package com.ospicorp.sgs.series.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.sgs.series.exception.InvalidParametersException;
import com.ospicorp.sgs.series.exception.SeriesNotFoundException;
import com.ospicorp.sgs.series.model.SeriesIdentity;
import com.ospicorp.sgs.series.model.SeriesRef;
import com.ospicorp.sgs.series.model.enums.Periodicity;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

/**
 * Read-only registry of well-known SGS series, with a case-insensitive index over
 * canonical names and aliases.
 */
public final class SeriesCatalog {
  private static final Logger log = LoggerFactory.getLogger(SeriesCatalog.class);
  public static final String DEFAULT_RESOURCE = "catalog/sgs-catalog.json";

  private final Map<Long, SeriesIdentity> byId;
  private final Map<String, Long> byName;

  public SeriesCatalog(List<SeriesIdentity> entries) {
    Map<Long, SeriesIdentity> ids = new TreeMap<>();
    Map<String, Long> names = new HashMap<>();
    for (SeriesIdentity entry : entries) {
      if (ids.putIfAbsent(entry.numericId(), entry) != null) {
        throw new IllegalStateException("Duplicate catalog id " + entry.numericId());
      }
      index(names, entry.canonicalName(), entry.numericId());
      for (String alias : entry.aliases()) {
        index(names, alias, entry.numericId());
      }
    }
    this.byId = Collections.unmodifiableMap(ids);
    this.byName = Collections.unmodifiableMap(names);
  }

  public static SeriesCatalog load(ObjectMapper mapper, String resource) {
    try (InputStream in = new ClassPathResource(resource).getInputStream()) {
      List<CatalogEntry> raw = mapper.readValue(in, new TypeReference<List<CatalogEntry>>() {});
      List<SeriesIdentity> entries = new ArrayList<>(raw.size());
      for (CatalogEntry e : raw) {
        entries.add(new SeriesIdentity(e.id(), e.name(), e.description(),
            Collections.unmodifiableSet(new LinkedHashSet<>(e.aliases())),
            e.periodicity(), e.unit()));
      }
      SeriesCatalog catalog = new SeriesCatalog(entries);
      log.info("Loaded {} catalog series from {}", entries.size(), resource);
      return catalog;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read series catalog " + resource, e);
    }
  }

  /**
   * Maps a reference to its numeric id. Numeric ids pass through without an existence check.
   */
  public long resolve(SeriesRef ref) {
    if (ref == null) {
      throw new InvalidParametersException("Series reference must not be null",
          InvalidParametersException.INVALID_REFERENCE);
    }
    if (ref instanceof SeriesRef.NumericId numeric) {
      return numeric.id();
    }
    String name = ((SeriesRef.Name) ref).name();
    return lookup(name)
        .map(SeriesIdentity::numericId)
        .orElseThrow(() -> SeriesNotFoundException.forName(name));
  }

  public SeriesIdentity identity(SeriesRef ref) {
    long id = resolve(ref);
    return find(id).orElseThrow(() -> SeriesNotFoundException.forId(id));
  }

  public Optional<SeriesIdentity> find(long id) {
    return Optional.ofNullable(byId.get(id));
  }

  public Optional<SeriesIdentity> lookup(String name) {
    Long id = byName.get(name.toLowerCase(Locale.ROOT));
    return id == null ? Optional.empty() : Optional.of(byId.get(id));
  }

  public Optional<Periodicity> periodicityOf(long id) {
    return find(id).map(SeriesIdentity::periodicity);
  }

  /** All entries, ascending by numeric id. */
  public List<SeriesIdentity> list() {
    List<SeriesIdentity> all = new ArrayList<>(byId.values());
    all.sort(Comparator.comparingLong(SeriesIdentity::numericId));
    return all;
  }

  private static void index(Map<String, Long> names, String key, long id) {
    Long previous = names.put(key.toLowerCase(Locale.ROOT), id);
    if (previous != null && previous != id) {
      throw new IllegalStateException(
          "Catalog name '" + key + "' maps to both " + previous + " and " + id);
    }
  }

  record CatalogEntry(
      @JsonProperty("id") long id,
      @JsonProperty("name") String name,
      @JsonProperty("description") String description,
      @JsonProperty("periodicity") Periodicity periodicity,
      @JsonProperty("unit") String unit,
      @JsonProperty("aliases") Set<String> aliases
  ) {}
}
