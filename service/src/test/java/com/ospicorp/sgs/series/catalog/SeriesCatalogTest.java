package com.ospicorp.sgs.series.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.sgs.series.exception.InvalidParametersException;
import com.ospicorp.sgs.series.exception.SeriesNotFoundException;
import com.ospicorp.sgs.series.model.SeriesIdentity;
import com.ospicorp.sgs.series.model.SeriesRef;
import com.ospicorp.sgs.series.model.enums.Periodicity;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SeriesCatalogTest {

  private final SeriesCatalog catalog =
      SeriesCatalog.load(new ObjectMapper(), SeriesCatalog.DEFAULT_RESOURCE);

  @Test
  void aliasAndCanonicalNameResolveToSameId() {
    assertEquals(11L, catalog.resolve(SeriesRef.of("selic")));
    assertEquals(11L, catalog.resolve(SeriesRef.of("Selic diária")));
    assertEquals(11L, catalog.resolve(SeriesRef.of("SELIC_DIARIA")));
    assertEquals(433L, catalog.resolve(SeriesRef.of("ipca")));
  }

  @Test
  void numericIdPassesThroughEvenWhenUncataloged() {
    assertEquals(433L, catalog.resolve(SeriesRef.of(433)));
    assertEquals(99999L, catalog.resolve(SeriesRef.of(99999)));
  }

  @Test
  void unknownNameIsNotFound() {
    var ex = assertThrows(SeriesNotFoundException.class,
        () -> catalog.resolve(SeriesRef.of("unknown_series")));
    assertEquals("unknown_series", ex.name());
    assertNull(ex.seriesId());
  }

  @Test
  void identityRequiresACatalogEntry() {
    SeriesIdentity ipca = catalog.identity(SeriesRef.of("inflacao"));
    assertEquals(433L, ipca.numericId());
    assertEquals(Periodicity.MONTHLY, ipca.periodicity());

    var ex = assertThrows(SeriesNotFoundException.class, () -> catalog.identity(SeriesRef.of(99999)));
    assertEquals(99999L, ex.seriesId());
  }

  @Test
  void listIsSortedById() {
    List<SeriesIdentity> all = catalog.list();
    assertThat(all).hasSizeGreaterThanOrEqualTo(14);
    assertThat(all).extracting(SeriesIdentity::numericId).isSorted();
    assertThat(catalog.periodicityOf(27574)).contains(Periodicity.WEEKLY);
    assertThat(catalog.periodicityOf(99999)).isEmpty();
  }

  @Test
  void aliasPointingAtTwoSeriesIsRejected() {
    var a = new SeriesIdentity(1, "A", "a", Set.of("shared"), Periodicity.DAILY, "%");
    var b = new SeriesIdentity(2, "B", "b", Set.of("shared"), Periodicity.DAILY, "%");
    assertThrows(IllegalStateException.class, () -> new SeriesCatalog(List.of(a, b)));
  }

  @Test
  void duplicateIdIsRejected() {
    var a = new SeriesIdentity(7, "A", "a", Set.of(), Periodicity.DAILY, "%");
    var b = new SeriesIdentity(7, "B", "b", Set.of(), Periodicity.DAILY, "%");
    assertThrows(IllegalStateException.class, () -> new SeriesCatalog(List.of(a, b)));
  }

  @Test
  void nullReferenceIsInvalid() {
    var ex = assertThrows(InvalidParametersException.class, () -> catalog.resolve(null));
    assertEquals(InvalidParametersException.INVALID_REFERENCE, ex.errorCode());
    assertThrows(InvalidParametersException.class, () -> catalog.identity(null));
  }

  @Test
  void referenceVariantsAreClosed() {
    assertTrue(SeriesRef.class.isSealed());
    assertThat(SeriesRef.class.getPermittedSubclasses())
        .containsExactlyInAnyOrder(SeriesRef.NumericId.class, SeriesRef.Name.class);
  }

  @Test
  void referenceOfUnsupportedTypeIsInvalid() {
    assertEquals(SeriesRef.of(11), SeriesRef.from(11));
    assertEquals(SeriesRef.of("selic"), SeriesRef.from("selic"));
    var ex = assertThrows(InvalidParametersException.class, () -> SeriesRef.from(11.5));
    assertEquals(InvalidParametersException.INVALID_REFERENCE, ex.errorCode());
    assertThrows(InvalidParametersException.class, () -> SeriesRef.from(null));
  }
}
