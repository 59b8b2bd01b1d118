package com.ospicorp.sgs.series.model;

import com.ospicorp.sgs.series.model.enums.Periodicity;
import java.util.Set;

public record SeriesIdentity(
    long numericId,
    String canonicalName,
    String description,
    Set<String> aliases,
    Periodicity periodicity,
    String unit
) {}
