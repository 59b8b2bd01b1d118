package com.ospicorp.sgs.series.model;

import java.time.LocalDate;

// null value marks an observation the upstream published without a usable number
public record SeriesPoint(LocalDate date, Double value) {}
