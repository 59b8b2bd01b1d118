package com.ospicorp.sgs.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;

// Fields are null when neither the upstream nor the catalog knows them
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesMetadata(
    long seriesId,
    String name,
    String unit,
    String periodicity,
    String source,
    String start,
    String end
) {}
