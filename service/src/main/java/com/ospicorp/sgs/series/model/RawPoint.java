package com.ospicorp.sgs.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of an upstream payload, kept exactly as published ({@code DD/MM/YYYY} date,
 * number as text).
 */
public record RawPoint(
    @JsonProperty("data") String date,
    @JsonProperty("valor") String value
) {}
