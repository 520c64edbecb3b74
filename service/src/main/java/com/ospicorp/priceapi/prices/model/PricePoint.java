package com.ospicorp.priceapi.prices.model;

import java.time.Instant;

// One cell of a regular price grid, value in EUR/MWh as published upstream
public record PricePoint(Instant timestamp, double value) {}
