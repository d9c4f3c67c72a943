package com.ospicorp.stockfeed.history.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.time.Instant;

@JsonPropertyOrder({"StockID", "Timestamp", "Price", "Volume"})
public record PricePoint(
    @JsonProperty("StockID") long stockId,
    @JsonProperty("Timestamp") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timestamp,
    @JsonProperty("Price") BigDecimal price,
    @JsonProperty("Volume") long volume
) {}
