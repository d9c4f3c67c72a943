package com.ospicorp.stockfeed.history.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

// One validated line of a history file; the timestamp is still wall-clock time in the file's zone.
public record RawBar(LocalDateTime timestamp, BigDecimal price, long volume) {}
