package com.ospicorp.stockfeed.prediction.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A stored prediction joined with the text of the message it was extracted from. Every field
 * except the ids and {@code predictedAt} may be null.
 */
public record Prediction(
    long id,
    long stockId,
    Long messageId,
    String predictionType,
    BigDecimal targetPrice,
    BigDecimal targetChangePercent,
    String period,
    String recommendation,
    String direction,
    String justificationText,
    String messageText,
    Instant predictedAt
) {}
