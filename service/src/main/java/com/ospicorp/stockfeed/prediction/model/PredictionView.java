package com.ospicorp.stockfeed.prediction.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of a prediction as the frontend consumes it.
 *
 * <p>{@code MessageID} is a position in the response (1..N, newest first) assigned when the view
 * is built, which is what the frontend keys its list on. It is neither the stored prediction id
 * nor the Telegram message id, and it changes whenever predictions are added, so clients must not
 * use it to look a prediction up again.
 */
public record PredictionView(
    @Schema(description = "Response-local position, 1..N. Not a durable identifier.")
    @JsonProperty("MessageID") long number,
    @JsonProperty("StockID") long stockId,
    @JsonProperty("PredictionType") String predictionType,
    @JsonProperty("TargetPrice") BigDecimal targetPrice,
    @JsonProperty("TargetChangePercent") BigDecimal targetChangePercent,
    @JsonProperty("Period") String period,
    @JsonProperty("Recommendation") String recommendation,
    @JsonProperty("Direction") String direction,
    @JsonProperty("JustificationText") String justificationText,
    @JsonProperty("Message") String message,
    @Schema(description = "Seconds since the Unix epoch (UTC)")
    @JsonProperty("PredictedAt") Long predictedAt
) {

  public static List<PredictionView> number(List<Prediction> predictions) {
    List<PredictionView> views = new ArrayList<>(predictions.size());
    long counter = 1;
    for (Prediction p : predictions) {
      views.add(new PredictionView(
          counter++,
          p.stockId(),
          p.predictionType(),
          p.targetPrice(),
          p.targetChangePercent(),
          p.period(),
          p.recommendation(),
          p.direction(),
          p.justificationText(),
          p.messageText(),
          p.predictedAt() != null ? p.predictedAt().getEpochSecond() : null));
    }
    return views;
  }
}
