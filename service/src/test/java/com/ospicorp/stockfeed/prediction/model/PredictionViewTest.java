package com.ospicorp.stockfeed.prediction.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PredictionViewTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void numbersPredictionsFromOneInGivenOrder() {
    List<PredictionView> views = PredictionView.number(List.of(
        prediction(40, Instant.parse("2024-03-02T10:00:00Z")),
        prediction(12, Instant.parse("2024-03-01T10:00:00Z"))));

    assertThat(views).extracting(PredictionView::number).containsExactly(1L, 2L);
    assertThat(views.get(0).predictedAt()).isEqualTo(1709373600L);
  }

  @Test
  void counterIsUniqueEvenWhenPredictionsShareAMessage() {
    Prediction orphan = new Prediction(3, 1, null, "price", null, null, null, null, null, null,
        null, Instant.parse("2024-03-01T00:00:00Z"));

    List<PredictionView> views = PredictionView.number(List.of(
        prediction(40, Instant.parse("2024-03-03T10:00:00Z")),
        prediction(41, Instant.parse("2024-03-02T10:00:00Z")),
        orphan));

    assertThat(views).extracting(PredictionView::number).containsExactly(1L, 2L, 3L);
  }

  @Test
  void emptyListStaysEmpty() {
    assertThat(PredictionView.number(List.of())).isEmpty();
  }

  @Test
  void serializesWithFrontendFieldNames() throws Exception {
    PredictionView view = PredictionView.number(
        List.of(prediction(40, Instant.parse("2024-03-02T10:00:00Z")))).get(0);

    JsonNode json = mapper.valueToTree(view);

    assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder(
        "MessageID", "StockID", "PredictionType", "TargetPrice", "TargetChangePercent", "Period",
        "Recommendation", "Direction", "JustificationText", "Message", "PredictedAt");
    assertThat(json.get("MessageID").asLong()).isEqualTo(1L);
    assertThat(json.get("Message").asText()).isEqualTo("AAA to 120 within a quarter");
    assertThat(json.get("TargetPrice").decimalValue()).isEqualByComparingTo("120.5");
  }

  @Test
  void missingMessageSerializesAsNull() {
    Prediction orphan = new Prediction(3, 1, null, "price", null, null, null, null, null, null,
        null, Instant.EPOCH);

    JsonNode json = mapper.valueToTree(PredictionView.number(List.of(orphan)).get(0));

    assertThat(json.get("Message").isNull()).isTrue();
    assertThat(json.get("PredictedAt").asLong()).isZero();
  }

  static Prediction prediction(long id, Instant predictedAt) {
    return new Prediction(id, 1, 500L, "price", new BigDecimal("120.5"), new BigDecimal("4.2"),
        "3m", "buy", "up", "strong quarter", "AAA to 120 within a quarter", predictedAt);
  }
}
