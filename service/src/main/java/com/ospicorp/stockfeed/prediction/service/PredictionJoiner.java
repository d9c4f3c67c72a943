package com.ospicorp.stockfeed.prediction.service;

import com.ospicorp.stockfeed.error.SourceUnavailableException;
import com.ospicorp.stockfeed.prediction.model.Prediction;
import com.ospicorp.stockfeed.prediction.repository.PredictionDao;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class PredictionJoiner {

  static final Comparator<Prediction> NEWEST_FIRST = Comparator.comparing(Prediction::predictedAt,
      Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

  private final PredictionDao predictionDao;

  public PredictionJoiner(PredictionDao predictionDao) {
    this.predictionDao = predictionDao;
  }

  /**
   * Predictions for a resolved stock, newest first. Ties keep the order the store returned them
   * in. An empty list means the stock has no predictions.
   */
  public List<Prediction> listPredictions(long stockId) {
    List<Prediction> rows;
    try {
      rows = predictionDao.fetchByStockId(stockId);
    } catch (DataAccessException ex) {
      throw new SourceUnavailableException("listPredictions", null,
          "Error querying predictions for stock " + stockId + ": " + ex.getMessage(), ex);
    }
    List<Prediction> ordered = new ArrayList<>(rows);
    ordered.sort(NEWEST_FIRST);
    return ordered;
  }
}
