package com.ospicorp.stockfeed.aggregate;

import com.ospicorp.stockfeed.error.SourceUnavailableException;
import com.ospicorp.stockfeed.history.model.PricePoint;
import com.ospicorp.stockfeed.history.model.RawBar;
import com.ospicorp.stockfeed.history.service.PriceHistoryNormalizer;
import com.ospicorp.stockfeed.history.service.PriceHistoryParser;
import com.ospicorp.stockfeed.prediction.model.Prediction;
import com.ospicorp.stockfeed.prediction.service.PredictionJoiner;
import com.ospicorp.stockfeed.stock.model.Stock;
import com.ospicorp.stockfeed.stock.service.StockIdResolver;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the read endpoints. Each call is independent and has no side effects; failures
 * surface as {@link com.ospicorp.stockfeed.error.StockDataNotFoundException} or
 * {@link SourceUnavailableException}.
 */
@Service
public class StockDataFacade {
  private static final Logger log = LoggerFactory.getLogger(StockDataFacade.class);

  private final StockIdResolver resolver;
  private final PredictionJoiner predictionJoiner;
  private final PriceHistoryParser historyParser;
  private final PriceHistoryNormalizer historyNormalizer;

  public StockDataFacade(StockIdResolver resolver, PredictionJoiner predictionJoiner,
      PriceHistoryParser historyParser, PriceHistoryNormalizer historyNormalizer) {
    this.resolver = resolver;
    this.predictionJoiner = predictionJoiner;
    this.historyParser = historyParser;
    this.historyNormalizer = historyNormalizer;
  }

  public List<Stock> listStocks() {
    List<Stock> stocks = resolver.listStocks();
    log.info("Returning {} stocks", stocks.size());
    return stocks;
  }

  public List<Prediction> getPredictions(String ticker) {
    long stockId = resolver.resolve(ticker);
    List<Prediction> predictions;
    try {
      predictions = predictionJoiner.listPredictions(stockId);
    } catch (SourceUnavailableException ex) {
      throw new SourceUnavailableException(ex.operation(), ticker, ex.getMessage(), ex.getCause());
    }
    log.info("Found {} predictions for ticker '{}'", predictions.size(), ticker);
    return predictions;
  }

  public List<PricePoint> getHistory(String ticker) {
    long stockId = resolver.resolve(ticker);
    List<RawBar> bars = historyParser.parse(ticker);
    List<PricePoint> points = historyNormalizer.normalize(stockId, bars);
    log.info("Found {} price history points for ticker '{}'", points.size(), ticker);
    return points;
  }
}
