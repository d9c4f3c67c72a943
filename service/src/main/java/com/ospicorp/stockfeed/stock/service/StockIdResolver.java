package com.ospicorp.stockfeed.stock.service;

import com.ospicorp.stockfeed.error.SourceUnavailableException;
import com.ospicorp.stockfeed.error.StockDataNotFoundException;
import com.ospicorp.stockfeed.stock.model.Stock;
import com.ospicorp.stockfeed.stock.repository.StockRepository;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Reads stock reference data: the full listing, and ticker to internal id resolution.
 */
@Service
public class StockIdResolver {

  private final StockRepository stockRepository;

  public StockIdResolver(StockRepository stockRepository) {
    this.stockRepository = stockRepository;
  }

  /**
   * Resolves {@code ticker} to the id of the stock whose ticker equals it exactly.
   *
   * @throws StockDataNotFoundException when no stock carries this ticker
   * @throws SourceUnavailableException when the store cannot be queried
   */
  public long resolve(String ticker) {
    try {
      return stockRepository.findIdByTicker(ticker)
          .orElseThrow(() -> StockDataNotFoundException.unknownTicker(ticker));
    } catch (DataAccessException | TransactionException ex) {
      throw new SourceUnavailableException("resolve", ticker,
          "Error getting stock ID for ticker " + ticker + ": " + ex.getMessage(), ex);
    }
  }

  public List<Stock> listStocks() {
    try {
      return stockRepository.findAll(Sort.by("id"));
    } catch (DataAccessException | TransactionException ex) {
      throw new SourceUnavailableException("listStocks", null,
          "Error querying stocks: " + ex.getMessage(), ex);
    }
  }
}
