package com.ospicorp.stockfeed.error;

import java.util.NoSuchElementException;

/**
 * The requested ticker has no data: either no stock row matches it, or the stock exists but has
 * no price-history file. Both cases share this type and the same HTTP status; {@link #reason()}
 * only feeds logging.
 */
public class StockDataNotFoundException extends NoSuchElementException {

  public enum Reason {
    UNKNOWN_TICKER,
    NO_HISTORY_FILE
  }

  private final String ticker;
  private final Reason reason;

  public StockDataNotFoundException(String ticker, Reason reason, String message) {
    super(message);
    this.ticker = ticker;
    this.reason = reason;
  }

  public static StockDataNotFoundException unknownTicker(String ticker) {
    return new StockDataNotFoundException(ticker, Reason.UNKNOWN_TICKER,
        "Stock not found for ticker " + ticker);
  }

  public static StockDataNotFoundException noHistoryFile(String ticker) {
    return new StockDataNotFoundException(ticker, Reason.NO_HISTORY_FILE,
        "Price history file not found for ticker " + ticker);
  }

  public String ticker() {
    return ticker;
  }

  public Reason reason() {
    return reason;
  }
}
