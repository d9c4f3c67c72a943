package com.ospicorp.stockfeed.error;

/**
 * The relational store or the price-history files could not be read. May be transient.
 */
public class SourceUnavailableException extends RuntimeException {
  private final String ticker;
  private final String operation;

  public SourceUnavailableException(String operation, String ticker, String message,
      Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.ticker = ticker;
  }

  /** Ticker the failing call was made for, or {@code null} for ticker-independent reads. */
  public String ticker() {
    return ticker;
  }

  public String operation() {
    return operation;
  }
}
