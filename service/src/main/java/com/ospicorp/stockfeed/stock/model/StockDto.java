package com.ospicorp.stockfeed.stock.model;

public record StockDto(long id, String ticker, String name) {

  public static StockDto from(Stock stock) {
    return new StockDto(stock.getId(), stock.getTicker(), stock.getName());
  }
}
