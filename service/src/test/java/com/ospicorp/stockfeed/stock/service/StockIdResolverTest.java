package com.ospicorp.stockfeed.stock.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ospicorp.stockfeed.error.SourceUnavailableException;
import com.ospicorp.stockfeed.error.StockDataNotFoundException;
import com.ospicorp.stockfeed.stock.model.Stock;
import com.ospicorp.stockfeed.stock.repository.StockRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.CannotCreateTransactionException;

class StockIdResolverTest {

  private StockRepository repository;
  private StockIdResolver resolver;

  @BeforeEach
  void setUp() {
    repository = mock(StockRepository.class);
    resolver = new StockIdResolver(repository);
  }

  @Test
  void resolvesExactTicker() {
    when(repository.findIdByTicker("AAA")).thenReturn(Optional.of(1L));

    assertThat(resolver.resolve("AAA")).isEqualTo(1L);
  }

  @Test
  void unknownTickerIsNotFound() {
    when(repository.findIdByTicker("aaa")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> resolver.resolve("aaa"))
        .isInstanceOf(StockDataNotFoundException.class)
        .hasMessage("Stock not found for ticker aaa");
  }

  @Test
  void storeFailureIsSourceUnavailable() {
    when(repository.findIdByTicker("AAA")).thenThrow(new DataAccessResourceFailureException("refused"));

    assertThatThrownBy(() -> resolver.resolve("AAA"))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("AAA");
  }

  @Test
  void listsStocksById() {
    List<Stock> stocks = List.of(new Stock(1L, "AAA", "Alpha"), new Stock(2L, "BBB", "Beta"));
    when(repository.findAll(any(Sort.class))).thenReturn(stocks);

    assertThat(resolver.listStocks()).extracting(Stock::getTicker).containsExactly("AAA", "BBB");
  }

  @Test
  void listingFailureIsSourceUnavailable() {
    when(repository.findAll(any(Sort.class)))
        .thenThrow(new CannotCreateTransactionException("no connection"));

    assertThatThrownBy(() -> resolver.listStocks())
        .isInstanceOf(SourceUnavailableException.class);
  }
}
