package com.ospicorp.stockfeed.stock.repository;

import com.ospicorp.stockfeed.stock.model.Stock;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface StockRepository extends JpaRepository<Stock, Long> {

  // exact, case-sensitive match
  @Query("SELECT s.id FROM Stock s WHERE s.ticker = :ticker")
  Optional<Long> findIdByTicker(@Param("ticker") String ticker);
}
