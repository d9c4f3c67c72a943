package com.ospicorp.stockfeed.history.service;

import com.ospicorp.stockfeed.history.model.PricePoint;
import com.ospicorp.stockfeed.history.model.RawBar;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Pins parsed bars to absolute instants and orders them oldest first. Bars with equal timestamps
 * are all kept, in file order.
 */
@Component
public class PriceHistoryNormalizer {
  private static final Comparator<PricePoint> BY_TIME = Comparator.comparing(PricePoint::timestamp);

  private final ZoneId sourceZone;

  public PriceHistoryNormalizer(@Value("${stocks.history.zone:UTC}") String sourceZone) {
    this.sourceZone = ZoneId.of(sourceZone);
  }

  public List<PricePoint> normalize(long stockId, List<RawBar> bars) {
    if (bars == null || bars.isEmpty()) {
      return List.of();
    }
    List<PricePoint> points = new ArrayList<>(bars.size());
    for (RawBar bar : bars) {
      points.add(new PricePoint(stockId, bar.timestamp().atZone(sourceZone).toInstant(),
          bar.price(), bar.volume()));
    }
    // List.sort is stable
    points.sort(BY_TIME);
    return points;
  }
}
