package com.ospicorp.stockfeed.history.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-file tally of record outcomes. Built by a single parse call and not shared.
 */
public final class ParseReport {
  private final String ticker;
  private final List<RawBar> bars = new ArrayList<>();
  private final Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);
  private boolean headerSkipped;
  private int volumeDefaulted;

  public ParseReport(String ticker) {
    this.ticker = ticker;
  }

  public void record(RecordOutcome outcome) {
    if (outcome.isAccepted()) {
      bars.add(outcome.bar());
      if (outcome.volumeDefaulted()) {
        volumeDefaulted++;
      }
    } else {
      dropped.merge(outcome.dropReason(), 1, Integer::sum);
    }
  }

  public void markHeaderSkipped() {
    headerSkipped = true;
  }

  public String ticker() {
    return ticker;
  }

  public List<RawBar> bars() {
    return Collections.unmodifiableList(bars);
  }

  public Map<DropReason, Integer> dropped() {
    return Collections.unmodifiableMap(dropped);
  }

  public int droppedCount() {
    return dropped.values().stream().mapToInt(Integer::intValue).sum();
  }

  public int volumeDefaultedCount() {
    return volumeDefaulted;
  }

  public boolean headerSkipped() {
    return headerSkipped;
  }
}
