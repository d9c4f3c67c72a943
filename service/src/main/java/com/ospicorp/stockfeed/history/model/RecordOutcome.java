package com.ospicorp.stockfeed.history.model;

/**
 * Result of converting one record of a history file: either a bar, or the reason the record was
 * dropped. Exactly one of {@code bar} and {@code dropReason} is non-null. {@code recordNumber}
 * counts non-blank records from 1, header included.
 */
public record RecordOutcome(long recordNumber, RawBar bar, DropReason dropReason,
    boolean volumeDefaulted) {

  public static RecordOutcome accepted(long recordNumber, RawBar bar, boolean volumeDefaulted) {
    return new RecordOutcome(recordNumber, bar, null, volumeDefaulted);
  }

  public static RecordOutcome dropped(long recordNumber, DropReason reason) {
    return new RecordOutcome(recordNumber, null, reason, false);
  }

  public boolean isAccepted() {
    return bar != null;
  }
}
