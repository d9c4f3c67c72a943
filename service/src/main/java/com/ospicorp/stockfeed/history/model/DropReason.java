package com.ospicorp.stockfeed.history.model;

import java.util.Locale;

public enum DropReason {
  MALFORMED_RECORD,
  TOO_FEW_FIELDS,
  INVALID_TIMESTAMP,
  INVALID_PRICE;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
