package com.ospicorp.stockfeed.history.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.stockfeed.error.SourceUnavailableException;
import com.ospicorp.stockfeed.error.StockDataNotFoundException;
import com.ospicorp.stockfeed.history.model.DropReason;
import com.ospicorp.stockfeed.history.model.ParseReport;
import com.ospicorp.stockfeed.history.model.RawBar;
import com.ospicorp.stockfeed.history.model.RecordOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reads {@code <ticker>_D1.csv} daily-bar exports from the data directory.
 *
 * <p>Rows are positional: field 0 is the bar time ({@code yyyy.MM.dd HH:mm:ss}), field 4 the
 * close price and field 7 the real volume. Each line is one record. Parsing is permissive per
 * record: lines that are not valid CSV, rows that are too short, or rows whose time or price
 * cannot be read are dropped; an unreadable volume becomes 0. Only I/O failures on the file
 * itself are reported as errors.
 */
@Service
public class PriceHistoryParser {
  private static final Logger log = LoggerFactory.getLogger(PriceHistoryParser.class);

  static final String FILE_SUFFIX = "_D1.csv";
  static final int MIN_FIELDS = 8;
  static final int TIME_FIELD = 0;
  static final int CLOSE_FIELD = 4;
  static final int VOLUME_FIELD = 7;
  static final String METRIC_NAME = "stockfeed.history.records";

  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
      .ofPattern("uuuu.MM.dd HH:mm:ss")
      .withResolverStyle(ResolverStyle.STRICT);

  private static final ObjectReader ROW_READER = new CsvMapper()
      .readerFor(String[].class)
      .with(CsvParser.Feature.WRAP_AS_ARRAY);

  private final Path dataDir;
  private final MeterRegistry meterRegistry;

  public PriceHistoryParser(@Value("${stocks.history.data-dir:data}") String dataDir,
      MeterRegistry meterRegistry) {
    this.dataDir = Paths.get(dataDir).toAbsolutePath().normalize();
    this.meterRegistry = meterRegistry;
  }

  public List<RawBar> parse(String ticker) {
    return read(ticker).bars();
  }

  /**
   * Parses the ticker's history file and returns the surviving bars together with the tally of
   * dropped records.
   *
   * @throws StockDataNotFoundException when the ticker has no history file
   * @throws SourceUnavailableException when the file exists but cannot be read
   */
  public ParseReport read(String ticker) {
    Path file = locate(ticker);
    ParseReport report = new ParseReport(ticker);

    try (BufferedReader reader = open(file)) {
      long recordNumber = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        recordNumber++;
        String[] fields;
        try {
          fields = ROW_READER.readValue(line);
        } catch (JsonProcessingException ex) {
          log.debug("Dropped record {} of {}: {}", recordNumber, file.getFileName(),
              ex.getOriginalMessage());
          report.record(RecordOutcome.dropped(recordNumber, DropReason.MALFORMED_RECORD));
          continue;
        }
        if (recordNumber == 1 && isHeader(fields)) {
          report.markHeaderSkipped();
          continue;
        }
        RecordOutcome outcome = convert(recordNumber, fields);
        if (!outcome.isAccepted()) {
          log.debug("Dropped record {} of {}: {}", recordNumber, file.getFileName(),
              outcome.dropReason());
        }
        report.record(outcome);
      }
    } catch (IOException ex) {
      throw new SourceUnavailableException("parseHistory", ticker,
          "Error reading price history file for ticker " + ticker + ": " + ex.getMessage(), ex);
    }

    publish(report);
    return report;
  }

  // undecodable bytes become U+FFFD so one bad byte only affects its own record
  private static BufferedReader open(Path file) throws IOException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
  }

  static RecordOutcome convert(long recordNumber, String[] fields) {
    if (fields.length < MIN_FIELDS) {
      return RecordOutcome.dropped(recordNumber, DropReason.TOO_FEW_FIELDS);
    }

    LocalDateTime timestamp;
    try {
      timestamp = LocalDateTime.parse(fields[TIME_FIELD], TIMESTAMP_FORMAT);
    } catch (DateTimeParseException ex) {
      return RecordOutcome.dropped(recordNumber, DropReason.INVALID_TIMESTAMP);
    }

    BigDecimal price = parsePrice(fields[CLOSE_FIELD]);
    if (price == null) {
      return RecordOutcome.dropped(recordNumber, DropReason.INVALID_PRICE);
    }

    Long volume = parseVolume(fields[VOLUME_FIELD]);
    boolean volumeDefaulted = volume == null;
    RawBar bar = new RawBar(timestamp, price, volumeDefaulted ? 0L : volume);
    return RecordOutcome.accepted(recordNumber, bar, volumeDefaulted);
  }

  private Path locate(String ticker) {
    Path file;
    try {
      file = dataDir.resolve(ticker + FILE_SUFFIX).normalize();
    } catch (InvalidPathException ex) {
      throw StockDataNotFoundException.noHistoryFile(ticker);
    }
    if (!file.startsWith(dataDir) || Files.notExists(file)) {
      throw StockDataNotFoundException.noHistoryFile(ticker);
    }
    return file;
  }

  private static boolean isHeader(String[] fields) {
    return fields.length > 0 && fields[TIME_FIELD].contains("Time");
  }

  private static BigDecimal parsePrice(String text) {
    try {
      BigDecimal price = new BigDecimal(text);
      return price.signum() < 0 ? null : price;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static Long parseVolume(String text) {
    try {
      long volume = Long.parseLong(text);
      return volume < 0 ? null : volume;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private void publish(ParseReport report) {
    int accepted = report.bars().size();
    counter("accepted", "none").increment(accepted);
    for (Map.Entry<DropReason, Integer> entry : report.dropped().entrySet()) {
      counter("dropped", entry.getKey().tag()).increment(entry.getValue());
    }
    if (report.volumeDefaultedCount() > 0) {
      counter("volume_defaulted", "invalid_volume").increment(report.volumeDefaultedCount());
    }

    if (report.droppedCount() > 0 || report.volumeDefaultedCount() > 0) {
      log.info("Parsed {} bars for ticker '{}': dropped {} {}, volume defaulted on {}",
          accepted, report.ticker(), report.droppedCount(), report.dropped(),
          report.volumeDefaultedCount());
    } else {
      log.debug("Parsed {} bars for ticker '{}'", accepted, report.ticker());
    }
  }

  private Counter counter(String outcome, String reason) {
    return Counter.builder(METRIC_NAME)
        .description("Price history records read, by outcome")
        .tag("outcome", outcome)
        .tag("reason", reason)
        .register(meterRegistry);
  }
}
