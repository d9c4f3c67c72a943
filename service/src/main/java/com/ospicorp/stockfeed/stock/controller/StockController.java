package com.ospicorp.stockfeed.stock.controller;

import com.ospicorp.stockfeed.aggregate.StockDataFacade;
import com.ospicorp.stockfeed.history.model.PricePoint;
import com.ospicorp.stockfeed.history.web.CsvHttpMessageConverter;
import com.ospicorp.stockfeed.stock.model.StockDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/stocks")
@Validated
@Tag(name = "Stocks")
public class StockController {
  public static final String TICKER_REGEX = "^[A-Za-z0-9._-]{1,32}$";

  private final StockDataFacade facade;

  public StockController(StockDataFacade facade) {
    this.facade = facade;
  }

  @GetMapping
  @Operation(summary = "List stocks", description = "All known stocks, ordered by id.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Stocks",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = StockDto.class)))),
      @ApiResponse(responseCode = "503", description = "Database unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public List<StockDto> list() {
    return facade.listStocks().stream().map(StockDto::from).toList();
  }

  @GetMapping("/{ticker}/history")
  @Tag(name = "History")
  @Operation(summary = "Get daily price history",
      description = "Closing prices and volumes from the ticker's daily bar file, oldest first.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Price points",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = PricePoint.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown ticker or no history file",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Database or history file unreadable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<PricePoint>> history(@PathVariable @Pattern(regexp = TICKER_REGEX)
      @Parameter(description = "Stock ticker", example = "AAA") String ticker,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "Response format, json or csv; overrides Accept") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    List<PricePoint> points = facade.getHistory(ticker);
    return ResponseEntity.ok().contentType(contentType).body(points);
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new IllegalArgumentException("Invalid format value. Supported values: json,csv.");
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes;
    try {
      mediaTypes = MediaType.parseMediaTypes(accept);
    } catch (InvalidMediaTypeException ex) {
      return MediaType.APPLICATION_JSON;
    }
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
