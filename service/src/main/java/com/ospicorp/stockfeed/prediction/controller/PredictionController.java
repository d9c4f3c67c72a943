package com.ospicorp.stockfeed.prediction.controller;

import static com.ospicorp.stockfeed.stock.controller.StockController.TICKER_REGEX;

import com.ospicorp.stockfeed.aggregate.StockDataFacade;
import com.ospicorp.stockfeed.prediction.model.PredictionView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/predictions")
@Validated
@Tag(name = "Predictions")
public class PredictionController {

  private final StockDataFacade facade;

  public PredictionController(StockDataFacade facade) {
    this.facade = facade;
  }

  @GetMapping("/{ticker}")
  @Operation(summary = "List predictions for a stock",
      description = "Analyst predictions joined with their source message text, newest first. "
          + "ID is the position in this response, not a stable identifier.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Predictions",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = PredictionView.class)))),
      @ApiResponse(responseCode = "400", description = "Malformed ticker",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown ticker",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Database unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public List<PredictionView> list(@PathVariable @Pattern(regexp = TICKER_REGEX)
      @Parameter(description = "Stock ticker", example = "AAA") String ticker) {
    return PredictionView.number(facade.getPredictions(ticker));
  }
}
