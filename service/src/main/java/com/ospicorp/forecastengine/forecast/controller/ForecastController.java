package com.ospicorp.forecastengine.forecast.controller;

import com.ospicorp.forecastengine.forecast.model.ForecastRequestRecord;
import com.ospicorp.forecastengine.forecast.model.ForecastResultRow;
import com.ospicorp.forecastengine.forecast.service.ForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Profile("!extract")
@Tag(name = "Forecast")
public class ForecastController {
  static final String TEXT_CSV = "text/csv";

  private final ForecastService forecastService;

  public ForecastController(ForecastService forecastService) {
    this.forecastService = forecastService;
  }

  @PostMapping(path = "/predict",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = {MediaType.APPLICATION_JSON_VALUE, TEXT_CSV})
  @Operation(summary = "Forecast series",
      description = "Forecast every series in the submitted history and return the point "
          + "estimate with 95% bounds for each horizon step.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast rows",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = ForecastResultRow.class))),
              @Content(mediaType = TEXT_CSV)
          }),
      @ApiResponse(responseCode = "400", description = "Request does not match the record contract",
          content = @Content(mediaType = "application/json",
              schema = @Schema(example = "{\"error\":\"records[0].item_id must not be blank.\","
                  + "\"errorCode\":2002,\"moreInfo\":\"https://docs.forecast-engine.dev/errors/2002\","
                  + "\"path\":\"/predict\"}"))),
      @ApiResponse(responseCode = "500", description = "Prediction failed or model misconfigured",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(example = "{\"error\":\"Prediction failed due to an internal error.\"}")),
              @Content(mediaType = "application/problem+json",
                  schema = @Schema(implementation = ProblemDetail.class))
          })
  })
  public List<ForecastResultRow> predict(
      @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "Ordered history records",
          content = @Content(array = @ArraySchema(
              schema = @Schema(implementation = ForecastRequestRecord.class))))
      @RequestBody List<ForecastRequestRecord> records) {
    return forecastService.forecast(records);
  }
}
