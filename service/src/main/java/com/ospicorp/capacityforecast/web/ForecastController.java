package com.ospicorp.capacityforecast.web;

import com.ospicorp.capacityforecast.alert.CapacityThreshold;
import com.ospicorp.capacityforecast.config.CsvHttpMessageConverter;
import com.ospicorp.capacityforecast.engine.EngineSettings;
import com.ospicorp.capacityforecast.engine.PipelineOutcome;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.ValidationReport;
import com.ospicorp.capacityforecast.service.ForecastingService;
import com.ospicorp.capacityforecast.service.ForecastingService.ForecastResult;
import com.ospicorp.capacityforecast.web.dto.AlertRequest;
import com.ospicorp.capacityforecast.web.dto.AlertResponse;
import com.ospicorp.capacityforecast.web.dto.BacktestResponse;
import com.ospicorp.capacityforecast.web.dto.ForecastResponse;
import com.ospicorp.capacityforecast.web.dto.ForecastRows;
import com.ospicorp.capacityforecast.web.dto.RunOptions;
import com.ospicorp.capacityforecast.web.dto.RunRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
public class ForecastController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final ForecastingService service;

  public ForecastController(ForecastingService service) {
    this.service = service;
  }

  @PostMapping(path = "/datasets/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Tag(name = "Datasets")
  @Operation(summary = "Validate a dataset",
      description = "Checks ingestion rows without running any model.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Validation report",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ValidationReport.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ValidationReport validate(@Valid @RequestBody RunRequest request) {
    EngineSettings settings = settings(request.optionsOrNone());
    return service.validate(request.rows(), settings);
  }

  @PostMapping(path = "/datasets/validate", consumes = "text/csv")
  @Tag(name = "Datasets")
  @Operation(summary = "Validate a CSV dataset")
  public ValidationReport validateCsv(@RequestBody RawObservation[] rows,
      @RequestParam(name = "min_series_length", required = false)
      @Parameter(description = "Minimum observations per series", example = "30")
          Integer minSeriesLength) {
    RunOptions options = new RunOptions(null, null, null, null, minSeriesLength, null, null, null,
        null);
    return service.validate(Arrays.asList(rows), settings(options));
  }

  @PostMapping(path = "/backtests", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Tag(name = "Backtests")
  @Operation(summary = "Backtest models",
      description = "Rolling-origin cross-validation of the candidate models, ranked by WAPE "
          + "and then by capacity breach rate.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Scores and winner",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = BacktestResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "No eligible series or no scorable model",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public BacktestResponse backtest(@Valid @RequestBody RunRequest request) {
    RunOptions options = request.optionsOrNone();
    return BacktestResponse.of(service.backtest(request.rows(), settings(options),
        models(options)));
  }

  @PostMapping(path = "/backtests", consumes = "text/csv")
  @Tag(name = "Backtests")
  @Operation(summary = "Backtest models on a CSV dataset")
  public BacktestResponse backtestCsv(@RequestBody RawObservation[] rows,
      @RequestParam(required = false) @Parameter(example = "14") Integer horizon,
      @RequestParam(name = "n_folds", required = false) Integer nFolds,
      @RequestParam(name = "step_size", required = false) Integer stepSize,
      @RequestParam(required = false)
      @Parameter(description = "Comma separated model ids", example = "Naive,SeasonalNaive")
          String models) {
    RunOptions options = new RunOptions(horizon, null, nFolds, stepSize, null, null, null, null,
        splitList(models));
    return BacktestResponse.of(service.backtest(Arrays.asList(rows), settings(options),
        models(options)));
  }

  @PostMapping(path = "/forecasts", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Tag(name = "Forecasts")
  @Operation(summary = "Forecast",
      description = "Forecasts every eligible series with the requested models, or with the "
          + "backtest winner when none are named.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast points with intervals",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "No eligible series or no scorable model",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> forecast(@Valid @RequestBody RunRequest request,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    RunOptions options = request.optionsOrNone();
    EngineSettings settings = settings(options);
    ForecastResult result = service.forecast(request.rows(), settings, models(options));
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE)
        ? ForecastRows.of(result.run().points(), settings.levels())
        : ForecastResponse.of(result, settings.levels());
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping(path = "/alerts/evaluate", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Tag(name = "Alerts")
  @Operation(summary = "Evaluate capacity alerts",
      description = "Backtests the candidates, forecasts with the winner and flags every step "
          + "whose upper bound at the alert level exceeds the threshold.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Alerts",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AlertResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "No eligible series or no scorable model",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public AlertResponse evaluateAlerts(@Valid @RequestBody AlertRequest request) {
    RunOptions options = request.optionsOrNone();
    EngineSettings settings = settings(options);
    CapacityThreshold threshold = RunOptionsResolver.threshold(request.threshold());
    PipelineOutcome outcome = service.evaluateAlerts(request.rows(), settings, models(options),
        threshold, request.seriesIds() == null ? null : new HashSet<>(request.seriesIds()));
    return AlertResponse.of(outcome, settings.alertLevel());
  }

  private EngineSettings settings(RunOptions options) {
    return RunOptionsResolver.settings(service.defaultSettings(), options);
  }

  private List<ModelKind> models(RunOptions options) {
    return RunOptionsResolver.models(service.registry(), options.models());
  }

  private static List<String> splitList(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("format",
          "Invalid format value. Supported values: json,csv.", RunOptionsResolver.FORMAT);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
