package com.ospicorp.capacityforecast.config;

import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.error.InsufficientHistoryException;
import com.ospicorp.capacityforecast.error.MalformedTimestampException;
import com.ospicorp.capacityforecast.error.NoScorableModelException;
import com.ospicorp.capacityforecast.web.InvalidParameterException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  static final String PROBLEM_TYPE_BASE = "https://docs.capacity-forecast.dev/problems/";

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-request",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.NOT_ACCEPTABLE, "not-acceptable",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.UNPROCESSABLE_ENTITY, "unprocessable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ProblemDetail> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request,
        "invalid-parameter");
    ProblemDetail detail = response.getBody();
    detail.setProperty("parameter", ex.parameter());
    detail.setProperty("error_code", ex.errorCode());
    detail.setProperty("more_info", ex.moreInfo());
    return response;
  }

  @ExceptionHandler(MalformedTimestampException.class)
  public ResponseEntity<ProblemDetail> handleMalformedTimestamp(MalformedTimestampException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request,
        "malformed-timestamp");
    response.getBody().setProperty("series_id", ex.seriesId());
    response.getBody().setProperty("value", ex.rawValue());
    return response;
  }

  @ExceptionHandler(InsufficientHistoryException.class)
  public ResponseEntity<ProblemDetail> handleInsufficientHistory(InsufficientHistoryException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex,
        request, "insufficient-history");
    response.getBody().setProperty("dropped_series", ex.droppedSeries());
    return response;
  }

  @ExceptionHandler(NoScorableModelException.class)
  public ResponseEntity<ProblemDetail> handleNoScorableModel(NoScorableModelException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex,
        request, "no-scorable-model");
    List<UnitFailure> failures = ex.failures();
    response.getBody().setProperty("failures", failures);
    return response;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoResourceFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMethodNotAllowed(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.METHOD_NOT_ALLOWED, ex, request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleUnsupportedMediaType(
      HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex, request);
  }

  @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
  public ResponseEntity<ProblemDetail> handleNotAcceptable(HttpMediaTypeNotAcceptableException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_ACCEPTABLE, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    return buildProblem(status, ex, request, TYPE_SLUGS.getOrDefault(status, "internal-error"));
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request, String typeSlug) {
    logException(status, ex, request);
    String message = status.is5xxServerError()
        ? "Unexpected error while processing the request"
        : ex.getMessage();
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_TYPE_BASE + typeSlug));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}", request.getMethod(),
          RequestInfo.uriWithQuery(request), RequestInfo.clientIp(request), status.value(),
          errorMessage, ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}", request.getMethod(),
          RequestInfo.uriWithQuery(request), RequestInfo.clientIp(request), status.value(),
          errorMessage);
    }
  }
}
