package com.ospicorp.forecastengine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.ospicorp.forecastengine.forecast.service.PredictionException;
import com.ospicorp.forecastengine.forecast.service.QuantileConfigurationException;
import com.ospicorp.forecastengine.forecast.service.RequestValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class ApiExceptionHandler {
  static final String PREDICTION_FAILED = "Prediction failed due to an internal error.";

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(RequestValidationException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidRequest(RequestValidationException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    return validationError(ex, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex,
      HttpServletRequest request) {
    RequestValidationException translated = new RequestValidationException(
        describeUnreadable(ex), RequestValidationException.MALFORMED_BODY);
    logException(HttpStatus.BAD_REQUEST, translated, request);
    return validationError(translated, request);
  }

  // The predictor's failure detail stays in the log; clients get a fixed message.
  @ExceptionHandler(PredictionException.class)
  public ResponseEntity<Map<String, Object>> handlePredictionFailure(PredictionException ex,
      HttpServletRequest request) {
    logException(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", PREDICTION_FAILED));
  }

  @ExceptionHandler(QuantileConfigurationException.class)
  public ResponseEntity<ProblemDetail> handleQuantileConfiguration(
      QuantileConfigurationException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    return buildProblem(resolve(ex.getStatusCode().value()), ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    if (ex instanceof ErrorResponse errorResponse) {
      return buildProblem(resolve(errorResponse.getStatusCode().value()), ex, request);
    }
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private static HttpStatus resolve(int statusCode) {
    HttpStatus status = HttpStatus.resolve(statusCode);
    return status == null ? HttpStatus.INTERNAL_SERVER_ERROR : status;
  }

  private ResponseEntity<Map<String, Object>> validationError(RequestValidationException ex,
      HttpServletRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  static String describeUnreadable(HttpMessageNotReadableException ex) {
    Throwable cause = ex.getCause();
    if (cause instanceof UnrecognizedPropertyException unknown) {
      return "Unknown field '" + unknown.getPropertyName() + "' at " + fieldPath(unknown) + ".";
    }
    if (cause instanceof MismatchedInputException mismatch) {
      if (mismatch.getPath().isEmpty()) {
        return "Request body must be a JSON array of records.";
      }
      return "Invalid value for " + fieldPath(mismatch) + ".";
    }
    if (cause instanceof JsonProcessingException) {
      return "Request body is not valid JSON.";
    }
    return "Request body is missing or unreadable.";
  }

  private static String fieldPath(JsonMappingException ex) {
    StringBuilder path = new StringBuilder("records");
    for (JsonMappingException.Reference reference : ex.getPath()) {
      if (reference.getFieldName() != null) {
        path.append('.').append(reference.getFieldName());
      } else if (reference.getIndex() >= 0) {
        path.append('[').append(reference.getIndex()).append(']');
      }
    }
    return path.toString();
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.forecast-engine.dev/problems/"
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String method = request.getMethod();
    String uriWithQuery = RequestDescriptions.uriWithQuery(request);
    String clientIp = RequestDescriptions.clientIp(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage,
          ex);
    } else if (status.is4xxClientError()) {
      log.warn("Request {} {} from {} returned status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage);
    } else {
      log.info("Request {} {} from {} resulted in status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage);
    }
  }
}
