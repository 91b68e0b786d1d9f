package io.b2mash.b2b.vatledger.exception;

import io.b2mash.b2b.vatledger.audit.AuditEventBuilder;
import io.b2mash.b2b.vatledger.audit.AuditService;
import io.b2mash.b2b.vatledger.config.VatLedgerProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;
  private final VatLedgerProperties ledgerProperties;

  public GlobalExceptionHandler(AuditService auditService, VatLedgerProperties ledgerProperties) {
    this.auditService = auditService;
    this.ledgerProperties = ledgerProperties;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", "insufficient_role"))
            .build());

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(AggregatorUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleAggregatorUnavailable(
      AggregatorUnavailableException ex) {
    log.warn("VAT aggregator unavailable: {}", ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ledgerProperties.retryAfterSeconds()))
        .body(ex.getBody());
  }

  @ExceptionHandler({
    ObjectOptimisticLockingFailureException.class,
    PessimisticLockingFailureException.class
  })
  public ResponseEntity<ProblemDetail> handleConcurrentModification(RuntimeException ex) {
    log.warn("Concurrent modification: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    problem.setProperty("errorCode", "CONCURRENT_MODIFICATION");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  /** A bad period type inside a JSON body keeps its own error code instead of a generic 400. */
  @Override
  protected ResponseEntity<Object> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof InvalidPeriodKeyException invalidKey) {
        log.warn("Unreadable request body: {}", invalidKey.getBody().getDetail());
        return ResponseEntity.badRequest().body(invalidKey.getBody());
      }
    }
    return super.handleHttpMessageNotReadable(ex, headers, status, request);
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var fieldErrors = new LinkedHashMap<String, String>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
    }
    log.warn("Request validation failed: {}", fieldErrors);

    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail("Request body has invalid fields");
    problem.setProperty("errorCode", "VALIDATION_FAILED");
    problem.setProperty("fieldErrors", fieldErrors);
    return ResponseEntity.badRequest().body(problem);
  }
}
