package io.b2mash.b2b.vatledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The VAT aggregator could not supply totals. Transient: the whole calculate call may be retried,
 * and no part of the period record was written.
 */
public class AggregatorUnavailableException extends ErrorResponseException {

  public static final String ERROR_CODE = "AGGREGATOR_UNAVAILABLE";

  public AggregatorUnavailableException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  public AggregatorUnavailableException(String detail) {
    this(detail, null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("VAT aggregator unavailable");
    problem.setDetail(detail);
    problem.setProperty("errorCode", ERROR_CODE);
    return problem;
  }
}
