package io.b2mash.b2b.vatledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A period key with an unknown type, an out-of-range period number or year, or no client. */
public class InvalidPeriodKeyException extends ErrorResponseException {

  public static final String ERROR_CODE = "INVALID_PERIOD_KEY";

  public InvalidPeriodKeyException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid period key");
    problem.setDetail(detail);
    problem.setProperty("errorCode", ERROR_CODE);
    return problem;
  }
}
