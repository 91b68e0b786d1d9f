package io.b2mash.b2b.vatledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Unlock refused: a later locked period of the same client already consumed this credit. */
public class LaterPeriodLockedException extends ErrorResponseException {

  public static final String ERROR_CODE = "LATER_PERIOD_LOCKED";

  public LaterPeriodLockedException(String periodDisplay) {
    super(HttpStatus.CONFLICT, createProblem(periodDisplay), null);
  }

  private static ProblemDetail createProblem(String periodDisplay) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Later period locked");
    problem.setDetail(
        "Cannot unlock "
            + periodDisplay
            + " while a later period of the same client is locked; unlock the later periods"
            + " first");
    problem.setProperty("errorCode", ERROR_CODE);
    return problem;
  }
}
