package io.b2mash.b2b.vatledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A manual credit was set on a period whose credit is already carried from a locked prior period.
 * Callers may repeat the request with {@code force = true}.
 */
public class CreditOverrideRefusedException extends ErrorResponseException {

  public static final String ERROR_CODE = "CREDIT_OVERRIDE_REFUSED";

  public CreditOverrideRefusedException(String periodDisplay, String sourcePeriodDisplay) {
    super(HttpStatus.CONFLICT, createProblem(periodDisplay, sourcePeriodDisplay), null);
  }

  private static ProblemDetail createProblem(String periodDisplay, String sourcePeriodDisplay) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Manual credit refused");
    problem.setDetail(
        "Credit for "
            + periodDisplay
            + " is carried from locked period "
            + sourcePeriodDisplay
            + "; pass force=true to override it");
    problem.setProperty("errorCode", ERROR_CODE);
    return problem;
  }
}
