package io.b2mash.b2b.vatledger.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PeriodAlreadyLockedException extends ErrorResponseException {

  public static final String ERROR_CODE = "PERIOD_ALREADY_LOCKED";

  public PeriodAlreadyLockedException(UUID periodId, String periodDisplay) {
    super(HttpStatus.CONFLICT, createProblem(periodId, periodDisplay), null);
  }

  private static ProblemDetail createProblem(UUID periodId, String periodDisplay) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Period already locked");
    problem.setDetail("VAT period " + periodDisplay + " is already locked");
    problem.setProperty("errorCode", ERROR_CODE);
    problem.setProperty("periodId", periodId.toString());
    return problem;
  }
}
