package io.b2mash.b2b.vatledger.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A mutation was attempted on a VAT period that is locked. The record is left unchanged. */
public class PeriodLockedException extends ErrorResponseException {

  public static final String ERROR_CODE = "PERIOD_LOCKED";

  public PeriodLockedException(UUID periodId, String periodDisplay) {
    super(HttpStatus.CONFLICT, createProblem(periodId, periodDisplay), null);
  }

  private static ProblemDetail createProblem(UUID periodId, String periodDisplay) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Period is locked");
    problem.setDetail(
        "VAT period " + periodDisplay + " is locked; unlock it before changing it");
    problem.setProperty("errorCode", ERROR_CODE);
    if (periodId != null) {
      problem.setProperty("periodId", periodId.toString());
    }
    return problem;
  }
}
