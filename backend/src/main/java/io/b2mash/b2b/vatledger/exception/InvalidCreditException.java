package io.b2mash.b2b.vatledger.exception;

import java.math.BigDecimal;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidCreditException extends ErrorResponseException {

  public static final String ERROR_CODE = "INVALID_CREDIT";

  public InvalidCreditException(BigDecimal amount) {
    super(
        HttpStatus.BAD_REQUEST,
        createProblem(
            amount == null
                ? "previousCredit is required"
                : "previousCredit must not be negative, got " + amount.toPlainString()),
        null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid credit amount");
    problem.setDetail(detail);
    problem.setProperty("errorCode", ERROR_CODE);
    return problem;
  }
}
