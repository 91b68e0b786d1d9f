package io.b2mash.b2b.vatledger.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when a VAT period or client does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  public static final String ERROR_CODE = "NOT_FOUND";

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase() + " found with id " + id),
        null);
  }

  private ResourceNotFoundException(ProblemDetail problem) {
    super(HttpStatus.NOT_FOUND, problem, null);
  }

  /** A period addressed by its key rather than its id, e.g. {@code 03/2024}. */
  public static ResourceNotFoundException forPeriod(String periodDisplay, UUID clientId) {
    var problem =
        createProblem(
            "VAT period not found",
            "No VAT period " + periodDisplay + " for client " + clientId);
    problem.setProperty("period", periodDisplay);
    return new ResourceNotFoundException(problem);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("errorCode", ERROR_CODE);
    return problem;
  }
}
