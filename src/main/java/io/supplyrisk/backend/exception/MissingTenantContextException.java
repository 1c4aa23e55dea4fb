package io.supplyrisk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A tenant-scoped operation ran without an active tenant. Raised before any storage call. */
public class MissingTenantContextException extends ErrorResponseException {

  public MissingTenantContextException() {
    super(HttpStatus.PRECONDITION_REQUIRED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.PRECONDITION_REQUIRED);
    problem.setTitle("Tenant required");
    problem.setDetail(
        "Tenant ID required for database access. Bind a tenant before running data operations.");
    return problem;
  }
}
