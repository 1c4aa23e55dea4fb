package io.supplyrisk.backend.exception;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A uniqueness or foreign-key constraint rejected the write: a duplicate business key, a duplicate
 * tenant+relationship combination, or a delete blocked by a restrict rule.
 */
public class ResourceConflictException extends ErrorResponseException {

  private final String constraintName;

  public ResourceConflictException(String title, String detail) {
    this(title, detail, null);
  }

  private ResourceConflictException(String title, String detail, String constraintName) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, constraintName), null);
    this.constraintName = constraintName;
  }

  /** Wraps a storage-level violation, keeping the violated constraint's name when known. */
  public static ResourceConflictException fromViolation(
      String entityName, DataIntegrityViolationException ex) {
    String constraint = null;
    if (ex.getCause() instanceof ConstraintViolationException cve) {
      constraint = cve.getConstraintName();
    }
    return new ResourceConflictException(
        "Constraint violation",
        entityName + " write rejected by constraint " + (constraint != null ? constraint : "?"),
        constraint);
  }

  /** Name of the violated constraint, or null when the storage engine did not report one. */
  public String getConstraintName() {
    return constraintName;
  }

  private static ProblemDetail createProblem(String title, String detail, String constraintName) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (constraintName != null) {
      problem.setProperty("constraint", constraintName);
    }
    return problem;
  }
}
