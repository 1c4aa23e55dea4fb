package io.supplyrisk.backend.user;

import java.util.Locale;
import org.springframework.data.jpa.domain.Specification;

public final class UserSpecifications {

  private UserSpecifications() {}

  /** Case-insensitive, matching the {@code lower(email)} unique index. */
  public static Specification<User> hasEmail(String email) {
    return (root, query, cb) ->
        cb.equal(cb.lower(root.get("email")), email.toLowerCase(Locale.ROOT));
  }

  public static Specification<User> withRole(UserRole role) {
    return (root, query, cb) -> cb.equal(root.get("role"), role);
  }

  public static Specification<User> withStatus(UserStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }
}
