package io.supplyrisk.backend.user;

import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.user.dto.CreateUserRequest;
import io.supplyrisk.backend.user.dto.UpdateUserRequest;
import io.supplyrisk.backend.user.dto.UserResponse;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final EntityStore<User> users;

  public UserService(EntityStores stores) {
    this.users = stores.forEntity(User.class);
  }

  @Transactional
  public UserResponse create(CreateUserRequest request) {
    var user = users.create(new User(request.email(), request.name(), request.role()));
    log.info("Created user: id={}, role={}", user.getId(), user.getRole());
    return UserResponse.from(user);
  }

  @Transactional(readOnly = true)
  public UserResponse findById(UUID id) {
    return UserResponse.from(users.getById(id));
  }

  @Transactional(readOnly = true)
  public UserResponse findByEmail(String email) {
    return users
        .findFirst(UserSpecifications.hasEmail(email))
        .map(UserResponse::from)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "User not found", "No user found with email " + email));
  }

  @Transactional(readOnly = true)
  public List<UserResponse> findAll(Specification<User> filter) {
    return users.findAll(filter, Sort.by("email")).stream().map(UserResponse::from).toList();
  }

  @Transactional
  public UserResponse update(UUID id, UpdateUserRequest request) {
    var user =
        users.update(
            id,
            u -> {
              u.updateProfile(request.email(), request.name());
              u.changeRole(request.role());
              u.changeStatus(request.status());
            });
    log.info("Updated user: id={}", user.getId());
    return UserResponse.from(user);
  }

  @Transactional
  public UserResponse recordLogin(UUID id) {
    var user = users.update(id, u -> u.recordLogin(Instant.now()));
    return UserResponse.from(user);
  }

  @Transactional
  public void delete(UUID id) {
    users.deleteById(id);
    log.info("Deleted user: id={}", id);
  }
}
