package io.supplyrisk.backend.user;

import io.supplyrisk.backend.user.dto.CreateUserRequest;
import io.supplyrisk.backend.user.dto.UpdateUserRequest;
import io.supplyrisk.backend.user.dto.UserResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
public class UserController {

  private final UserService userService;

  public UserController(UserService userService) {
    this.userService = userService;
  }

  @GetMapping
  public ResponseEntity<List<UserResponse>> list(
      @RequestParam(required = false) UserRole role,
      @RequestParam(required = false) UserStatus status) {
    List<Specification<User>> filters = new ArrayList<>();
    if (role != null) {
      filters.add(UserSpecifications.withRole(role));
    }
    if (status != null) {
      filters.add(UserSpecifications.withStatus(status));
    }
    return ResponseEntity.ok(
        userService.findAll(filters.stream().reduce(Specification::and).orElse(null)));
  }

  @GetMapping("/by-email")
  public ResponseEntity<UserResponse> byEmail(@RequestParam String email) {
    return ResponseEntity.ok(userService.findByEmail(email));
  }

  @GetMapping("/{id}")
  public ResponseEntity<UserResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(userService.findById(id));
  }

  @PostMapping
  public ResponseEntity<UserResponse> create(@Valid @RequestBody CreateUserRequest request) {
    var response = userService.create(request);
    return ResponseEntity.created(URI.create("/api/users/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<UserResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateUserRequest request) {
    return ResponseEntity.ok(userService.update(id, request));
  }

  @PostMapping("/{id}/login")
  public ResponseEntity<UserResponse> recordLogin(@PathVariable UUID id) {
    return ResponseEntity.ok(userService.recordLogin(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    userService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
