package io.supplyrisk.backend.provisioning;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class ProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningController.class);

  private final TenantProvisioningService provisioningService;

  public ProvisioningController(TenantProvisioningService provisioningService) {
    this.provisioningService = provisioningService;
  }

  @PostMapping
  public ResponseEntity<TenantResponse> provision(@Valid @RequestBody ProvisioningRequest request) {
    log.info("Received provisioning request for tenant {}", request.tenantId());

    var result = provisioningService.provision(request.tenantId(), request.name());
    var body = TenantResponse.from(result.tenant());

    if (result.alreadyProvisioned()) {
      return ResponseEntity.ok(body);
    }
    return ResponseEntity.created(URI.create("/internal/tenants/" + request.tenantId()))
        .body(body);
  }

  @GetMapping
  public ResponseEntity<List<TenantResponse>> list() {
    return ResponseEntity.ok(
        provisioningService.listAll().stream().map(TenantResponse::from).toList());
  }

  public record ProvisioningRequest(
      @NotBlank(message = "tenantId is required") @Size(max = 64) String tenantId,
      @NotBlank(message = "name is required") String name) {}

  public record TenantResponse(UUID id, String tenantId, String name, Instant createdAt) {

    static TenantResponse from(Tenant tenant) {
      return new TenantResponse(
          tenant.getId(), tenant.getExternalId(), tenant.getName(), tenant.getCreatedAt());
    }
  }
}
