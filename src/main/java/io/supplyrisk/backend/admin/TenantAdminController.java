package io.supplyrisk.backend.admin;

import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.provisioning.TenantProvisioningService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class TenantAdminController {

  private final TenantRowCountService rowCountService;
  private final TenantProvisioningService provisioningService;

  public TenantAdminController(
      TenantRowCountService rowCountService, TenantProvisioningService provisioningService) {
    this.rowCountService = rowCountService;
    this.provisioningService = provisioningService;
  }

  @GetMapping("/{tenantId}/row-counts")
  public ResponseEntity<Map<String, Long>> rowCounts(@PathVariable String tenantId) {
    if (provisioningService.findByExternalId(tenantId).isEmpty()) {
      throw new ResourceNotFoundException("Tenant", tenantId);
    }
    return ResponseEntity.ok(rowCountService.countRows(tenantId));
  }
}
