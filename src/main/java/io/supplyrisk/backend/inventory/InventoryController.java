package io.supplyrisk.backend.inventory;

import io.supplyrisk.backend.inventory.dto.CreateInventoryRequest;
import io.supplyrisk.backend.inventory.dto.InventoryResponse;
import io.supplyrisk.backend.inventory.dto.UpdateInventoryRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
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
@RequestMapping("/api/inventory")
public class InventoryController {

  private final InventoryService inventoryService;

  public InventoryController(InventoryService inventoryService) {
    this.inventoryService = inventoryService;
  }

  @GetMapping
  public ResponseEntity<List<InventoryResponse>> list(
      @RequestParam(required = false) UUID productId,
      @RequestParam(required = false) UUID locationId,
      @RequestParam(defaultValue = "false") boolean belowReorderPoint) {
    List<Specification<Inventory>> filters = new ArrayList<>();
    if (productId != null) {
      filters.add(InventorySpecifications.forProduct(productId));
    }
    if (locationId != null) {
      filters.add(InventorySpecifications.atLocation(locationId));
    }
    if (belowReorderPoint) {
      filters.add(InventorySpecifications.belowReorderPoint());
    }
    return ResponseEntity.ok(
        inventoryService.findAll(filters.stream().reduce(Specification::and).orElse(null)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<InventoryResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(inventoryService.findById(id));
  }

  @GetMapping("/products/{productId}/total")
  public ResponseEntity<Map<String, Object>> totalOnHand(@PathVariable UUID productId) {
    return ResponseEntity.ok(
        Map.of("productId", productId, "quantityOnHand", inventoryService.totalOnHand(productId)));
  }

  @PostMapping
  public ResponseEntity<InventoryResponse> create(
      @Valid @RequestBody CreateInventoryRequest request) {
    var response = inventoryService.create(request);
    return ResponseEntity.created(URI.create("/api/inventory/" + response.id())).body(response);
  }

  @PutMapping("/products/{productId}/locations/{locationId}")
  public ResponseEntity<InventoryResponse> upsert(
      @PathVariable UUID productId,
      @PathVariable UUID locationId,
      @Valid @RequestBody UpdateInventoryRequest request) {
    return ResponseEntity.ok(inventoryService.upsert(productId, locationId, request));
  }

  @PutMapping("/{id}")
  public ResponseEntity<InventoryResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateInventoryRequest request) {
    return ResponseEntity.ok(inventoryService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    inventoryService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
