package io.supplyrisk.backend.supplier;

import io.supplyrisk.backend.supplier.dto.CreateSupplierRequest;
import io.supplyrisk.backend.supplier.dto.SupplierResponse;
import io.supplyrisk.backend.supplier.dto.UpdateSupplierRequest;
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
@RequestMapping("/api/suppliers")
public class SupplierController {

  private final SupplierService supplierService;

  public SupplierController(SupplierService supplierService) {
    this.supplierService = supplierService;
  }

  @GetMapping
  public ResponseEntity<List<SupplierResponse>> list(
      @RequestParam(required = false) String country,
      @RequestParam(required = false) Integer minRating) {
    List<Specification<Supplier>> filters = new ArrayList<>();
    if (country != null && !country.isBlank()) {
      filters.add(SupplierSpecifications.inCountry(country));
    }
    if (minRating != null) {
      filters.add(SupplierSpecifications.ratedAtLeast(minRating));
    }
    return ResponseEntity.ok(
        supplierService.findAll(filters.stream().reduce(Specification::and).orElse(null)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<SupplierResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(supplierService.findById(id));
  }

  @PostMapping
  public ResponseEntity<SupplierResponse> create(
      @Valid @RequestBody CreateSupplierRequest request) {
    var response = supplierService.create(request);
    return ResponseEntity.created(URI.create("/api/suppliers/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<SupplierResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateSupplierRequest request) {
    return ResponseEntity.ok(supplierService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    supplierService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
