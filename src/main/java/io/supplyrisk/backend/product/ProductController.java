package io.supplyrisk.backend.product;

import io.supplyrisk.backend.product.dto.CreateProductRequest;
import io.supplyrisk.backend.product.dto.ProductResponse;
import io.supplyrisk.backend.product.dto.UpdateProductRequest;
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
@RequestMapping("/api/products")
public class ProductController {

  private final ProductService productService;

  public ProductController(ProductService productService) {
    this.productService = productService;
  }

  @GetMapping
  public ResponseEntity<List<ProductResponse>> list(
      @RequestParam(required = false) String category,
      @RequestParam(required = false) UUID supplierId) {
    List<Specification<Product>> filters = new ArrayList<>();
    if (category != null && !category.isBlank()) {
      filters.add(ProductSpecifications.inCategory(category));
    }
    if (supplierId != null) {
      filters.add(ProductSpecifications.suppliedBy(supplierId));
    }
    return ResponseEntity.ok(
        productService.findAll(filters.stream().reduce(Specification::and).orElse(null)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProductResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(productService.findById(id));
  }

  @PostMapping
  public ResponseEntity<ProductResponse> create(@Valid @RequestBody CreateProductRequest request) {
    var response = productService.create(request);
    return ResponseEntity.created(URI.create("/api/products/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<ProductResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateProductRequest request) {
    return ResponseEntity.ok(productService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    productService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
