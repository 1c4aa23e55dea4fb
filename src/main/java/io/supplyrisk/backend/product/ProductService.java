package io.supplyrisk.backend.product;

import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.product.dto.CreateProductRequest;
import io.supplyrisk.backend.product.dto.ProductResponse;
import io.supplyrisk.backend.product.dto.UpdateProductRequest;
import io.supplyrisk.backend.supplier.Supplier;
import io.supplyrisk.backend.supplier.dto.SupplierResponse;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProductService {

  private static final Logger log = LoggerFactory.getLogger(ProductService.class);

  private final EntityStore<Product> products;
  private final EntityStore<Supplier> suppliers;

  public ProductService(EntityStores stores) {
    this.products = stores.forEntity(Product.class);
    this.suppliers = stores.forEntity(Supplier.class);
  }

  @Transactional
  public ProductResponse create(CreateProductRequest request) {
    // Resolving through the scoped store keeps a foreign tenant's supplier out of reach.
    suppliers.getById(request.supplierId());

    var product =
        new Product(
            request.sku(),
            request.name(),
            request.category(),
            request.unitOfMeasure(),
            request.leadTimeDays(),
            request.supplierId());
    product.setDescription(request.description());
    product = products.create(product);

    log.info(
        "Created product: id={}, sku={}, supplierId={}",
        product.getId(),
        product.getSku(),
        product.getSupplierId());
    return ProductResponse.from(product);
  }

  /** Reads a product with its supplier included. */
  @Transactional(readOnly = true)
  public ProductResponse findById(UUID id) {
    var product = products.getById(id);
    var supplier = suppliers.findById(product.getSupplierId()).map(SupplierResponse::from);
    return ProductResponse.from(product, supplier.orElse(null));
  }

  @Transactional(readOnly = true)
  public List<ProductResponse> findAll(Specification<Product> filter) {
    return products.findAll(filter, Sort.by("sku")).stream().map(ProductResponse::from).toList();
  }

  @Transactional
  public ProductResponse update(UUID id, UpdateProductRequest request) {
    suppliers.getById(request.supplierId());

    var product =
        products.update(
            id,
            p ->
                p.update(
                    request.name(),
                    request.description(),
                    request.category(),
                    request.unitOfMeasure(),
                    request.leadTimeDays(),
                    request.supplierId()));

    log.info("Updated product: id={}", product.getId());
    return ProductResponse.from(product);
  }

  /** Deleting a product also removes its inventory rows and risk links (database cascade). */
  @Transactional
  public void delete(UUID id) {
    products.deleteById(id);
    log.info("Deleted product: id={}", id);
  }
}
