package io.supplyrisk.backend.inventory;

import io.supplyrisk.backend.inventory.dto.CreateInventoryRequest;
import io.supplyrisk.backend.inventory.dto.InventoryResponse;
import io.supplyrisk.backend.inventory.dto.UpdateInventoryRequest;
import io.supplyrisk.backend.location.Location;
import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.product.Product;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InventoryService {

  private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

  private final EntityStore<Inventory> inventory;
  private final EntityStore<Product> products;
  private final EntityStore<Location> locations;

  public InventoryService(EntityStores stores) {
    this.inventory = stores.forEntity(Inventory.class);
    this.products = stores.forEntity(Product.class);
    this.locations = stores.forEntity(Location.class);
  }

  @Transactional
  public InventoryResponse create(CreateInventoryRequest request) {
    products.getById(request.productId());
    locations.getById(request.locationId());

    var row = new Inventory(request.productId(), request.locationId());
    row.updateQuantities(
        request.quantityOnHand(), request.quantityReserved(), request.reorderPoint());
    row.recordCount(request.lastCountDate());
    row = inventory.create(row);

    log.info(
        "Created inventory: id={}, productId={}, locationId={}",
        row.getId(),
        row.getProductId(),
        row.getLocationId());
    return InventoryResponse.from(row);
  }

  /**
   * Creates or updates the single row for (product, location). Quantities left null keep their
   * current value, or default to zero on a new row.
   */
  @Transactional
  public InventoryResponse upsert(UUID productId, UUID locationId, UpdateInventoryRequest request) {
    products.getById(productId);
    locations.getById(locationId);

    var row =
        inventory.upsert(
            InventorySpecifications.forProductAtLocation(productId, locationId),
            () -> {
              var created = new Inventory(productId, locationId);
              apply(created, request);
              return created;
            },
            existing -> apply(existing, request));

    log.info(
        "Upserted inventory: id={}, productId={}, locationId={}",
        row.getId(),
        productId,
        locationId);
    return InventoryResponse.from(row);
  }

  @Transactional(readOnly = true)
  public InventoryResponse findById(UUID id) {
    return InventoryResponse.from(inventory.getById(id));
  }

  @Transactional(readOnly = true)
  public List<InventoryResponse> findAll(Specification<Inventory> filter) {
    return inventory.findAll(filter, Sort.by("createdAt")).stream()
        .map(InventoryResponse::from)
        .toList();
  }

  /** Units on hand for a product across every location of the active tenant. */
  @Transactional(readOnly = true)
  public long totalOnHand(UUID productId) {
    return inventory.sum("quantityOnHand", InventorySpecifications.forProduct(productId));
  }

  @Transactional
  public InventoryResponse update(UUID id, UpdateInventoryRequest request) {
    var row = inventory.update(id, existing -> apply(existing, request));
    log.info("Updated inventory: id={}", row.getId());
    return InventoryResponse.from(row);
  }

  @Transactional
  public void delete(UUID id) {
    inventory.deleteById(id);
    log.info("Deleted inventory: id={}", id);
  }

  private static void apply(Inventory row, UpdateInventoryRequest request) {
    row.updateQuantities(
        request.quantityOnHand(), request.quantityReserved(), request.reorderPoint());
    if (request.lastCountDate() != null) {
      row.recordCount(request.lastCountDate());
    }
  }
}
