package io.supplyrisk.backend.supplier;

import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.supplier.dto.CreateSupplierRequest;
import io.supplyrisk.backend.supplier.dto.SupplierResponse;
import io.supplyrisk.backend.supplier.dto.UpdateSupplierRequest;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SupplierService {

  private static final Logger log = LoggerFactory.getLogger(SupplierService.class);

  private final EntityStore<Supplier> suppliers;

  public SupplierService(EntityStores stores) {
    this.suppliers = stores.forEntity(Supplier.class);
  }

  @Transactional
  public SupplierResponse create(CreateSupplierRequest request) {
    var supplier =
        new Supplier(request.code(), request.name(), request.country(), request.rating());
    supplier.updateContact(request.contactEmail(), request.contactPhone(), request.address());
    supplier.setNotes(request.notes());
    supplier = suppliers.create(supplier);

    log.info("Created supplier: id={}, code={}", supplier.getId(), supplier.getCode());
    return SupplierResponse.from(supplier);
  }

  @Transactional(readOnly = true)
  public SupplierResponse findById(UUID id) {
    return SupplierResponse.from(suppliers.getById(id));
  }

  @Transactional(readOnly = true)
  public List<SupplierResponse> findAll(Specification<Supplier> filter) {
    return suppliers.findAll(filter, Sort.by("code")).stream().map(SupplierResponse::from).toList();
  }

  @Transactional
  public SupplierResponse update(UUID id, UpdateSupplierRequest request) {
    var supplier =
        suppliers.update(
            id,
            s -> {
              s.updateDetails(request.name(), request.country(), request.rating());
              s.updateContact(request.contactEmail(), request.contactPhone(), request.address());
              s.setNotes(request.notes());
            });

    log.info("Updated supplier: id={}", supplier.getId());
    return SupplierResponse.from(supplier);
  }

  /** Rejected with a conflict while products still reference the supplier. */
  @Transactional
  public void delete(UUID id) {
    suppliers.deleteById(id);
    log.info("Deleted supplier: id={}", id);
  }
}
