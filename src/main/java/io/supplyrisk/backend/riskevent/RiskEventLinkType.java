package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.location.Location;
import io.supplyrisk.backend.product.Product;
import io.supplyrisk.backend.route.ShipmentRoute;
import io.supplyrisk.backend.supplier.Supplier;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Describes one of the four junctions of a risk event: the linked entity type, the junction entity
 * type, the junction column holding the linked id, and the URL segment naming it.
 *
 * @param <L> the junction entity
 */
public final class RiskEventLinkType<L extends RiskEventLink> {

  public static final RiskEventLinkType<RiskEventSupplier> SUPPLIER =
      new RiskEventLinkType<>(
          "suppliers",
          Supplier.class,
          RiskEventSupplier.class,
          "supplierId",
          RiskEventSupplier::new);

  public static final RiskEventLinkType<RiskEventProduct> PRODUCT =
      new RiskEventLinkType<>(
          "products", Product.class, RiskEventProduct.class, "productId", RiskEventProduct::new);

  public static final RiskEventLinkType<RiskEventLocation> LOCATION =
      new RiskEventLinkType<>(
          "locations",
          Location.class,
          RiskEventLocation.class,
          "locationId",
          RiskEventLocation::new);

  public static final RiskEventLinkType<RiskEventRoute> ROUTE =
      new RiskEventLinkType<>(
          "routes", ShipmentRoute.class, RiskEventRoute.class, "routeId", RiskEventRoute::new);

  private static final List<RiskEventLinkType<?>> ALL = List.of(SUPPLIER, PRODUCT, LOCATION, ROUTE);

  private final String pathSegment;
  private final Class<?> targetType;
  private final Class<L> linkType;
  private final String linkedAttribute;
  private final BiFunction<UUID, UUID, L> factory;

  private RiskEventLinkType(
      String pathSegment,
      Class<?> targetType,
      Class<L> linkType,
      String linkedAttribute,
      BiFunction<UUID, UUID, L> factory) {
    this.pathSegment = pathSegment;
    this.targetType = targetType;
    this.linkType = linkType;
    this.linkedAttribute = linkedAttribute;
    this.factory = factory;
  }

  public static List<RiskEventLinkType<?>> values() {
    return ALL;
  }

  public static Optional<RiskEventLinkType<?>> fromPathSegment(String segment) {
    return ALL.stream().filter(type -> type.pathSegment.equals(segment)).findFirst();
  }

  public String pathSegment() {
    return pathSegment;
  }

  public Class<?> targetType() {
    return targetType;
  }

  public Class<L> linkType() {
    return linkType;
  }

  public String linkedAttribute() {
    return linkedAttribute;
  }

  L newLink(UUID riskEventId, UUID linkedId) {
    return factory.apply(riskEventId, linkedId);
  }

  @Override
  public String toString() {
    return pathSegment;
  }
}
