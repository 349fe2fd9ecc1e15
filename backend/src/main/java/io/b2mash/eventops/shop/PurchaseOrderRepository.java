package io.b2mash.eventops.shop;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, UUID> {

  List<PurchaseOrder> findByEventIdIn(Collection<UUID> eventIds);

  List<PurchaseOrder> findByClassIdIn(Collection<UUID> classIds);

  List<PurchaseOrder> findByEventIdAndPaymentStatus(UUID eventId, String paymentStatus);

  List<PurchaseOrder> findByClassIdInAndPaymentStatus(
      Collection<UUID> classIds, String paymentStatus);
}
