package com.clinicflow.repository;

import com.clinicflow.entity.InventoryDrug;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link InventoryDrug} entities.
 * Stock changes go through single UPDATE statements so concurrent dispensing writes cannot lose updates.
 */
public interface InventoryDrugRepository extends JpaRepository<InventoryDrug, UUID> {

    List<InventoryDrug> findByOwnerIdAndActiveTrueOrderByDrugNameAsc(String ownerId);

    List<InventoryDrug> findByOwnerIdAndActiveTrueAndStockQuantityLessThanEqualOrderByStockQuantityAsc(
            String ownerId, int threshold);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from InventoryDrug d where d.id = :id")
    Optional<InventoryDrug> findForUpdate(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InventoryDrug d set d.stockQuantity = case when d.stockQuantity >= :quantity "
            + "then d.stockQuantity - :quantity else 0 end where d.id = :id")
    int decrementStock(@Param("id") UUID id, @Param("quantity") int quantity);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InventoryDrug d set d.stockQuantity = d.stockQuantity + :quantity where d.id = :id")
    int incrementStock(@Param("id") UUID id, @Param("quantity") int quantity);
}
