package com.papersim.backend.repository;

import com.papersim.backend.model.OrderStatus;
import com.papersim.backend.model.PaperOrder;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaperOrderRepository extends JpaRepository<PaperOrder, Long> {
    List<PaperOrder> findByAccountIdOrderByCreatedAtDescIdDesc(Long accountId);
    List<PaperOrder> findByStatusAndOrderTypeNot(OrderStatus status, PaperOrder.OrderType orderType);
    long countByAccountIdAndStatus(Long accountId, OrderStatus status);
    void deleteByAccountId(Long accountId);

    /**
     * Owning account of an order, read without loading the order into the persistence context so the
     * later row lock returns its committed state.
     */
    @Query("select o.accountId from PaperOrder o where o.id = :id")
    Optional<Long> findAccountIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from PaperOrder o where o.id = :id")
    Optional<PaperOrder> findByIdForUpdate(@Param("id") Long id);
}
