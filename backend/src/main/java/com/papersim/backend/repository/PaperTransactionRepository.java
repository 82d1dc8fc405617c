package com.papersim.backend.repository;

import com.papersim.backend.model.PaperOrder;
import com.papersim.backend.model.PaperTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PaperTransactionRepository extends JpaRepository<PaperTransaction, Long> {
    List<PaperTransaction> findByAccountIdOrderByTimestampDescIdDesc(Long accountId);
    List<PaperTransaction> findByAccountIdAndTypeOrderByTimestampAscIdAsc(Long accountId, PaperOrder.OrderSide type);
    void deleteByAccountId(Long accountId);
}
