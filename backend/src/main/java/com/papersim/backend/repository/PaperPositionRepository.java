package com.papersim.backend.repository;

import com.papersim.backend.model.PaperPosition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaperPositionRepository extends JpaRepository<PaperPosition, Long> {
    List<PaperPosition> findByAccountId(Long accountId);
    Optional<PaperPosition> findByAccountIdAndSymbol(Long accountId, String symbol);
    long countByAccountId(Long accountId);
    void deleteByAccountId(Long accountId);
}
