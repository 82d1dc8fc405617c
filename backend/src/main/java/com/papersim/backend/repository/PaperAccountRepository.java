package com.papersim.backend.repository;

import com.papersim.backend.model.PaperAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaperAccountRepository extends JpaRepository<PaperAccount, Long> {

    List<PaperAccount> findByOwnerIdOrderByCreatedAtDescIdDesc(Long ownerId);

    @Query("select a.id from PaperAccount a")
    List<Long> findAllIds();

    /**
     * Row lock taken before any cash or position mutation of the account.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from PaperAccount a where a.id = :id")
    Optional<PaperAccount> findByIdForUpdate(@Param("id") Long id);
}
