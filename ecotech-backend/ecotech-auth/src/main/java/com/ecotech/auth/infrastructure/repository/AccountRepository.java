package com.ecotech.auth.infrastructure.repository;

import com.ecotech.auth.infrastructure.entity.AccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    /* ================= HOT PATHS ================= */

    Optional<AccountEntity> findByUsername(String username);

    /* ================= LISTING ================= */

    @Query("""
        select a
        from AccountEntity a
        order by a.id asc
    """)
    List<AccountEntity> findAllOrderedById();
}
