package com.goldtrader.repository.jpa;

import com.goldtrader.entity.UserAccountEntity;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface UserAccountJpaRepository extends JpaRepository<UserAccountEntity, String> {

    /** Row-locks the account until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM UserAccountEntity a WHERE a.userId = :userId")
    Optional<UserAccountEntity> findForUpdate(@Param("userId") String userId);
}
