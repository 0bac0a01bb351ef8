package com.platform.scaffold.persistence.repository;

import com.platform.scaffold.persistence.entity.UserEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for users.
 */
@Repository
public interface UserJpaRepository extends JpaRepository<UserEntity, Long> {
    
    /**
     * True when either value is already taken.
     */
    boolean existsByEmailOrUsername(String email, String username);
    
    Slice<UserEntity> findAllBy(Pageable pageable);
}
