package com.hinata.backend.modules.auth.infrastructure.persistence;

import java.util.List;

import com.hinata.backend.modules.auth.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, Long> {

    boolean existsByRoleId(Long roleId);

    boolean existsByUserIdAndRoleId(Long userId, Long roleId);

    @Query("""
            select r.name
              from UserRole ur
              join ur.role r
             where ur.user.id = :userId
             order by r.name
            """)
    List<String> findRoleNamesByUserId(@Param("userId") Long userId);
}
