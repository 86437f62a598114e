package com.hinata.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.hinata.backend.modules.rbac.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface RoleRepository extends JpaRepository<Role, Long> {

    Optional<Role> findByName(String name);

    Optional<Role> findBySlug(String slug);

    boolean existsByName(String name);

    boolean existsBySlug(String slug);

    boolean existsByInheritsId(Long inheritsRoleId);

    @Query("""
            select r
              from Role r
              left join fetch r.inherits
             order by r.id
            """)
    List<Role> findAllWithInherits();
}
