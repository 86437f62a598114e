package com.hinata.backend.modules.rbac.infrastructure.persistence;

import java.util.Optional;

import com.hinata.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, Long> {

    Optional<Permission> findByName(String name);

    boolean existsByName(String name);

    boolean existsBySlug(String slug);
}
