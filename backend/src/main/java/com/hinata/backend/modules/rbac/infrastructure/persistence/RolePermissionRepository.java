package com.hinata.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.hinata.backend.modules.rbac.domain.Permission;
import com.hinata.backend.modules.rbac.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, Long> {

    boolean existsByRoleIdAndPermissionId(Long roleId, Long permissionId);

    boolean existsByPermissionId(Long permissionId);

    Optional<RolePermission> findByRoleIdAndPermissionId(Long roleId, Long permissionId);

    @Query("""
            select new com.hinata.backend.modules.rbac.infrastructure.persistence.RoleGrantRow(r.scope, r.name, p.name)
              from RolePermission rp
              join rp.role r
              join rp.permission p
             order by r.id, p.id
            """)
    List<RoleGrantRow> findAllGrantRows();

    @Query("""
            select p
              from RolePermission rp
              join rp.permission p
             where rp.role.id = :roleId
             order by p.name
            """)
    List<Permission> findPermissionsByRoleId(@Param("roleId") Long roleId);

    @Modifying
    @Query("delete from RolePermission rp where rp.role.id = :roleId")
    int deleteByRoleId(@Param("roleId") Long roleId);
}
