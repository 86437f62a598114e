package com.hinata.backend.modules.organization.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.hinata.backend.modules.organization.domain.OrganizationUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationUserRepository extends JpaRepository<OrganizationUser, Long> {

    boolean existsByRoleId(Long roleId);

    boolean existsByUserIdAndOrganizationId(Long userId, Long organizationId);

    @Query("""
            select ou
              from OrganizationUser ou
              join fetch ou.organization o
              join fetch ou.role r
             where ou.user.id = :userId
               and o.id = :organizationId
            """)
    Optional<OrganizationUser> findMembership(@Param("userId") Long userId,
                                              @Param("organizationId") Long organizationId);

    @Query("""
            select ou
              from OrganizationUser ou
              join fetch ou.organization o
             where ou.user.id = :userId
             order by o.id
            """)
    List<OrganizationUser> findAllByUserId(@Param("userId") Long userId);
}
