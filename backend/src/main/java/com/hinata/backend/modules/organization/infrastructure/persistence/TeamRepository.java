package com.hinata.backend.modules.organization.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.hinata.backend.modules.organization.domain.Team;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamRepository extends JpaRepository<Team, Long> {

    boolean existsByOrganizationIdAndNameIgnoreCase(Long organizationId, String name);

    @Query("""
            select t
              from Team t
              join fetch t.organization
             where t.id = :teamId
            """)
    Optional<Team> findWithOrganizationById(@Param("teamId") Long teamId);

    @Query("""
            select t
              from Team t
              join fetch t.organization o
             where o.id = :organizationId
             order by t.name
            """)
    List<Team> findAllByOrganizationId(@Param("organizationId") Long organizationId);
}
