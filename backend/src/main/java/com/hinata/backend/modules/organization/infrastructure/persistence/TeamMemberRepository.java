package com.hinata.backend.modules.organization.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.hinata.backend.modules.organization.domain.TeamMember;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamMemberRepository extends JpaRepository<TeamMember, Long> {

    boolean existsByRoleId(Long roleId);

    @Query("""
            select tm
              from TeamMember tm
              join fetch tm.team t
              join fetch t.organization
              join fetch tm.role
             where tm.user.id = :userId
               and t.id = :teamId
            """)
    Optional<TeamMember> findMembership(@Param("userId") Long userId, @Param("teamId") Long teamId);

    @Query("""
            select tm
              from TeamMember tm
              join fetch tm.team t
              join fetch t.organization
             where tm.user.id = :userId
             order by t.id
            """)
    List<TeamMember> findAllByUserId(@Param("userId") Long userId);

    @Query("""
            select tm
              from TeamMember tm
              join fetch tm.user
              join fetch tm.role
             where tm.team.id = :teamId
             order by tm.id
            """)
    List<TeamMember> findAllByTeamId(@Param("teamId") Long teamId);
}
