package com.hinata.backend.modules.organization.domain;

import com.hinata.backend.global.jpa.AbstractAuditedEntity;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.rbac.domain.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * 사용자-팀 매핑 엔터티.
 */
@Entity
@Table(
        name = "team_members",
        uniqueConstraints = @UniqueConstraint(name = "uq_team_members_team_user", columnNames = {"team_id", "user_id"})
)
public class TeamMember extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "team_id", nullable = false)
    private Team team;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    protected TeamMember() {
    }

    public TeamMember(Team team, AppUser user, Role role) {
        this.team = team;
        this.user = user;
        this.role = role;
    }

    public Long getId() {
        return id;
    }

    public Team getTeam() {
        return team;
    }

    public AppUser getUser() {
        return user;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }
}
