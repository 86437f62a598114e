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
 * 사용자-조직 매핑 엔터티. 조직 스코프 역할을 정확히 하나 가진다.
 */
@Entity
@Table(
        name = "organization_users",
        uniqueConstraints = @UniqueConstraint(name = "uq_organization_users_org_user", columnNames = {"organization_id", "user_id"})
)
public class OrganizationUser extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organization_id", nullable = false)
    private Organization organization;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    protected OrganizationUser() {
    }

    public OrganizationUser(Organization organization, AppUser user, Role role) {
        this.organization = organization;
        this.user = user;
        this.role = role;
    }

    public Long getId() {
        return id;
    }

    public Organization getOrganization() {
        return organization;
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
