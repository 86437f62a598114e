package com.hinata.backend.modules.organization.infrastructure.persistence;

import com.hinata.backend.modules.organization.domain.Organization;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationRepository extends JpaRepository<Organization, Long> {
}
