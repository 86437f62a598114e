package com.hinata.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.hinata.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByEmailIgnoreCase(String email);
}
