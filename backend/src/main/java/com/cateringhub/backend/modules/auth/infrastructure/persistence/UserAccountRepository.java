package com.cateringhub.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.cateringhub.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {
}
