package com.flamingo.ai.memorybot.domain.repository;

import com.flamingo.ai.memorybot.domain.entity.AppUser;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for bot users. */
@Repository
public interface UserRepository extends JpaRepository<AppUser, UUID> {

  Optional<AppUser> findByPhoneNumber(String phoneNumber);
}
