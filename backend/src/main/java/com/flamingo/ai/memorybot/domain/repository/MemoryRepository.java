package com.flamingo.ai.memorybot.domain.repository;

import com.flamingo.ai.memorybot.domain.entity.Memory;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Memory entities. */
@Repository
public interface MemoryRepository extends JpaRepository<Memory, UUID> {

  /** Finds a memory only if it belongs to the given user. */
  Optional<Memory> findByIdAndUserId(UUID id, UUID userId);
}
