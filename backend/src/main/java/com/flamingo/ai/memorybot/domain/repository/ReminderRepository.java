package com.flamingo.ai.memorybot.domain.repository;

import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.ReminderStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Reminder entities. */
@Repository
public interface ReminderRepository extends JpaRepository<Reminder, UUID> {

  /** Pending reminders whose time has come, earliest first. */
  @Query(
      "SELECT r FROM Reminder r WHERE r.status = "
          + "com.flamingo.ai.memorybot.domain.enums.ReminderStatus.PENDING "
          + "AND r.scheduledFor <= :now ORDER BY r.scheduledFor ASC, r.createdAt ASC")
  List<Reminder> findDue(@Param("now") Instant now);

  /**
   * Moves a pending reminder to {@code target}. Has no effect once the reminder is terminal.
   *
   * @return 1 if the transition happened, 0 otherwise
   */
  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Reminder r SET r.status = :target, r.updatedAt = :now WHERE r.id = :id "
          + "AND r.status = com.flamingo.ai.memorybot.domain.enums.ReminderStatus.PENDING")
  int transitionFromPending(
      @Param("id") UUID id, @Param("target") ReminderStatus target, @Param("now") Instant now);

  /** Cancels a pending reminder only if it belongs to {@code ownerId}. */
  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Reminder r SET r.status = "
          + "com.flamingo.ai.memorybot.domain.enums.ReminderStatus.CANCELLED, "
          + "r.updatedAt = :now WHERE r.id = :id AND r.ownerId = :ownerId "
          + "AND r.status = com.flamingo.ai.memorybot.domain.enums.ReminderStatus.PENDING")
  int cancelIfPending(
      @Param("id") UUID id, @Param("ownerId") UUID ownerId, @Param("now") Instant now);

  List<Reminder> findByOwnerIdOrderByScheduledForAsc(UUID ownerId);

  List<Reminder> findByOwnerIdAndStatusOrderByScheduledForAsc(UUID ownerId, ReminderStatus status);

  long countByOwnerId(UUID ownerId);

  long countByStatus(ReminderStatus status);

  long countByOwnerIdAndStatus(UUID ownerId, ReminderStatus status);

  /** Reminders in {@code status} scheduled in {@code [from, to)}. */
  long countByStatusAndScheduledForGreaterThanEqualAndScheduledForLessThan(
      ReminderStatus status, Instant from, Instant to);

  long countByOwnerIdAndStatusAndScheduledForGreaterThanEqualAndScheduledForLessThan(
      UUID ownerId, ReminderStatus status, Instant from, Instant to);
}
