package com.flamingo.ai.memorybot.service.reminder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.domain.entity.AppUser;
import com.flamingo.ai.memorybot.domain.entity.Memory;
import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.MemoryType;
import com.flamingo.ai.memorybot.domain.enums.ReminderStatus;
import com.flamingo.ai.memorybot.domain.repository.MemoryRepository;
import com.flamingo.ai.memorybot.domain.repository.ReminderRepository;
import com.flamingo.ai.memorybot.domain.repository.UserRepository;
import com.flamingo.ai.memorybot.exception.MemoryNotFoundException;
import com.flamingo.ai.memorybot.exception.MessageDeliveryException;
import com.flamingo.ai.memorybot.exception.UserNotFoundException;
import com.flamingo.ai.memorybot.exception.ValidationException;
import com.flamingo.ai.memorybot.service.messaging.MessagingClient;
import com.flamingo.ai.memorybot.service.time.TimeExpressionParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReminderServiceImplTest {

  private static final Instant NOW = Instant.parse("2024-01-15T15:00:00Z");

  @Mock private ReminderRepository reminderRepository;
  @Mock private MemoryRepository memoryRepository;
  @Mock private UserRepository userRepository;
  @Mock private MessagingClient messagingClient;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private ReminderServiceImpl reminderService;

  private UUID ownerId;
  private UUID memoryId;
  private AppUser user;
  private Memory memory;

  @BeforeEach
  void setUp() {
    MemoryBotConfig config = new MemoryBotConfig();
    reminderService =
        new ReminderServiceImpl(
            reminderRepository,
            memoryRepository,
            userRepository,
            new TimeExpressionParser(TimeExpressionParser.defaultMatchers(LocalTime.of(9, 0))),
            messagingClient,
            new ReminderMessageFormatter(config),
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));

    ownerId = UUID.randomUUID();
    memoryId = UUID.randomUUID();
    user =
        AppUser.builder()
            .id(ownerId)
            .phoneNumber("+15551234567")
            .timezone("America/New_York")
            .build();
    memory =
        Memory.builder()
            .id(memoryId)
            .userId(ownerId)
            .content("Dentist appointment on Main Street")
            .memoryType(MemoryType.TEXT)
            .build();

    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient().when(userRepository.existsById(ownerId)).thenReturn(true);
    lenient().when(userRepository.findById(ownerId)).thenReturn(Optional.of(user));
    lenient()
        .when(memoryRepository.findByIdAndUserId(memoryId, ownerId))
        .thenReturn(Optional.of(memory));
    lenient().when(memoryRepository.findById(memoryId)).thenReturn(Optional.of(memory));
    lenient()
        .when(reminderRepository.save(any(Reminder.class)))
        .thenAnswer(
            inv -> {
              Reminder r = inv.getArgument(0);
              r.setId(UUID.randomUUID());
              return r;
            });
  }

  private Reminder pending(Instant scheduledFor, String message) {
    return Reminder.builder()
        .id(UUID.randomUUID())
        .ownerId(ownerId)
        .memoryId(memoryId)
        .scheduledFor(scheduledFor)
        .message(message)
        .status(ReminderStatus.PENDING)
        .build();
  }

  @Nested
  @DisplayName("create")
  class Create {

    @Test
    @DisplayName("should persist a pending reminder in the future")
    void shouldPersistPending() {
      Instant when = NOW.plus(Duration.ofHours(1));

      Reminder reminder = reminderService.create(ownerId, memoryId, when, "Call the dentist");

      assertThat(reminder.getStatus()).isEqualTo(ReminderStatus.PENDING);
      assertThat(reminder.getScheduledFor()).isEqualTo(when);
      assertThat(reminder.getCreatedAt()).isEqualTo(NOW);
      verify(meterRegistry).counter("reminder.created");
    }

    @Test
    @DisplayName("should reject a time in the past without saving")
    void shouldRejectPast() {
      Instant when = NOW.minusSeconds(1);

      assertThatThrownBy(() -> reminderService.create(ownerId, memoryId, when, "Too late"))
          .isInstanceOf(ValidationException.class)
          .hasMessageContaining("future");
      verify(reminderRepository, never()).save(any());
    }

    @Test
    @DisplayName("should reject the current instant")
    void shouldRejectNow() {
      assertThatThrownBy(() -> reminderService.create(ownerId, memoryId, NOW, "Right now"))
          .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should reject a memory owned by someone else")
    void shouldRejectForeignMemory() {
      UUID otherMemory = UUID.randomUUID();
      when(memoryRepository.findByIdAndUserId(otherMemory, ownerId)).thenReturn(Optional.empty());

      assertThatThrownBy(
              () ->
                  reminderService.create(
                      ownerId, otherMemory, NOW.plus(Duration.ofHours(1)), "Not mine"))
          .isInstanceOf(MemoryNotFoundException.class);
      verify(reminderRepository, never()).save(any());
    }

    @Test
    @DisplayName("should reject an unknown user")
    void shouldRejectUnknownUser() {
      UUID stranger = UUID.randomUUID();

      assertThatThrownBy(
              () -> reminderService.create(stranger, memoryId, NOW.plusSeconds(60), "Hello"))
          .isInstanceOf(UserNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("createFromPhrase")
  class CreateFromPhrase {

    @Test
    @DisplayName("should schedule at the parsed instant in the user's zone")
    void shouldUseUserZone() {
      Optional<Reminder> reminder =
          reminderService.createFromPhrase(
              ownerId, memoryId, "tomorrow at 3 PM", "Dentist", ZoneId.of("America/New_York"));

      assertThat(reminder).isPresent();
      assertThat(reminder.get().getScheduledFor())
          .isEqualTo(Instant.parse("2024-01-16T20:00:00Z"));
    }

    @Test
    @DisplayName("should fall back to the stored timezone when none is given")
    void shouldFallBackToStoredZone() {
      Optional<Reminder> reminder =
          reminderService.createFromPhrase(ownerId, memoryId, "tomorrow", "Dentist", null);

      assertThat(reminder.map(Reminder::getScheduledFor))
          .contains(Instant.parse("2024-01-16T14:00:00Z"));
    }

    @Test
    @DisplayName("should return empty and save nothing for an unparsable phrase")
    void shouldReturnEmptyWhenUnparsable() {
      Optional<Reminder> reminder =
          reminderService.createFromPhrase(
              ownerId, memoryId, "gibberish not a time", "Dentist", ZoneOffset.UTC);

      assertThat(reminder).isEmpty();
      verify(reminderRepository, never()).save(any());
    }
  }

  @Nested
  @DisplayName("cancel")
  class Cancel {

    @Test
    @DisplayName("should report true when the pending reminder was cancelled")
    void shouldCancelPending() {
      UUID reminderId = UUID.randomUUID();
      when(reminderRepository.cancelIfPending(reminderId, ownerId, NOW)).thenReturn(1);

      assertThat(reminderService.cancel(reminderId, ownerId)).isTrue();
      verify(meterRegistry).counter("reminder.cancelled");
    }

    @Test
    @DisplayName("should report false for a reminder that was already sent")
    void shouldNotCancelSent() {
      UUID reminderId = UUID.randomUUID();
      when(reminderRepository.cancelIfPending(reminderId, ownerId, NOW)).thenReturn(0);

      assertThat(reminderService.cancel(reminderId, ownerId)).isFalse();
      verify(reminderRepository, never()).transitionFromPending(any(), any(), any());
      verify(reminderRepository, never()).save(any());
    }
  }

  @Nested
  @DisplayName("processDueReminders")
  class ProcessDue {

    @Test
    @DisplayName("should deliver earlier reminders first and mark them sent")
    void shouldDeliverInOrder() {
      Reminder first = pending(NOW.minusSeconds(120), "First");
      Reminder second = pending(NOW.minusSeconds(60), "Second");
      when(reminderRepository.findDue(NOW)).thenReturn(List.of(first, second));
      when(reminderRepository.transitionFromPending(any(), eq(ReminderStatus.SENT), eq(NOW)))
          .thenReturn(1);

      DeliveryBatchResult result = reminderService.processDueReminders();

      assertThat(result).isEqualTo(new DeliveryBatchResult(2, 2, 0));
      ArgumentCaptor<String> bodies = ArgumentCaptor.forClass(String.class);
      InOrder order = inOrder(messagingClient, reminderRepository);
      order.verify(messagingClient).send(eq("whatsapp:+15551234567"), bodies.capture());
      order
          .verify(reminderRepository)
          .transitionFromPending(first.getId(), ReminderStatus.SENT, NOW);
      order.verify(messagingClient).send(eq("whatsapp:+15551234567"), bodies.capture());
      order.verify(reminderRepository)
          .transitionFromPending(second.getId(), ReminderStatus.SENT, NOW);
      assertThat(bodies.getAllValues().get(0)).contains("First");
      assertThat(bodies.getAllValues().get(1)).contains("Second");
    }

    @Test
    @DisplayName("should cancel a reminder whose delivery fails and continue the batch")
    void shouldCancelOnFailure() {
      Reminder failing = pending(NOW.minusSeconds(120), "Will fail");
      Reminder ok = pending(NOW.minusSeconds(60), "Will pass");
      when(reminderRepository.findDue(NOW)).thenReturn(List.of(failing, ok));
      when(messagingClient.send(anyString(), contains("Will fail")))
          .thenThrow(new MessageDeliveryException("whatsapp:+15551234567", "rejected"));
      when(reminderRepository.transitionFromPending(any(), any(), any())).thenReturn(1);

      DeliveryBatchResult result = reminderService.processDueReminders();

      assertThat(result).isEqualTo(new DeliveryBatchResult(2, 1, 1));
      verify(reminderRepository)
          .transitionFromPending(failing.getId(), ReminderStatus.CANCELLED, NOW);
      verify(reminderRepository, never())
          .transitionFromPending(failing.getId(), ReminderStatus.SENT, NOW);
      verify(reminderRepository).transitionFromPending(ok.getId(), ReminderStatus.SENT, NOW);
      verify(meterRegistry).counter("reminder.failed");
    }

    @Test
    @DisplayName("should keep a delivered reminder out of CANCELLED when the status write fails")
    void shouldNotCancelDeliveredReminder() {
      Reminder delivered = pending(NOW.minusSeconds(60), "Delivered");
      when(reminderRepository.findDue(NOW)).thenReturn(List.of(delivered));
      when(messagingClient.send(anyString(), anyString())).thenReturn("SM123");
      when(reminderRepository.transitionFromPending(
              delivered.getId(), ReminderStatus.SENT, NOW))
          .thenThrow(new DataAccessResourceFailureException("database is locked"));

      DeliveryBatchResult result = reminderService.processDueReminders();

      assertThat(result).isEqualTo(new DeliveryBatchResult(1, 1, 0));
      verify(reminderRepository, never())
          .transitionFromPending(delivered.getId(), ReminderStatus.CANCELLED, NOW);
      verify(meterRegistry, never()).counter("reminder.failed");
      verify(meterRegistry).counter("reminder.sent");
    }

    @Test
    @DisplayName("should not retry a failed reminder on the next pass")
    void shouldNotRetryFailed() {
      Reminder failing = pending(NOW.minusSeconds(60), "Will fail");
      when(reminderRepository.findDue(NOW)).thenReturn(List.of(failing)).thenReturn(List.of());
      when(messagingClient.send(anyString(), anyString()))
          .thenThrow(new MessageDeliveryException("x", "rejected"));

      reminderService.processDueReminders();
      DeliveryBatchResult second = reminderService.processDueReminders();

      assertThat(second).isEqualTo(DeliveryBatchResult.empty());
      verify(messagingClient).send(anyString(), anyString());
    }

    @Test
    @DisplayName("should cancel when the owner no longer exists")
    void shouldCancelWhenOwnerMissing() {
      Reminder orphan = pending(NOW.minusSeconds(60), "Orphan");
      when(userRepository.findById(ownerId)).thenReturn(Optional.empty());
      when(reminderRepository.findDue(NOW)).thenReturn(List.of(orphan));

      DeliveryBatchResult result = reminderService.processDueReminders();

      assertThat(result.failed()).isEqualTo(1);
      verify(messagingClient, never()).send(anyString(), anyString());
      verify(reminderRepository)
          .transitionFromPending(orphan.getId(), ReminderStatus.CANCELLED, NOW);
    }
  }

  @Nested
  @DisplayName("stats")
  class Stats {

    @Test
    @DisplayName("should compute success rate and today's window in the user's zone")
    void shouldComputeUserStats() {
      when(reminderRepository.countByOwnerId(ownerId)).thenReturn(4L);
      when(reminderRepository.countByOwnerIdAndStatus(ownerId, ReminderStatus.PENDING))
          .thenReturn(2L);
      when(reminderRepository.countByOwnerIdAndStatus(ownerId, ReminderStatus.SENT))
          .thenReturn(1L);
      when(reminderRepository.countByOwnerIdAndStatus(ownerId, ReminderStatus.CANCELLED))
          .thenReturn(1L);
      // 10:00 in New York; the local day ends at 05:00Z the next day
      when(reminderRepository
              .countByOwnerIdAndStatusAndScheduledForGreaterThanEqualAndScheduledForLessThan(
                  ownerId, ReminderStatus.PENDING, NOW, Instant.parse("2024-01-16T05:00:00Z")))
          .thenReturn(1L);

      ReminderStats stats = reminderService.stats(ownerId);

      assertThat(stats).isEqualTo(new ReminderStats(4, 2, 1, 1, 1, 0.25));
    }

    @Test
    @DisplayName("should report zero success rate without reminders")
    void shouldHandleEmpty() {
      ReminderStats stats = reminderService.stats(null);

      assertThat(stats.total()).isZero();
      assertThat(stats.successRate()).isZero();
    }
  }

  @Nested
  @DisplayName("resolveZone")
  class ResolveZone {

    @Test
    @DisplayName("should prefer an explicit zone, then the stored one, then UTC")
    void shouldResolveInOrder() {
      assertThat(reminderService.resolveZone(ownerId, "Europe/Paris"))
          .isEqualTo(ZoneId.of("Europe/Paris"));
      assertThat(reminderService.resolveZone(ownerId, null))
          .isEqualTo(ZoneId.of("America/New_York"));
      assertThat(reminderService.resolveZone(UUID.randomUUID(), null)).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("should reject an unknown zone id")
    void shouldRejectUnknownZone() {
      assertThatThrownBy(() -> reminderService.resolveZone(ownerId, "Mars/Olympus"))
          .isInstanceOf(ValidationException.class);
    }
  }
}
