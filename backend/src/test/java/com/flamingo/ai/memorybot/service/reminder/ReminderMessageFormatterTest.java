package com.flamingo.ai.memorybot.service.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.domain.entity.Memory;
import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.MemoryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReminderMessageFormatterTest {

  private ReminderMessageFormatter formatter;
  private Reminder reminder;

  @BeforeEach
  void setUp() {
    MemoryBotConfig config = new MemoryBotConfig();
    config.getReminders().setMemoryPreviewLength(10);
    formatter = new ReminderMessageFormatter(config);
    reminder = Reminder.builder().message("Take the pills").build();
  }

  @Test
  @DisplayName("should include message, truncated memory preview and type")
  void shouldIncludeMemoryPreview() {
    Memory memory =
        Memory.builder().content("Doctor said twice a day").memoryType(MemoryType.AUDIO).build();

    String text = formatter.format(reminder, memory);

    assertThat(text)
        .startsWith("*Reminder*")
        .contains("Take the pills")
        .contains("\"Doctor sai...\"")
        .contains("Type: AUDIO")
        .endsWith(ReminderMessageFormatter.FOOTER);
  }

  @Test
  @DisplayName("should keep short memories intact")
  void shouldKeepShortMemory() {
    Memory memory = Memory.builder().content("Short").memoryType(MemoryType.TEXT).build();

    assertThat(formatter.format(reminder, memory)).contains("\"Short\"").doesNotContain("...");
  }

  @Test
  @DisplayName("should omit the memory section when the memory is gone")
  void shouldOmitMissingMemory() {
    assertThat(formatter.format(reminder, null))
        .contains("Take the pills")
        .doesNotContain("Related Memory");
  }
}
