package com.flamingo.ai.memorybot.service.reminder;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.domain.entity.Memory;
import com.flamingo.ai.memorybot.domain.entity.Reminder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Renders the WhatsApp text delivered for a due reminder. */
@Component
@RequiredArgsConstructor
public class ReminderMessageFormatter {

  static final String FOOTER = "_Scheduled reminder delivered_";

  private final MemoryBotConfig config;

  /**
   * Formats the message body.
   *
   * @param reminder the due reminder
   * @param memory the linked memory, or null when it no longer exists
   */
  public String format(Reminder reminder, Memory memory) {
    StringBuilder sb = new StringBuilder();
    sb.append("*Reminder*\n\n");
    sb.append(reminder.getMessage()).append("\n\n");
    if (memory != null) {
      sb.append("*Related Memory:*\n\"").append(preview(memory.getContent())).append("\"\n\n");
      sb.append("Type: ").append(memory.getMemoryType()).append("\n\n");
    }
    sb.append(FOOTER);
    return sb.toString();
  }

  String preview(String content) {
    int limit = config.getReminders().getMemoryPreviewLength();
    if (content == null) {
      return "";
    }
    return content.length() > limit ? content.substring(0, limit) + "..." : content;
  }
}
