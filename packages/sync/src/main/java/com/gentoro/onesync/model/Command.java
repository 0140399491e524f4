package com.gentoro.onesync.model;

import java.util.List;

/**
 * A prompt template exposed as a command.
 *
 * @param name natural name, also used as the persisted id
 * @param description short human-readable purpose
 * @param prompt the prompt template body
 * @param messages optional pre-baked conversation messages, {@code null} when absent
 * @param arguments optional typed arguments, {@code null} when absent
 */
public record Command(
    String name,
    String description,
    String prompt,
    List<CommandMessage> messages,
    List<CommandArgument> arguments)
    implements ContentItem {

  public Command(String name, String description, String prompt) {
    this(name, description, prompt, null, null);
  }
}
