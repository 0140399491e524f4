package com.gentoro.onesync.model;

import java.time.Instant;
import java.util.List;

public record CommandModel(
    String id,
    String hash,
    Instant lastUpdated,
    String name,
    String description,
    String prompt,
    List<CommandMessage> messages,
    List<CommandArgument> arguments)
    implements ContentModel<Command> {

  public static CommandModel of(Command command, String hash, Instant lastUpdated) {
    return new CommandModel(
        command.name(),
        hash,
        lastUpdated,
        command.name(),
        command.description(),
        command.prompt(),
        command.messages(),
        command.arguments());
  }

  @Override
  public Command toContent() {
    return new Command(name, description, prompt, messages, arguments);
  }
}
