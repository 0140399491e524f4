package com.gentoro.onesync.model;

import java.time.Instant;

public record PersonaModel(
    String id,
    String hash,
    Instant lastUpdated,
    String name,
    String description,
    String instructions)
    implements ContentModel<Persona> {

  public static PersonaModel of(Persona persona, String hash, Instant lastUpdated) {
    return new PersonaModel(
        persona.name(),
        hash,
        lastUpdated,
        persona.name(),
        persona.description(),
        persona.instructions());
  }

  @Override
  public Persona toContent() {
    return new Persona(name, description, instructions);
  }
}
