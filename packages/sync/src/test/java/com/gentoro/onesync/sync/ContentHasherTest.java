package com.gentoro.onesync.sync;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.model.Command;
import com.gentoro.onesync.model.CommandArgument;
import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.Persona;
import com.gentoro.onesync.model.PersonaModel;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashIsStableLowercaseSha256() {
    Command command = new Command("build", "Build project", "Build it");

    String first = ContentHasher.hash(command);
    String second = ContentHasher.hash(new Command("build", "Build project", "Build it"));

    assertEquals(first, second);
    assertTrue(first.matches("[0-9a-f]{64}"));
  }

  @Test
  void knownDigest() {
    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        ContentHasher.sha256Hex("abc"));
  }

  @Test
  void anyContentFieldChangesTheHash() {
    Command base = new Command("build", "Build project", "Build it");

    assertNotEquals(
        ContentHasher.hash(base), ContentHasher.hash(new Command("build", "Build", "Build it")));
    assertNotEquals(
        ContentHasher.hash(base),
        ContentHasher.hash(
            new Command(
                "build",
                "Build project",
                "Build it",
                null,
                List.of(new CommandArgument("TARGET", null, true)))));
  }

  @Test
  void persistedFieldsDoNotAffectTheHash() {
    Persona persona = new Persona("architect", "d", "i");
    PersonaModel stored = PersonaModel.of(persona, "whatever", Instant.EPOCH);

    assertEquals(ContentHasher.hash(persona), ContentHasher.hash(stored.toContent()));
  }

  @Test
  void absentOptionalFieldsAreOmittedNotNulled() {
    CommandModel model =
        CommandModel.of(new Command("build", "d", "p", null, null), "h", Instant.EPOCH);

    assertEquals(
        ContentHasher.hash(new Command("build", "d", "p")), ContentHasher.hash(model.toContent()));
  }
}
