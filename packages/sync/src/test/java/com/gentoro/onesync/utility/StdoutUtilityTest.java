package com.gentoro.onesync.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.model.SyncStatus;
import com.gentoro.onesync.sync.SyncResult;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StdoutUtilityTest {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  @BeforeEach
  void capture() {
    StdoutUtility.redirect(new PrintStream(buffer, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void restore() {
    StdoutUtility.redirect(System.out);
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void successfulPassPrintsCounts() {
    StdoutUtility.printSyncResult(
        new SyncResult(SyncStatus.SUCCESS, 2, 1, 0, List.of(), Duration.ofMillis(42), false));

    assertTrue(output().startsWith("✅ "));
    assertTrue(output().contains("Sync completed in 42 ms: 2 commands, 1 personas, 0 rules updated"));
  }

  @Test
  void failedPassPrintsJoinedErrors() {
    StdoutUtility.printSyncResult(
        new SyncResult(
            SyncStatus.FAILED, 0, 0, 0, List.of("Commands: a", "Rules: b"), Duration.ZERO, false));

    assertTrue(output().startsWith("❌ "));
    assertTrue(output().contains("Sync completed with errors: Commands: a; Rules: b"));
  }

  @Test
  void skippedPassIsAWarning() {
    StdoutUtility.printSyncResult(
        new SyncResult(null, 0, 0, 0, List.of(), Duration.ZERO, true));

    assertTrue(output().contains("Sync skipped"));
  }

  @Test
  void errorIncludesCompactStack() {
    StdoutUtility.printError("boom", new IllegalStateException("x"));

    String[] lines = output().split("\n");
    assertTrue(lines[0].contains("boom"));
    assertTrue(lines.length > 1);
    assertTrue(lines[1].contains("StdoutUtilityTest.errorIncludesCompactStack"));
  }
}
