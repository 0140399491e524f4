package com.gentoro.onesync.utility;

import com.gentoro.onesync.exception.ExceptionUtil;
import com.gentoro.onesync.sync.SyncResult;
import java.io.PrintStream;

public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String yellow = "\u001B[33m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  private static PrintStream out = System.out;

  public static void printNewLine(String message) {
    out.printf("%s%n", message);
  }

  public static void printSuccessLine(String message) {
    out.print("✅ ");
    for (String line : message.split("\n")) {
      out.printf("%s%s%s%n", green, line, reset);
    }
  }

  public static void printWarningLine(String message) {
    out.print("⚠️ ");
    for (String line : message.split("\n")) {
      out.printf("%s%s%s%n", yellow, line, reset);
    }
  }

  public static void printError(String message, Throwable cause) {
    out.printf("❌ %s%s%s%n", red, message, reset);
    if (cause != null) {
      for (String line : ExceptionUtil.formatCompactStackTrace(cause).split(" > ")) {
        out.printf("  %s%s%s%n", red, line, reset);
      }
    }
  }

  /** One-line outcome of a pass, coloured by status. */
  public static void printSyncResult(SyncResult result) {
    if (result.skipped()) {
      printWarningLine("Sync skipped: another pass is already running");
    } else if (result.isSuccess()) {
      printSuccessLine(
          "Sync completed in %d ms: %d commands, %d personas, %d rules updated"
              .formatted(
                  result.duration().toMillis(),
                  result.commandsUpdated(),
                  result.personasUpdated(),
                  result.rulesUpdated()));
    } else {
      printError("Sync completed with errors: " + String.join("; ", result.errors()), null);
    }
  }

  static void redirect(PrintStream stream) {
    out = stream;
  }
}
