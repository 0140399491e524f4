package com.gentoro.onesync.sync;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.MutableClock;
import com.gentoro.onesync.config.ScheduleMode;
import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.http.OkHttpFactory;
import com.gentoro.onesync.model.SyncStatus;
import com.gentoro.onesync.source.FakeGitHub;
import com.gentoro.onesync.source.RemoteSourceLoader;
import com.gentoro.onesync.store.ContentStore;
import com.gentoro.onesync.store.InMemoryDocumentStorage;
import java.time.Duration;
import java.time.Instant;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentMirrorTest {

  private static final String API = "https://api.test/repos/acme/content/contents/.claude/";
  private static final String RAW = "https://raw.test/acme/content/master/.claude/";

  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
  private FakeGitHub github;
  private ContentStore store;
  private SyncService service;
  private ContentMirror mirror;

  @BeforeEach
  void setUp() {
    github = new FakeGitHub();
    github.ok(
        API + "commands?ref=master",
        "[{\"name\": \"build.md\", \"path\": \".claude/commands/build.md\", \"type\": \"file\"}]");
    github.ok(RAW + "commands/build.md", "**Purpose**: Build\nBuild $TARGET");
    github.ok(
        RAW + "shared/superclaude-personas.yml",
        "All_Personas:\n  architect:\n    Identity: \"Architect | Planner\"\n");

    OkHttpClient client = OkHttpFactory.create().newBuilder().addInterceptor(github).build();
    SyncConfiguration.Remote remote =
        new SyncConfiguration.Remote(
            "https://github.com/acme/content",
            "master",
            5,
            ".claude",
            "https://api.test",
            "https://raw.test");

    store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();
    service =
        new SyncService(
            new RemoteSourceLoader(remote, client, clock),
            store,
            Duration.ofMinutes(30),
            ScheduleMode.FIXED_RATE,
            clock);
    mirror = new ContentMirror(service);
  }

  @AfterEach
  void tearDown() {
    service.close();
    store.close();
  }

  @Test
  void missingRulesFileStillCountsAsSuccess() {
    SyncResult result = mirror.triggerSync();

    assertEquals(SyncStatus.SUCCESS, result.status());
    assertEquals(1, mirror.getAllCommands().size());
    assertEquals(1, mirror.getAllPersonas().size());
    assertTrue(mirror.getAllRules().isEmpty());
    assertEquals(clock.instant(), mirror.getLastSync());
    assertTrue(mirror.getSyncMetadata().isSuccess());
    assertTrue(mirror.getUnparsedFiles().isEmpty());
  }

  @Test
  void triggerSyncBypassesTheResponseCache() {
    mirror.triggerSync();
    mirror.triggerSync();

    assertEquals(2, github.hits(API + "commands?ref=master"));
  }

  @Test
  void scheduledPassesReuseCachedResponses() {
    service.syncFromSource();
    service.syncFromSource();

    assertEquals(1, github.hits(API + "commands?ref=master"));
  }

  @Test
  void snapshotReflectsStoredContent() {
    mirror.triggerSync();

    assertEquals("architect", mirror.loadFromDatabase().personas().keySet().iterator().next());
    assertEquals("build", mirror.loadFromDatabase().commands().get(0).id());
  }
}
