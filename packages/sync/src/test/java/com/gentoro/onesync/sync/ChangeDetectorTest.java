package com.gentoro.onesync.sync;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.MutableClock;
import com.gentoro.onesync.model.Rule;
import com.gentoro.onesync.model.RuleModel;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChangeDetectorTest {

  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

  private final MutableClock clock = new MutableClock(T0.plus(Duration.ofHours(1)));
  private final ChangeDetector detector = new ChangeDetector(clock);

  private static RuleModel stored(Rule rule) {
    return RuleModel.of(rule, ContentHasher.hash(rule), T0);
  }

  @Test
  void unchangedItemKeepsItsTimestamp() {
    Rule rule = new Rule("KISS", "Keep it simple");

    ChangeDetector.ChangeSet<RuleModel> changes =
        detector.detect(List.of(rule), List.of(stored(rule)), RuleModel::of);

    assertEquals(0, changes.updated());
    assertEquals(T0, changes.models().get(0).lastUpdated());
  }

  @Test
  void changedItemGetsNewHashAndTimestamp() {
    Rule before = new Rule("KISS", "Keep it simple");
    Rule after = new Rule("KISS", "Keep it simple, always");

    ChangeDetector.ChangeSet<RuleModel> changes =
        detector.detect(List.of(after), List.of(stored(before)), RuleModel::of);

    RuleModel model = changes.models().get(0);
    assertEquals(1, changes.updated());
    assertEquals(clock.instant(), model.lastUpdated());
    assertEquals(ContentHasher.hash(after), model.hash());
  }

  @Test
  void newItemIsStampedWithNow() {
    ChangeDetector.ChangeSet<RuleModel> changes =
        detector.detect(List.of(new Rule("DRY", "Do not repeat")), List.of(), RuleModel::of);

    assertEquals(1, changes.updated());
    assertEquals("DRY", changes.models().get(0).id());
    assertEquals(clock.instant(), changes.models().get(0).lastUpdated());
  }

  @Test
  void storedItemsMissingFromSourceAreNotReturned() {
    Rule kept = new Rule("KISS", "Keep it simple");
    Rule stale = new Rule("YAGNI", "Not needed");

    ChangeDetector.ChangeSet<RuleModel> changes =
        detector.detect(List.of(kept), List.of(stored(kept), stored(stale)), RuleModel::of);

    assertEquals(List.of("KISS"), changes.models().stream().map(RuleModel::id).toList());
  }
}
