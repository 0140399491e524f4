package com.gentoro.onesync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/** The rules singleton document as loaded from a source. */
public record RuleSet(List<Rule> rules) {

  public RuleSet {
    rules = List.copyOf(Objects.requireNonNullElse(rules, List.of()));
  }

  public static RuleSet empty() {
    return new RuleSet(List.of());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return rules.isEmpty();
  }
}
