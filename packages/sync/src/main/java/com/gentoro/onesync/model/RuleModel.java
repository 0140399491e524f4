package com.gentoro.onesync.model;

import java.time.Instant;

public record RuleModel(String id, String hash, Instant lastUpdated, String name, String content)
    implements ContentModel<Rule> {

  public static RuleModel of(Rule rule, String hash, Instant lastUpdated) {
    return new RuleModel(rule.name(), hash, lastUpdated, rule.name(), rule.content());
  }

  @Override
  public Rule toContent() {
    return new Rule(name, content);
  }
}
