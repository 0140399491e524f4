package com.gentoro.onesync.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the mirror, with personas keyed by id for direct lookup.
 *
 * @param commands every stored command
 * @param personas every stored persona keyed by id, in store order
 * @param rules every stored rule
 */
public record MirrorSnapshot(
    List<CommandModel> commands, Map<String, PersonaModel> personas, List<RuleModel> rules) {}
