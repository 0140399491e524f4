package com.gentoro.onesync.model;

public record Persona(String name, String description, String instructions)
    implements ContentItem {}
