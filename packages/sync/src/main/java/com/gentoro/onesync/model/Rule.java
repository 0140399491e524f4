package com.gentoro.onesync.model;

public record Rule(String name, String content) implements ContentItem {}
