package com.gentoro.onesync.model;

public record CommandMessage(String role, String content) {}
