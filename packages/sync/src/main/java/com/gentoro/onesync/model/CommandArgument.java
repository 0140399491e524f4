package com.gentoro.onesync.model;

public record CommandArgument(String name, String description, boolean required) {}
