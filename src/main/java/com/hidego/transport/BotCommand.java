package com.hidego.transport;

public record BotCommand(String command, String description) {}
