package com.engagewatch.watch.channel;

public record NotificationMessage(String title, String text, String html, String link) {}
