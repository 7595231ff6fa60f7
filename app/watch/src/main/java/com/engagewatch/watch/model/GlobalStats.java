package com.engagewatch.watch.model;

public record GlobalStats(
    long trackedResources,
    long openResources,
    long openings,
    long checksToday,
    CheckSummary checks) {}
