package com.example.platformsync.model;

import java.time.Duration;

public record RunSummary(
        int succeeded,
        int failed,
        int skipped,
        Duration elapsed) {

    public int total() {
        return succeeded + failed + skipped;
    }
}
