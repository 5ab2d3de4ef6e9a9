package com.drinkjoy.catalog.application.health;

import java.time.Instant;

public record Alert(AlertLevel level, String message, Instant timestamp) {}
