package com.nevis.vendors.event;

import java.util.UUID;

public record PlanRequestedEvent(UUID runId) {}
