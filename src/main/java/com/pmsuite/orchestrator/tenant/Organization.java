package com.pmsuite.orchestrator.tenant;

public record Organization(String id, String name, String description, String ownerId) {
}
