package com.conciliator.engine.services.statements.model;

public record AccountMetadata(String id, String companyId, String tenantId) {
}
