package org.carball.rlsguard.model.analysis;

public record PolicyIssue(Severity severity, String message, String suggestion) {
}
