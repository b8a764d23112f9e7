package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationConfig(
    List<NotificationChannel> channels,
    List<String> recipients,
    String template,
    Severity severity
) {

    public NotificationConfig {
        severity = severity == null ? Severity.INFO : severity;
    }
}
