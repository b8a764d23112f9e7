package com.policyledger.audit.export;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportResult(
    String content,
    ExportMetadata metadata,
    ExportSignature signature,
    String contentType,
    String filename
) {}
