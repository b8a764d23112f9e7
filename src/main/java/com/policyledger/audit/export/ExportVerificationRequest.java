package com.policyledger.audit.export;

/** An export's content and signature, checked against an X.509 PEM public key. */
public record ExportVerificationRequest(String content, ExportSignature signature, String publicKey) {}
