package com.policyledger.api;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ActorType;
import com.policyledger.audit.AuditEntryInput;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditLogMetadata;
import com.policyledger.audit.AuditLogService;
import com.policyledger.audit.AuditQuery;
import com.policyledger.audit.AuditQueryResult;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.audit.ResourceType;
import com.policyledger.audit.SortOrder;
import com.policyledger.audit.export.AuditLogExportService;
import com.policyledger.audit.export.ExportOptions;
import com.policyledger.audit.export.ExportResult;
import com.policyledger.audit.export.ExportVerificationRequest;
import com.policyledger.chain.ChainHealthStats;
import com.policyledger.chain.ChainIntegrityException;
import com.policyledger.chain.ChainVerificationResult;
import com.policyledger.chain.VerificationOptions;
import com.policyledger.chain.VerificationReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only access to a tenant's audit log. There are no update or delete endpoints.
 */
@RestController
@RequestMapping("/v1/audit/{tenantId}")
public class AuditController {

    private final AuditLogService auditLogService;
    private final AuditLogExportService exportService;

    public AuditController(AuditLogService auditLogService, AuditLogExportService exportService) {
        this.auditLogService = auditLogService;
        this.exportService = exportService;
    }

    @PostMapping("/entries")
    @ResponseStatus(HttpStatus.CREATED)
    public AuditLogEntry append(@PathVariable String tenantId, @RequestBody AuditEntryInput input) {
        return auditLogService.append(tenantId, input);
    }

    @PostMapping("/entries/batch")
    @ResponseStatus(HttpStatus.CREATED)
    public AuditLogService.BatchAppendResult appendBatch(@PathVariable String tenantId,
                                                         @RequestBody List<AuditEntryInput> inputs) {
        return auditLogService.appendBatch(tenantId, inputs);
    }

    @GetMapping("/entries")
    public AuditQueryResult query(@PathVariable String tenantId,
                                  @RequestParam(required = false) List<String> category,
                                  @RequestParam(required = false) List<String> actionType,
                                  @RequestParam(required = false) List<String> outcome,
                                  @RequestParam(required = false) List<String> tag,
                                  @RequestParam(required = false) String actorId,
                                  @RequestParam(required = false) String actorType,
                                  @RequestParam(required = false) String resourceType,
                                  @RequestParam(required = false) String resourceId,
                                  @RequestParam(required = false) String traceId,
                                  @RequestParam(required = false) String runId,
                                  @RequestParam(required = false) String requestId,
                                  @RequestParam(required = false) Instant startTime,
                                  @RequestParam(required = false) Instant endTime,
                                  @RequestParam(required = false) Long startSequence,
                                  @RequestParam(required = false) Long endSequence,
                                  @RequestParam(defaultValue = "false") boolean highRiskOnly,
                                  @RequestParam(required = false) String search,
                                  @RequestParam(defaultValue = "100") int limit,
                                  @RequestParam(defaultValue = "0") int offset,
                                  @RequestParam(defaultValue = "desc") String order,
                                  @RequestParam(defaultValue = "false") boolean verify) {
        AuditQuery.Builder builder = AuditQuery.forTenant(tenantId)
            .actorId(actorId)
            .actorType(actorType == null ? null : ActorType.fromValue(actorType))
            .resourceType(resourceType == null ? null : ResourceType.fromValue(resourceType))
            .resourceId(resourceId)
            .traceId(traceId)
            .runId(runId)
            .requestId(requestId)
            .timeRange(startTime, endTime)
            .sequenceRange(startSequence, endSequence)
            .highRiskOnly(highRiskOnly)
            .searchText(search)
            .limit(limit)
            .offset(offset)
            .order(SortOrder.fromValue(order))
            .includeChainVerification(verify);
        if (category != null) {
            builder.categories(category.stream().map(ActionCategory::fromValue).toList());
        }
        if (actionType != null) {
            builder.actionTypes(actionType);
        }
        if (outcome != null) {
            builder.outcomes(outcome.stream().map(OutcomeStatus::fromValue).toList());
        }
        if (tag != null) {
            builder.tags(tag);
        }
        return auditLogService.query(builder.build());
    }

    @GetMapping("/entries/{entryId}")
    public AuditLogEntry entry(@PathVariable String tenantId, @PathVariable String entryId) {
        return auditLogService.getEntry(tenantId, entryId);
    }

    @GetMapping("/sequence/{sequence}")
    public AuditLogEntry entryAt(@PathVariable String tenantId, @PathVariable long sequence) {
        return auditLogService.getEntryBySequence(tenantId, sequence);
    }

    @GetMapping("/metadata")
    public AuditLogMetadata metadata(@PathVariable String tenantId) {
        return auditLogService.metadata(tenantId);
    }

    /**
     * Verifies the chain. With {@code strict=true} a broken chain is reported as a
     * 409 error instead of a result body with {@code valid=false}.
     */
    @GetMapping("/verify")
    public ChainVerificationResult verify(@PathVariable String tenantId,
                                          @RequestParam(required = false) Long fromSequence,
                                          @RequestParam(required = false) Long toSequence,
                                          @RequestParam(defaultValue = "false") boolean strict) {
        if (strict && fromSequence == null && toSequence == null) {
            return auditLogService.assertIntegrity(tenantId);
        }
        ChainVerificationResult result = auditLogService.verifyIntegrity(tenantId, fromSequence, toSequence);
        if (strict && !result.valid()) {
            throw new ChainIntegrityException(
                auditLogService.metadata(tenantId).logId(), result);
        }
        return result;
    }

    /** Every integrity issue in the range, most severe first, with health figures. */
    @GetMapping("/verify/report")
    public VerificationReport verifyReport(@PathVariable String tenantId,
                                           @RequestParam(required = false) Long fromSequence,
                                           @RequestParam(required = false) Long toSequence,
                                           @RequestParam(defaultValue = "false") boolean includeEntryDetails,
                                           @RequestParam(defaultValue = "false") boolean stopOnFirstError,
                                           @RequestParam(defaultValue = "false") boolean verifyTimestamps,
                                           @RequestParam(required = false) Integer maxEntries) {
        return auditLogService.verifyReport(tenantId, new VerificationOptions(fromSequence, toSequence,
            includeEntryDetails, stopOnFirstError, verifyTimestamps, maxEntries));
    }

    @GetMapping("/health")
    public ChainHealthStats health(@PathVariable String tenantId) {
        return auditLogService.chainHealth(tenantId);
    }

    /** The tenant in the path wins over any tenant in the body. */
    @PostMapping("/export")
    public ExportResult export(@PathVariable String tenantId, @RequestBody ExportOptions options) {
        if (options == null || options.format() == null) {
            throw new IllegalArgumentException("format is required");
        }
        return exportService.export(options.withTenantId(tenantId));
    }

    @PostMapping("/export/verify")
    public Map<String, Object> verifyExport(@PathVariable String tenantId,
                                            @RequestBody ExportVerificationRequest request) {
        if (request.signature() == null) {
            throw new IllegalArgumentException("signature is required");
        }
        boolean valid = exportService.verifySignature(request.content(), request.signature(), request.publicKey());
        return Map.of("valid", valid, "key_id", String.valueOf(request.signature().keyId()));
    }

    @PostMapping("/seal")
    public AuditLogMetadata seal(@PathVariable String tenantId,
                                 @RequestBody(required = false) Map<String, Object> request) {
        Object reason = request == null ? null : request.get("reason");
        return auditLogService.seal(tenantId, reason == null ? null : String.valueOf(reason));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String tenantId,
                             @RequestParam(required = false) String category,
                             @RequestParam(defaultValue = "false") boolean highRiskOnly) {
        ActionCategory wanted = category == null ? null : ActionCategory.fromValue(category);
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = auditLogService.subscribe(entry -> {
            if (!tenantId.equals(entry.tenantId())
                || (wanted != null && wanted != entry.action().category())
                || (highRiskOnly && !entry.highRisk())) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .id(String.valueOf(entry.chain().sequence()))
                    .name("audit-entry")
                    .data(entry));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> auditLogService.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> auditLogService.unsubscribe(subscriptionId));
        emitter.onError(ex -> auditLogService.unsubscribe(subscriptionId));
        return emitter;
    }
}
