package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a policy decision may look at. Built fresh for each evaluation and
 * never mutated; time windows use {@code context.timestamp}, not the wall clock.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationRequest(
    Actor actor,
    Action action,
    Resource resource,
    RequestContext context,
    Map<String, Object> attributes,
    List<ExistingApproval> approvals,
    List<String> requiredScopes
) {

    public EvaluationRequest {
        context = context == null ? new RequestContext(Instant.now(), null, null, null) : context;
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        approvals = approvals == null ? List.of() : List.copyOf(approvals);
        requiredScopes = requiredScopes == null ? List.of() : List.copyOf(requiredScopes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Actor(String id, String type, List<String> roles, List<String> teams) {

        public Actor {
            roles = roles == null ? List.of() : List.copyOf(roles);
            teams = teams == null ? List.of() : List.copyOf(teams);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Action(String name, String agentType, Double confidence) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Resource(
        String type,
        Double complexity,
        List<String> files,
        Repo repo,
        String branch,
        Boolean protectedBranch,
        List<String> labels
    ) {

        public Resource {
            files = files == null ? List.of() : List.copyOf(files);
            labels = labels == null ? List.of() : List.copyOf(labels);
        }

        public boolean onProtectedBranch() {
            return Boolean.TRUE.equals(protectedBranch);
        }
    }

    public record Repo(String owner, String name) {

        public String fullName() {
            return owner + "/" + name;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestContext(Instant timestamp, String source, String requestId, String traceId) {

        public RequestContext {
            timestamp = timestamp == null ? Instant.now() : timestamp;
        }
    }

    /** An approval already granted on the resource. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ExistingApproval(String approverId, String approverType, List<String> scopes) {

        public ExistingApproval {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
        }

        public boolean countsAsHuman() {
            return approverType == null
                || "human".equalsIgnoreCase(approverType)
                || "user".equalsIgnoreCase(approverType);
        }
    }

    public static final class Builder {
        private String actorId = "anonymous";
        private String actorType = "human";
        private List<String> roles = List.of();
        private List<String> teams = List.of();
        private String actionName = "unspecified";
        private String agentType;
        private Double confidence;
        private String resourceType = "pull_request";
        private Double complexity;
        private List<String> files = List.of();
        private Repo repo;
        private String branch;
        private Boolean protectedBranch;
        private List<String> labels = List.of();
        private Instant timestamp;
        private String source;
        private String requestId;
        private String traceId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<ExistingApproval> approvals = new ArrayList<>();
        private List<String> requiredScopes = List.of();

        private Builder() {
        }

        public Builder actor(String id, String type) {
            this.actorId = id;
            this.actorType = type;
            return this;
        }

        public Builder roles(String... values) {
            this.roles = List.of(values);
            return this;
        }

        public Builder teams(String... values) {
            this.teams = List.of(values);
            return this;
        }

        public Builder action(String name) {
            this.actionName = name;
            return this;
        }

        public Builder agent(String type, Double agentConfidence) {
            this.agentType = type;
            this.confidence = agentConfidence;
            return this;
        }

        public Builder resourceType(String value) {
            this.resourceType = value;
            return this;
        }

        public Builder complexity(double value) {
            this.complexity = value;
            return this;
        }

        public Builder files(String... values) {
            this.files = List.of(values);
            return this;
        }

        public Builder repo(String owner, String name) {
            this.repo = new Repo(owner, name);
            return this;
        }

        public Builder branch(String value, boolean isProtected) {
            this.branch = value;
            this.protectedBranch = isProtected;
            return this;
        }

        public Builder labels(String... values) {
            this.labels = List.of(values);
            return this;
        }

        public Builder timestamp(Instant value) {
            this.timestamp = value;
            return this;
        }

        public Builder source(String value) {
            this.source = value;
            return this;
        }

        public Builder requestId(String value) {
            this.requestId = value;
            return this;
        }

        public Builder traceId(String value) {
            this.traceId = value;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder approval(String approverId, String approverType, String... scopes) {
            this.approvals.add(new ExistingApproval(approverId, approverType, List.of(scopes)));
            return this;
        }

        public Builder requiredScopes(String... values) {
            this.requiredScopes = List.of(values);
            return this;
        }

        public EvaluationRequest build() {
            return new EvaluationRequest(
                new Actor(actorId, actorType, roles, teams),
                new Action(actionName, agentType, confidence),
                new Resource(resourceType, complexity, files, repo, branch, protectedBranch, labels),
                new RequestContext(timestamp, source, requestId, traceId),
                attributes,
                approvals,
                requiredScopes);
        }
    }
}
