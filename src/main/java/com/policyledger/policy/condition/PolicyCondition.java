package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of rule conditions, discriminated by the JSON {@code type} field.
 * A missing or unrecognized type deserializes to {@link UnknownCondition}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
    defaultImpl = UnknownCondition.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ComplexityCondition.class, name = "complexity"),
    @JsonSubTypes.Type(value = FilePatternCondition.class, name = "file_pattern"),
    @JsonSubTypes.Type(value = AuthorCondition.class, name = "author"),
    @JsonSubTypes.Type(value = TimeWindowCondition.class, name = "time_window"),
    @JsonSubTypes.Type(value = RepositoryCondition.class, name = "repository"),
    @JsonSubTypes.Type(value = BranchCondition.class, name = "branch"),
    @JsonSubTypes.Type(value = LabelCondition.class, name = "label"),
    @JsonSubTypes.Type(value = AgentCondition.class, name = "agent"),
    @JsonSubTypes.Type(value = CustomCondition.class, name = "custom")
})
public sealed interface PolicyCondition permits ComplexityCondition, FilePatternCondition, AuthorCondition,
    TimeWindowCondition, RepositoryCondition, BranchCondition, LabelCondition, AgentCondition,
    CustomCondition, UnknownCondition {

    ConditionType kind();
}
