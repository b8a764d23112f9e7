package com.policyledger.policy.condition;

import com.policyledger.policy.model.EvaluationRequest;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pure predicates over an {@link EvaluationRequest}, one per condition type.
 *
 * Patterns, regexes and time zones are resolved once in {@link #compile}; the
 * returned predicates hold no mutable state and may be shared across threads.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /** Compiles and evaluates in one step. Unknown or uncompilable conditions are false. */
    public static boolean evaluate(PolicyCondition condition, EvaluationRequest request) {
        try {
            return compile(condition).test(request);
        } catch (ConditionCompilationException ex) {
            return false;
        }
    }

    /**
     * @throws ConditionCompilationException if a regex, glob or time zone is invalid
     */
    public static CompiledCondition compile(PolicyCondition condition) {
        Predicate<EvaluationRequest> predicate = switch (condition.kind()) {
            case COMPLEXITY -> complexity((ComplexityCondition) condition);
            case FILE_PATTERN -> filePattern((FilePatternCondition) condition);
            case AUTHOR -> author((AuthorCondition) condition);
            case TIME_WINDOW -> timeWindow((TimeWindowCondition) condition);
            case REPOSITORY -> repository((RepositoryCondition) condition);
            case BRANCH -> branch((BranchCondition) condition);
            case LABEL -> label((LabelCondition) condition);
            case AGENT -> agent((AgentCondition) condition);
            case CUSTOM -> custom((CustomCondition) condition);
            case UNKNOWN -> request -> false;
        };
        return new CompiledCondition(condition, predicate);
    }

    private static Predicate<EvaluationRequest> complexity(ComplexityCondition condition) {
        if (condition.operator() == null || condition.threshold() == null) {
            return request -> false;
        }
        return request -> {
            Double complexity = request.resource() == null ? null : request.resource().complexity();
            return complexity != null && condition.operator().test(complexity, condition.threshold());
        };
    }

    private static Predicate<EvaluationRequest> filePattern(FilePatternCondition condition) {
        List<Pattern> patterns = globs(condition.patterns());
        boolean include = condition.matchType() == FilePatternCondition.MatchType.INCLUDE;
        return request -> {
            List<String> files = request.resource() == null ? List.of() : request.resource().files();
            if (files.isEmpty()) {
                return false;
            }
            boolean anyMatch = files.stream().anyMatch(file -> anyGlob(patterns, file));
            return include == anyMatch;
        };
    }

    private static Predicate<EvaluationRequest> author(AuthorCondition condition) {
        return request -> {
            EvaluationRequest.Actor actor = request.actor();
            if (!condition.hasCriteria()) {
                return true;
            }
            if (actor == null) {
                return false;
            }
            return actor.id() != null && condition.authors().contains(actor.id())
                || actor.roles().stream().anyMatch(condition.roles()::contains)
                || actor.teams().stream().anyMatch(condition.teams()::contains);
        };
    }

    private static Predicate<EvaluationRequest> timeWindow(TimeWindowCondition condition) {
        ZoneId zone;
        try {
            zone = ZoneId.of(condition.timezone());
        } catch (DateTimeException ex) {
            throw new ConditionCompilationException("invalid timezone: " + condition.timezone(), ex);
        }
        boolean during = condition.matchType() == TimeWindowCondition.MatchType.DURING;
        return request -> {
            ZonedDateTime at = request.context().timestamp().atZone(zone);
            String day = dayName(at);
            int hour = at.getHour();
            boolean inWindow = condition.windows().stream().anyMatch(window ->
                (window.days().isEmpty() || window.days().stream().anyMatch(d -> d.equalsIgnoreCase(day)))
                    && (window.startHour() == null || hour >= window.startHour())
                    && (window.endHour() == null || hour < window.endHour()));
            return during == inWindow;
        };
    }

    private static Predicate<EvaluationRequest> repository(RepositoryCondition condition) {
        List<Pattern> patterns = globs(condition.patterns());
        boolean matchAll = condition.repos().isEmpty() && condition.patterns().isEmpty();
        return request -> {
            EvaluationRequest.Repo repo = request.resource() == null ? null : request.resource().repo();
            if (repo == null) {
                return false;
            }
            if (matchAll) {
                return true;
            }
            String fullName = repo.fullName();
            return condition.repos().contains(fullName)
                || condition.repos().contains(repo.name())
                || anyGlob(patterns, fullName);
        };
    }

    private static Predicate<EvaluationRequest> branch(BranchCondition condition) {
        List<Pattern> patterns = globs(condition.patterns());
        boolean matchAll = condition.branches().isEmpty() && condition.patterns().isEmpty();
        boolean protectedOnly = Boolean.TRUE.equals(condition.protectedOnly());
        return request -> {
            String branch = request.resource() == null ? null : request.resource().branch();
            if (branch == null) {
                return false;
            }
            if (protectedOnly && !request.resource().onProtectedBranch()) {
                return false;
            }
            return matchAll || condition.branches().contains(branch) || anyGlob(patterns, branch);
        };
    }

    private static Predicate<EvaluationRequest> label(LabelCondition condition) {
        return request -> {
            List<String> labels = request.resource() == null ? List.of() : request.resource().labels();
            return switch (condition.matchType()) {
                case ANY -> condition.labels().stream().anyMatch(labels::contains);
                case ALL -> labels.containsAll(condition.labels());
                case NONE -> condition.labels().stream().noneMatch(labels::contains);
            };
        };
    }

    private static Predicate<EvaluationRequest> agent(AgentCondition condition) {
        AgentCondition.Confidence confidence = condition.confidence();
        return request -> {
            EvaluationRequest.Action action = request.action();
            if (action == null || action.agentType() == null) {
                return false;
            }
            if (!condition.agents().contains(action.agentType())) {
                return false;
            }
            if (confidence != null && confidence.operator() != null && confidence.threshold() != null
                    && action.confidence() != null) {
                return confidence.operator().test(action.confidence(), confidence.threshold());
            }
            return true;
        };
    }

    private static Predicate<EvaluationRequest> custom(CustomCondition condition) {
        if (condition.operator() == null || condition.field() == null) {
            return request -> false;
        }
        Object expected = condition.value();
        if (condition.operator() == CustomOperator.MATCHES) {
            Pattern regex = regex(expected);
            return request -> {
                Lookup lookup = lookup(request.attributes(), condition.field());
                return lookup.present() && lookup.value() instanceof String text && regex.matcher(text).find();
            };
        }
        return request -> {
            Lookup lookup = lookup(request.attributes(), condition.field());
            if (condition.operator() == CustomOperator.EXISTS) {
                return lookup.present() == truthy(expected);
            }
            if (!lookup.present()) {
                return false;
            }
            Object actual = lookup.value();
            return switch (condition.operator()) {
                case EQ -> valuesEqual(actual, expected);
                case NE -> !valuesEqual(actual, expected);
                case GT -> compare(actual, expected, c -> c > 0);
                case GTE -> compare(actual, expected, c -> c >= 0);
                case LT -> compare(actual, expected, c -> c < 0);
                case LTE -> compare(actual, expected, c -> c <= 0);
                case IN -> expected instanceof Collection<?> options
                    && options.stream().anyMatch(option -> valuesEqual(actual, option));
                case NIN -> expected instanceof Collection<?> options
                    && options.stream().noneMatch(option -> valuesEqual(actual, option));
                case CONTAINS -> contains(actual, expected);
                case MATCHES, EXISTS -> false;
            };
        };
    }

    /**
     * Dry-run breakdown of one condition: what the request had, what the
     * condition expected, and a one-line verdict.
     */
    public static ConditionExplanation explain(PolicyCondition condition, EvaluationRequest request, boolean matched) {
        String verdict = matched ? "MATCH" : "NO MATCH";
        EvaluationRequest.Resource resource = request.resource();
        EvaluationRequest.Actor actor = request.actor();
        return switch (condition.kind()) {
            case COMPLEXITY -> {
                ComplexityCondition c = (ComplexityCondition) condition;
                Double actual = resource == null ? null : resource.complexity();
                yield new ConditionExplanation(c.kind(), matched, actual, c.threshold(),
                    "Complexity " + (actual == null ? "absent" : format(actual)) + " "
                        + (c.operator() == null ? "?" : c.operator().getValue()) + " "
                        + (c.threshold() == null ? "?" : format(c.threshold())) + " -> " + verdict);
            }
            case FILE_PATTERN -> {
                FilePatternCondition c = (FilePatternCondition) condition;
                List<String> files = resource == null ? List.of() : resource.files();
                yield new ConditionExplanation(c.kind(), matched, files, c.patterns(),
                    "Patterns " + c.patterns() + " matched against " + files.size() + " files ("
                        + c.matchType().name().toLowerCase(Locale.ROOT) + ") -> " + verdict);
            }
            case AUTHOR -> {
                AuthorCondition c = (AuthorCondition) condition;
                Map<String, Object> actual = new LinkedHashMap<>();
                actual.put("id", actor == null ? null : actor.id());
                actual.put("roles", actor == null ? List.of() : actor.roles());
                actual.put("teams", actor == null ? List.of() : actor.teams());
                Map<String, Object> expected = new LinkedHashMap<>();
                expected.put("authors", c.authors());
                expected.put("roles", c.roles());
                expected.put("teams", c.teams());
                yield new ConditionExplanation(c.kind(), matched, actual, expected,
                    "Author \"" + actual.get("id") + "\" checked against "
                        + (c.hasCriteria() ? expected : "no criteria") + " -> " + verdict);
            }
            case TIME_WINDOW -> {
                TimeWindowCondition c = (TimeWindowCondition) condition;
                Map<String, Object> actual = new LinkedHashMap<>();
                try {
                    ZonedDateTime at = request.context().timestamp().atZone(ZoneId.of(c.timezone()));
                    actual.put("day", dayName(at));
                    actual.put("hour", at.getHour());
                } catch (DateTimeException ex) {
                    actual.put("error", "invalid timezone " + c.timezone());
                }
                actual.put("timezone", c.timezone());
                yield new ConditionExplanation(c.kind(), matched, actual, c.windows(),
                    "Request time " + actual.get("hour") + ":00 " + actual.get("day") + " " + c.timezone()
                        + " within windows (" + c.matchType().name().toLowerCase(Locale.ROOT) + ") -> " + verdict);
            }
            case REPOSITORY -> {
                RepositoryCondition c = (RepositoryCondition) condition;
                String actual = resource == null || resource.repo() == null ? null : resource.repo().fullName();
                Map<String, Object> expected = new LinkedHashMap<>();
                expected.put("repos", c.repos());
                expected.put("patterns", c.patterns());
                yield new ConditionExplanation(c.kind(), matched, actual, expected,
                    "Repository \"" + (actual == null ? "unknown" : actual) + "\" matches repos/patterns -> " + verdict);
            }
            case BRANCH -> {
                BranchCondition c = (BranchCondition) condition;
                String actual = resource == null ? null : resource.branch();
                Map<String, Object> expected = new LinkedHashMap<>();
                expected.put("branches", c.branches());
                expected.put("patterns", c.patterns());
                if (c.protectedOnly() != null) {
                    expected.put("protected", c.protectedOnly());
                }
                yield new ConditionExplanation(c.kind(), matched, actual, expected,
                    "Branch \"" + (actual == null ? "unknown" : actual) + "\" matches branches/patterns -> " + verdict);
            }
            case LABEL -> {
                LabelCondition c = (LabelCondition) condition;
                List<String> labels = resource == null ? List.of() : resource.labels();
                yield new ConditionExplanation(c.kind(), matched, labels, c.labels(),
                    "Labels " + labels + " matchType=" + c.matchType().name().toLowerCase(Locale.ROOT)
                        + " " + c.labels() + " -> " + verdict);
            }
            case AGENT -> {
                AgentCondition c = (AgentCondition) condition;
                String agentType = request.action() == null ? null : request.action().agentType();
                yield new ConditionExplanation(c.kind(), matched, agentType, c.agents(),
                    "Agent type \"" + agentType + "\" matches " + c.agents() + " -> " + verdict);
            }
            case CUSTOM -> {
                CustomCondition c = (CustomCondition) condition;
                Lookup lookup = c.field() == null ? Lookup.ABSENT : lookup(request.attributes(), c.field());
                yield new ConditionExplanation(c.kind(), matched, lookup.value(), c.value(),
                    "Custom condition \"" + c.field() + "\" "
                        + (c.operator() == null ? "?" : c.operator().getValue()) + " " + c.value() + " -> " + verdict);
            }
            case UNKNOWN -> new ConditionExplanation(ConditionType.UNKNOWN, matched, null, null,
                "Unknown condition type -> " + verdict);
        };
    }

    private static List<Pattern> globs(List<String> globs) {
        List<Pattern> compiled = new ArrayList<>(globs.size());
        for (String glob : globs) {
            compiled.add(GlobMatcher.compile(glob));
        }
        return List.copyOf(compiled);
    }

    private static boolean anyGlob(List<Pattern> patterns, String value) {
        return patterns.stream().anyMatch(p -> p.matcher(value).matches());
    }

    private static Pattern regex(Object expected) {
        if (!(expected instanceof String source)) {
            throw new ConditionCompilationException("matches operator requires a string pattern", null);
        }
        try {
            return Pattern.compile(source);
        } catch (PatternSyntaxException ex) {
            throw new ConditionCompilationException("invalid regex: " + source, ex);
        }
    }

    private static String dayName(ZonedDateTime at) {
        return TimeWindowCondition.DAY_NAMES.get(at.getDayOfWeek().getValue() - 1);
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    static Lookup lookup(Map<String, Object> attributes, String field) {
        if (attributes.containsKey(field)) {
            return new Lookup(true, attributes.get(field));
        }
        Object current = attributes;
        for (String segment : field.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Lookup.ABSENT;
            }
            current = map.get(segment);
        }
        return new Lookup(true, current);
    }

    private static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof String text) {
            return !text.isEmpty();
        }
        return true;
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean compare(Object actual, Object expected, IntPredicate accept) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return accept.test(Double.compare(a.doubleValue(), b.doubleValue()));
        }
        return false;
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof String text && expected instanceof String part) {
            return text.contains(part);
        }
        if (actual instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> valuesEqual(item, expected));
        }
        return false;
    }

    record Lookup(boolean present, Object value) {
        static final Lookup ABSENT = new Lookup(false, null);
    }
}
