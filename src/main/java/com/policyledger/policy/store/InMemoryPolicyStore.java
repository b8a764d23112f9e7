package com.policyledger.policy.store;

import com.policyledger.contract.ValidationException;
import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyScope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryPolicyStore implements PolicyStore {

    private final Map<String, PolicyDocument> documents = new ConcurrentHashMap<>();

    @Override
    public void put(PolicyDocument document) {
        if (document == null || document.name() == null) {
            throw new ValidationException("policy document with a name is required");
        }
        documents.put(key(document.scope(), document.scopeTarget()), document);
    }

    @Override
    public Optional<PolicyDocument> getPolicy(PolicyScope scope, String target) {
        return Optional.ofNullable(documents.get(key(scope, target)));
    }

    @Override
    public List<PolicyDocument> listPolicies(PolicyScope scope) {
        List<PolicyDocument> result = new ArrayList<>();
        for (PolicyDocument document : documents.values()) {
            if (scope == null || document.scope() == scope) {
                result.add(document);
            }
        }
        result.sort((a, b) -> {
            int byScope = Integer.compare(a.scope().ordinal(), b.scope().ordinal());
            return byScope != 0 ? byScope : a.name().compareTo(b.name());
        });
        return result;
    }

    @Override
    public Optional<PolicyDocument> findByName(String name) {
        return documents.values().stream()
            .filter(document -> document.name().equals(name))
            .findFirst();
    }

    @Override
    public boolean remove(PolicyScope scope, String target) {
        return documents.remove(key(scope, target)) != null;
    }

    public void clear() {
        documents.clear();
    }

    private static String key(PolicyScope scope, String target) {
        String resolvedTarget = target == null || target.isBlank() ? DEFAULT_TARGET : target;
        return scope.getValue() + ":" + resolvedTarget;
    }
}
