package com.policyledger.policy.engine;

import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.PolicyDocumentValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyEngineConfiguration {

    /**
     * Engine backing both the policy API and the gate. Starts empty; documents
     * arrive through {@code POST /v1/policies}.
     */
    @Bean
    public PolicyEngine policyEngine(PolicyLedgerProperties properties, PolicyDocumentValidator validator) {
        return new PolicyEngine(properties.getEngine(), validator);
    }
}
