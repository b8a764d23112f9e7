package com.policyledger.config;

import com.policyledger.chain.HashAlgorithm;
import com.policyledger.policy.model.Effect;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the policy engine, the audit log and evidence collection.
 */
@ConfigurationProperties(prefix = "policy-ledger")
public class PolicyLedgerProperties {

    private final Engine engine = new Engine();
    private final Audit audit = new Audit();
    private final Evidence evidence = new Evidence();

    public Engine getEngine() {
        return engine;
    }

    public Audit getAudit() {
        return audit;
    }

    public Evidence getEvidence() {
        return evidence;
    }

    public static class Engine {

        /** Stop at the first matching require_approval rule instead of aggregating. */
        private boolean stopOnFirstMatch = false;

        /** Effect applied when no rule matches. */
        private Effect defaultEffect = Effect.DENY;

        /** Reject documents with unknown condition types or invalid patterns at load. */
        private boolean validateOnLoad = true;

        private int protectedBranchApprovers = 2;

        private int defaultApprovers = 1;

        public boolean isStopOnFirstMatch() {
            return stopOnFirstMatch;
        }

        public void setStopOnFirstMatch(boolean stopOnFirstMatch) {
            this.stopOnFirstMatch = stopOnFirstMatch;
        }

        public Effect getDefaultEffect() {
            return defaultEffect;
        }

        public void setDefaultEffect(Effect defaultEffect) {
            this.defaultEffect = defaultEffect;
        }

        public boolean isValidateOnLoad() {
            return validateOnLoad;
        }

        public void setValidateOnLoad(boolean validateOnLoad) {
            this.validateOnLoad = validateOnLoad;
        }

        public int getProtectedBranchApprovers() {
            return protectedBranchApprovers;
        }

        public void setProtectedBranchApprovers(int protectedBranchApprovers) {
            this.protectedBranchApprovers = protectedBranchApprovers;
        }

        public int getDefaultApprovers() {
            return defaultApprovers;
        }

        public void setDefaultApprovers(int defaultApprovers) {
            this.defaultApprovers = defaultApprovers;
        }
    }

    public static class Audit {

        private HashAlgorithm hashAlgorithm = HashAlgorithm.SHA256;

        /** Attempts per append before a lost head race is reported to the caller. */
        private int maxAppendRetries = 16;

        public HashAlgorithm getHashAlgorithm() {
            return hashAlgorithm;
        }

        public void setHashAlgorithm(HashAlgorithm hashAlgorithm) {
            this.hashAlgorithm = hashAlgorithm;
        }

        public int getMaxAppendRetries() {
            return maxAppendRetries;
        }

        public void setMaxAppendRetries(int maxAppendRetries) {
            this.maxAppendRetries = maxAppendRetries;
        }
    }

    public static class Evidence {

        private String collectorId = "evidence-collector";

        private int defaultMaxPerSource = 100;

        private boolean verifyChainByDefault = true;

        public String getCollectorId() {
            return collectorId;
        }

        public void setCollectorId(String collectorId) {
            this.collectorId = collectorId;
        }

        public int getDefaultMaxPerSource() {
            return defaultMaxPerSource;
        }

        public void setDefaultMaxPerSource(int defaultMaxPerSource) {
            this.defaultMaxPerSource = defaultMaxPerSource;
        }

        public boolean isVerifyChainByDefault() {
            return verifyChainByDefault;
        }

        public void setVerifyChainByDefault(boolean verifyChainByDefault) {
            this.verifyChainByDefault = verifyChainByDefault;
        }
    }
}
