package com.umitunal.batchq.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tries registered remedies for a failure before it is retried.
 *
 * <p>Rules are evaluated in registration order. Of the enabled rules whose type matches the
 * classified error and whose condition holds, the first resolution returning true wins. A
 * resolution that throws is logged and the next one is tried.
 */
public class ErrorResolver {
    private static final Logger log = LoggerFactory.getLogger(ErrorResolver.class);

    private final ErrorClassifier classifier;
    private final List<ResolutionRule> rules = new CopyOnWriteArrayList<>();

    public ErrorResolver() {
        this(ErrorClassifier.defaults());
    }

    public ErrorResolver(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    public void addRule(ResolutionRule rule) {
        rules.add(rule);
    }

    public boolean removeRule(String ruleId) {
        return rules.removeIf(rule -> rule.getId().equals(ruleId));
    }

    public void enableRule(String ruleId) {
        setEnabled(ruleId, true);
    }

    public void disableRule(String ruleId) {
        setEnabled(ruleId, false);
    }

    public List<ResolutionRule> getRules() {
        return new ArrayList<>(rules);
    }

    public ResolutionResult resolve(Throwable error, Object context) {
        ClassifiedError classified = classifier.classify(error);
        Throwable root = ErrorClassifier.unwrap(error);

        List<ResolutionRule> candidates = new ArrayList<>();
        for (ResolutionRule rule : rules) {
            if (rule.isEnabled() && rule.getErrorType() == classified.getType()
                    && rule.getCondition().test(root, context)) {
                candidates.add(rule);
            }
        }

        if (candidates.isEmpty()) {
            return new ResolutionResult(false, ResolutionResult.ACTION_NONE,
                    "No automatic resolution available for this error type");
        }

        for (ResolutionRule rule : candidates) {
            try {
                log.debug("Attempting resolution '{}' for {} error", rule.getId(), classified.getType());
                if (rule.getResolution().resolve(root, context)) {
                    log.info("Auto-resolved {} error with rule '{}': {}",
                            classified.getType(), rule.getId(), classified.getMessage());
                    return new ResolutionResult(true, rule.getId(),
                            "Automatically resolved: " + rule.getDescription());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Resolution '{}' interrupted", rule.getId());
                break;
            } catch (Exception e) {
                log.warn("Resolution '{}' failed: {}", rule.getId(), e.toString());
            }
        }

        return new ResolutionResult(false, ResolutionResult.ACTION_FAILED,
                "All automatic resolution attempts failed");
    }

    public Stats getStats() {
        Map<ErrorType, Integer> byType = new EnumMap<>(ErrorType.class);
        int enabled = 0;
        List<ResolutionRule> snapshot = getRules();
        for (ResolutionRule rule : snapshot) {
            byType.merge(rule.getErrorType(), 1, Integer::sum);
            if (rule.isEnabled()) {
                enabled++;
            }
        }
        return new Stats(snapshot.size(), enabled, byType);
    }

    private void setEnabled(String ruleId, boolean enabled) {
        for (ResolutionRule rule : rules) {
            if (rule.getId().equals(ruleId)) {
                rule.setEnabled(enabled);
            }
        }
    }

    /**
     * Rule counts.
     */
    public static class Stats {
        private final int totalRules;
        private final int enabledRules;
        private final Map<ErrorType, Integer> rulesByType;

        Stats(int totalRules, int enabledRules, Map<ErrorType, Integer> rulesByType) {
            this.totalRules = totalRules;
            this.enabledRules = enabledRules;
            this.rulesByType = rulesByType;
        }

        public int getTotalRules() { return totalRules; }
        public int getEnabledRules() { return enabledRules; }
        public Map<ErrorType, Integer> getRulesByType() { return rulesByType; }
    }
}
