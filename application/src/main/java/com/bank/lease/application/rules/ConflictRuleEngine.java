package com.bank.lease.application.rules;

import com.bank.lease.application.service.MetricsService;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the comparator battery over a lease group. A failing rule is logged and
 * counted; the remaining rules still run.
 */
@Component
public class ConflictRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(ConflictRuleEngine.class);

    private final List<ConflictRule> rules;
    private final MetricsService metricsService;

    public ConflictRuleEngine(List<ConflictRule> rules, MetricsService metricsService) {
        this.rules = List.copyOf(rules);
        this.metricsService = metricsService;
        log.info("Conflict rule engine initialized with rules {}", rules.stream().map(ConflictRule::name).collect(Collectors.toList()));
    }

    public List<ConflictRecord> scan(LeaseGroupSnapshot group) {
        if (group.getBaseRecord().isExtractionFailed()) {
            log.debug("Lease {} has no usable extraction; comparisons skipped", group.getLeaseId());
            return List.of();
        }
        List<ConflictRecord> findings = new ArrayList<>();
        for (ConflictRule rule : rules) {
            try {
                List<ConflictRecord> ruleFindings = rule.evaluate(group);
                log.debug("Rule {} found {} conflict(s) in lease {}", rule.name(), ruleFindings.size(), group.getLeaseId());
                findings.addAll(ruleFindings);
            } catch (RuntimeException e) {
                log.error("Rule {} failed on lease {}; continuing with remaining rules", rule.name(), group.getLeaseId(), e);
                metricsService.recordRuleFailure(rule.name());
            }
        }
        return findings;
    }
}
