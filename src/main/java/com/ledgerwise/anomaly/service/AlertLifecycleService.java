package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.AlertPolicyConfig;
import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.model.AlertStatus;
import com.ledgerwise.anomaly.model.EscalationRule;
import com.ledgerwise.anomaly.model.GeneratedAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Owns generated alerts after creation: dispatch once the delivery time is reached,
 * acknowledgement, resolution and escalation of unacknowledged alerts.
 *
 * PENDING -> SENT -> ACKNOWLEDGED -> RESOLVED, with PENDING and SENT also allowed to resolve
 * directly. Any other transition throws {@link IllegalStateException}.
 */
@Service
public class AlertLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleService.class);

    private final AlertPolicyConfig config;
    private final MetricsConfig metricsConfig;

    // alertId -> alert plus the escalation rules it was created under
    private final ConcurrentHashMap<String, TrackedAlert> alerts = new ConcurrentHashMap<>();

    public AlertLifecycleService(AlertPolicyConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public void register(GeneratedAlert alert, List<EscalationRule> escalationRules) {
        List<EscalationRule> rules = escalationRules == null ? List.of() : List.copyOf(escalationRules);
        alerts.put(alert.getId(), new TrackedAlert(alert, rules));
    }

    public GeneratedAlert getAlert(String alertId) {
        TrackedAlert tracked = alerts.get(alertId);
        return tracked == null ? null : tracked.alert();
    }

    public List<GeneratedAlert> findAlerts(String organizationId, AlertStatus status) {
        List<GeneratedAlert> result = new ArrayList<>();
        for (TrackedAlert tracked : alerts.values()) {
            GeneratedAlert alert = tracked.alert();
            if (organizationId != null && !organizationId.equals(alert.getOrganizationId())) continue;
            if (status != null && alert.getStatus() != status) continue;
            result.add(alert);
        }
        result.sort(Comparator.comparingLong(GeneratedAlert::getTimestamp).reversed());
        return result;
    }

    public GeneratedAlert markSent(String alertId, long now) {
        TrackedAlert tracked = require(alertId);
        synchronized (tracked) {
            transition(tracked.alert(), AlertStatus.SENT);
            tracked.alert().setSentAt(now);
        }
        return tracked.alert();
    }

    public GeneratedAlert acknowledge(String alertId, String acknowledgedBy, long now) {
        TrackedAlert tracked = require(alertId);
        synchronized (tracked) {
            transition(tracked.alert(), AlertStatus.ACKNOWLEDGED);
            tracked.alert().setAcknowledgedAt(now);
            tracked.alert().setAcknowledgedBy(acknowledgedBy);
        }
        log.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
        return tracked.alert();
    }

    public GeneratedAlert resolve(String alertId, long now) {
        TrackedAlert tracked = require(alertId);
        synchronized (tracked) {
            transition(tracked.alert(), AlertStatus.RESOLVED);
            tracked.alert().setResolvedAt(now);
        }
        log.info("Alert {} resolved", alertId);
        return tracked.alert();
    }

    @Scheduled(fixedRateString = "${detection.alerts.check-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "10")
    public void runScheduledChecks() {
        long now = System.currentTimeMillis();
        int sent = 0;
        int escalated = 0;
        // purging runs even with dispatch disabled, so tracked alerts stay bounded
        if (config.isEnabled()) {
            sent = dispatchDue(now);
            escalated = escalate(now);
        }
        int purged = purgeExpired(now);
        if (sent + escalated + purged > 0) {
            log.info("Alert check complete: dispatched={}, escalated={}, purged={}, tracked={}",
                    sent, escalated, purged, alerts.size());
        }
    }

    /**
     * Move every PENDING alert whose delivery time has arrived to SENT.
     */
    public int dispatchDue(long now) {
        int dispatched = 0;
        for (TrackedAlert tracked : alerts.values()) {
            synchronized (tracked) {
                GeneratedAlert alert = tracked.alert();
                if (alert.getStatus() != AlertStatus.PENDING || alert.getDeliverAfter() > now) continue;
                transition(alert, AlertStatus.SENT);
                alert.setSentAt(now);
                dispatched++;
                log.info("Alert {} dispatched: severity={}, recipients={}",
                        alert.getId(), alert.getSeverity(), alert.getRecipients().size());
            }
        }
        return dispatched;
    }

    /**
     * Escalate SENT alerts left unacknowledged for longer than their rule's delay. The delay is
     * measured from the last escalation, or from dispatch for the first one.
     */
    public int escalate(long now) {
        int escalated = 0;
        for (TrackedAlert tracked : alerts.values()) {
            synchronized (tracked) {
                GeneratedAlert alert = tracked.alert();
                if (alert.getStatus() != AlertStatus.SENT) continue;

                EscalationRule rule = firstMatchingRule(tracked);
                if (rule == null || alert.getEscalationLevel() >= rule.getMaxEscalations()) continue;

                Long reference = alert.getLastEscalatedAt() != null ? alert.getLastEscalatedAt() : alert.getSentAt();
                if (reference == null || now - reference < TimeUnit.MINUTES.toMillis(rule.getDelayMinutes())) continue;

                Set<String> recipients = new LinkedHashSet<>(alert.getRecipients());
                recipients.addAll(rule.getEscalateTo());
                alert.setRecipients(new ArrayList<>(recipients));
                alert.setEscalationLevel(alert.getEscalationLevel() + 1);
                alert.setLastEscalatedAt(now);
                escalated++;

                metricsConfig.recordEscalation(alert.getEscalationLevel());
                log.warn("Alert {} escalated to level {}: added {}",
                        alert.getId(), alert.getEscalationLevel(), rule.getEscalateTo());
            }
        }
        return escalated;
    }

    /**
     * Drop resolved alerts older than the resolved retention, and open alerts (pending, sent or
     * acknowledged) with no activity for longer than the stale retention.
     */
    public int purgeExpired(long now) {
        long resolvedCutoff = now - config.getResolvedRetention().toMillis();
        long staleCutoff = now - config.getStaleRetention().toMillis();
        int before = alerts.size();
        alerts.values().removeIf(t -> {
            GeneratedAlert alert = t.alert();
            if (alert.getStatus() == AlertStatus.RESOLVED) {
                return alert.getResolvedAt() != null && alert.getResolvedAt() < resolvedCutoff;
            }
            return lastActivity(alert) < staleCutoff;
        });
        return before - alerts.size();
    }

    private static long lastActivity(GeneratedAlert alert) {
        long last = Math.max(alert.getTimestamp(), alert.getDeliverAfter());
        if (alert.getSentAt() != null) last = Math.max(last, alert.getSentAt());
        if (alert.getAcknowledgedAt() != null) last = Math.max(last, alert.getAcknowledgedAt());
        if (alert.getLastEscalatedAt() != null) last = Math.max(last, alert.getLastEscalatedAt());
        return last;
    }

    private EscalationRule firstMatchingRule(TrackedAlert tracked) {
        for (EscalationRule rule : tracked.escalationRules()) {
            if (AlertConditions.matches(rule.getCondition(), tracked.alert().getAttributes())) {
                return rule;
            }
        }
        return null;
    }

    private void transition(GeneratedAlert alert, AlertStatus next) {
        AlertStatus current = alert.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Alert " + alert.getId() + " cannot move from " + current + " to " + next);
        }
        alert.setStatus(next);
        metricsConfig.recordAlertTransition(current.name(), next.name());
    }

    private TrackedAlert require(String alertId) {
        TrackedAlert tracked = alerts.get(alertId);
        if (tracked == null) {
            throw new IllegalArgumentException("Unknown alert: " + alertId);
        }
        return tracked;
    }

    private record TrackedAlert(GeneratedAlert alert, List<EscalationRule> escalationRules) {}
}
