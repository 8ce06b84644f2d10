package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.AlertChannel;
import com.ledgerwise.anomaly.model.AlertChannelType;
import com.ledgerwise.anomaly.model.AlertConfiguration;
import com.ledgerwise.anomaly.model.AlertStatus;
import com.ledgerwise.anomaly.model.BusinessImpact;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.GeneratedAlert;
import com.ledgerwise.anomaly.model.Severity;
import com.ledgerwise.anomaly.model.SeverityThreshold;
import com.ledgerwise.anomaly.model.SuppressionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Turns anomalies into alerts.
 *
 * An anomaly becomes a candidate when its severity tier is configured and its score reaches
 * the tier threshold. Candidates matching a suppression rule are counted per
 * (organization, source, condition, field group); once more than {@code maxOccurrences} fall
 * inside the rule's window, further candidates are dropped. Non-critical alerts are held
 * until the next business-hours window when a policy is configured.
 */
@Service
public class AlertGenerationService {

    private static final Logger log = LoggerFactory.getLogger(AlertGenerationService.class);

    private final BusinessHours businessHours;
    private final AlertLifecycleService lifecycleService;
    private final MetricsConfig metricsConfig;

    // suppression key -> recent occurrence times
    private final ConcurrentHashMap<String, OccurrenceWindow> occurrences = new ConcurrentHashMap<>();

    public AlertGenerationService(BusinessHours businessHours,
                                  AlertLifecycleService lifecycleService,
                                  MetricsConfig metricsConfig) {
        this.businessHours = businessHours;
        this.lifecycleService = lifecycleService;
        this.metricsConfig = metricsConfig;
    }

    public List<GeneratedAlert> generate(List<DetectedAnomaly> anomalies, AlertConfiguration alertConfig,
                                         String organizationId, String sourceId) {
        return generate(anomalies, alertConfig, organizationId, sourceId, System.currentTimeMillis());
    }

    public List<GeneratedAlert> generate(List<DetectedAnomaly> anomalies, AlertConfiguration alertConfig,
                                         String organizationId, String sourceId, long now) {
        List<GeneratedAlert> alerts = new ArrayList<>();
        if (alertConfig == null || alertConfig.getSeverity() == null) {
            return alerts;
        }

        for (DetectedAnomaly anomaly : anomalies) {
            SeverityThreshold tier = alertConfig.getSeverity().forSeverity(anomaly.getSeverity());
            if (tier == null || anomaly.getAnomalyScore() < tier.getThreshold()) continue;

            if (isSuppressed(anomaly, alertConfig.getSuppressionRules(), organizationId, sourceId, now)) {
                metricsConfig.recordAlert(anomaly.getSeverity().name(), "suppressed");
                log.debug("Suppressed alert for anomaly {} ({} {})", anomaly.getId(), organizationId, sourceId);
                continue;
            }

            GeneratedAlert alert = buildAlert(anomaly, alertConfig, organizationId, sourceId, now);
            lifecycleService.register(alert, alertConfig.getEscalation());
            alerts.add(alert);
            metricsConfig.recordAlert(anomaly.getSeverity().name(),
                    alert.getDeliverAfter() > now ? "deferred" : "created");
        }
        return alerts;
    }

    private boolean isSuppressed(DetectedAnomaly anomaly, List<SuppressionRule> rules,
                                 String organizationId, String sourceId, long now) {
        if (rules == null || rules.isEmpty()) return false;

        boolean suppressed = false;
        String fieldGroup = anomaly.getAffectedFields().stream()
                .map(AffectedField::getFieldName)
                .sorted()
                .collect(Collectors.joining(","));

        for (SuppressionRule rule : rules) {
            if (!AlertConditions.matches(rule.getCondition(), anomaly)) continue;

            long windowMs;
            try {
                windowMs = DurationStyle.detectAndParse(rule.getDuration()).toMillis();
            } catch (IllegalArgumentException e) {
                log.warn("Skipping suppression rule '{}' with invalid duration '{}'",
                        rule.getCondition(), rule.getDuration());
                continue;
            }

            String key = String.join("|", organizationId, sourceId,
                    String.valueOf(rule.getCondition()), rule.getDuration(), fieldGroup);
            OccurrenceWindow window = occurrences.computeIfAbsent(key, k -> new OccurrenceWindow());
            if (window.record(now, windowMs) > rule.getMaxOccurrences()) {
                suppressed = true;
            }
        }
        return suppressed;
    }

    private GeneratedAlert buildAlert(DetectedAnomaly anomaly, AlertConfiguration alertConfig,
                                      String organizationId, String sourceId, long now) {
        List<AlertChannelType> channels = new ArrayList<>();
        Set<String> recipients = new LinkedHashSet<>();
        for (AlertChannel channel : alertConfig.getChannels()) {
            channels.add(channel.getType());
            recipients.addAll(channel.getRecipients());
        }

        long deliverAfter = anomaly.getSeverity() == Severity.CRITICAL
                ? now
                : businessHours.nextDeliveryTime(alertConfig.getBusinessHours(), now);

        return GeneratedAlert.builder()
                .id("alert_" + UUID.randomUUID())
                .anomalyId(anomaly.getId())
                .organizationId(organizationId)
                .sourceId(sourceId)
                .severity(anomaly.getSeverity())
                .title(anomaly.getSeverity() + " Anomaly Detected")
                .message(formatMessage(anomaly))
                .timestamp(now)
                .deliverAfter(deliverAfter)
                .channels(channels)
                .recipients(new ArrayList<>(recipients))
                .status(AlertStatus.PENDING)
                .escalationLevel(0)
                .businessContext(businessContext(anomaly.getBusinessImpact()))
                .attributes(AlertConditions.attributesOf(anomaly))
                .build();
    }

    private static String formatMessage(DetectedAnomaly anomaly) {
        String fields = anomaly.getAffectedFields().stream()
                .map(AffectedField::getFieldName)
                .collect(Collectors.joining(", "));
        String cause = anomaly.getExplanation() == null ? "unknown" : anomaly.getExplanation().getPrimaryCause();
        return String.format("%s anomaly detected in %s. Score: %.2f, Confidence: %.1f%%. Primary cause: %s",
                anomaly.getSeverity(), fields, anomaly.getAnomalyScore(), anomaly.getConfidence() * 100, cause);
    }

    private static Map<String, Object> businessContext(BusinessImpact impact) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (impact == null) return context;
        context.put("summary", impact.getCategory() + " impact - " + impact.getUrgency() + " urgency");
        context.put("category", String.valueOf(impact.getCategory()));
        context.put("urgency", String.valueOf(impact.getUrgency()));
        context.put("stakeholders", new ArrayList<>(impact.getStakeholders()));
        if (impact.getPotentialLoss() != null) {
            context.put("potentialLoss", impact.getPotentialLoss());
        }
        return context;
    }

    @Scheduled(fixedRateString = "${detection.alerts.check-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void purgeExpiredOccurrences() {
        purgeExpiredOccurrences(System.currentTimeMillis());
    }

    int purgeExpiredOccurrences(long now) {
        int before = occurrences.size();
        occurrences.values().removeIf(window -> window.isExpired(now));
        return before - occurrences.size();
    }

    private static final class OccurrenceWindow {
        private final Deque<Long> times = new ArrayDeque<>();
        private long windowMs;

        // record an occurrence and return how many fall inside the window, this one included
        synchronized int record(long now, long windowMs) {
            this.windowMs = windowMs;
            while (!times.isEmpty() && times.peekFirst() <= now - windowMs) {
                times.pollFirst();
            }
            times.addLast(now);
            return times.size();
        }

        synchronized boolean isExpired(long now) {
            return times.isEmpty() || times.peekLast() <= now - windowMs;
        }
    }
}
