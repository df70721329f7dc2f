package com.brayford.organization.config;

import com.brayford.lifecycle.DeletionLifecycle;
import com.brayford.lifecycle.OrganizationDeletionService;
import com.brayford.lifecycle.SecureRandomTokenGenerator;
import com.brayford.lifecycle.TokenGenerator;
import com.brayford.lifecycle.notification.NotificationFormatter;
import com.brayford.lifecycle.port.CompletionScheduler;
import com.brayford.lifecycle.port.DeletionNotifier;
import com.brayford.lifecycle.port.DeletionRequestStore;
import com.brayford.lifecycle.port.MemberStore;
import com.brayford.lifecycle.port.OrganizationPurger;
import com.brayford.lifecycle.port.TenantDirectory;
import com.brayford.observability.MetricFactory;
import com.brayford.observability.SensitiveDataRedactor;
import com.brayford.observability.SpanHelper;
import com.brayford.organization.domain.MembershipService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free platform libraries into the Spring context.
 */
@Configuration
public class OrganizationServiceConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenGenerator tokenGenerator() {
        return new SecureRandomTokenGenerator();
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, OrganizationServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    /** Uses whatever OpenTelemetry SDK the deployment installs globally; a no-op tracer otherwise. */
    @Bean
    @ConditionalOnMissingBean
    public SpanHelper spanHelper(OrganizationServiceProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.name()));
    }

    @Bean
    public DeletionLifecycle deletionLifecycle(DeletionProperties deletion, TokenGenerator tokenGenerator) {
        return new DeletionLifecycle(deletion.toPolicy(), tokenGenerator);
    }

    @Bean
    public NotificationFormatter notificationFormatter(
            OrganizationServiceProperties properties, DeletionProperties deletion) {
        return new NotificationFormatter(properties.appUrl(), deletion.zoneId());
    }

    @Bean
    public OrganizationDeletionService organizationDeletionService(
            DeletionLifecycle lifecycle,
            DeletionRequestStore requests,
            MemberStore members,
            TenantDirectory directory,
            DeletionNotifier notifier,
            CompletionScheduler scheduler,
            OrganizationPurger purger,
            NotificationFormatter formatter,
            MetricFactory metrics,
            Clock clock,
            DeletionProperties deletion) {
        return new OrganizationDeletionService(
                lifecycle, requests, members, directory, notifier, scheduler, purger,
                formatter, metrics, clock, deletion.maxWriteAttempts());
    }

    @Bean
    public MembershipService membershipService(
            MemberStore members, TenantDirectory directory, Clock clock, DeletionProperties deletion) {
        return new MembershipService(members, directory, clock, deletion.maxWriteAttempts());
    }
}
