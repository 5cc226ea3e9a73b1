package com.library.circulation.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LoanPolicyTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(PolicyConfiguration.class);

    @Test
    void unsetPropertiesFallBackToDefaults() {
        contextRunner.run(context -> {
            LoanPolicy policy = context.getBean(LoanPolicy.class);
            assertThat(policy.period()).isEqualTo(Duration.ofDays(14));
            assertThat(policy.maxActive()).isEqualTo(3);
        });
    }

    @Test
    void boundValuesAreUsed() {
        contextRunner
            .withPropertyValues("library.loans.period=7d", "library.loans.max-active=5")
            .run(context -> {
                LoanPolicy policy = context.getBean(LoanPolicy.class);
                assertThat(policy.period()).isEqualTo(Duration.ofDays(7));
                assertThat(policy.maxActive()).isEqualTo(5);
            });
    }

    @Test
    void nonPositiveLimitFailsStartup() {
        contextRunner
            .withPropertyValues("library.loans.max-active=0")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
            });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(LoanPolicy.class)
    static class PolicyConfiguration {
    }
}
