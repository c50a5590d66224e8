package com.fintech.settlement.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class SettlementPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @EnableConfigurationProperties(SettlementProperties.class)
    static class PropertiesConfig {
    }

    @Test
    @DisplayName("Should bind a tax rate below one")
    void shouldAcceptFractionalRate() {
        contextRunner.withPropertyValues("settlement.tax.rate=0.16").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(SettlementProperties.class).getTax().getRate())
                    .isEqualByComparingTo(new BigDecimal("0.16"));
        });
    }

    @Test
    @DisplayName("Should refuse to start with a tax rate of one")
    void shouldRejectRateOfOne() {
        contextRunner.withPropertyValues("settlement.tax.rate=1").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
        });
    }

    @Test
    @DisplayName("Should refuse to start with a negative tax rate")
    void shouldRejectNegativeRate() {
        contextRunner.withPropertyValues("settlement.tax.rate=-0.05").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
        });
    }
}
