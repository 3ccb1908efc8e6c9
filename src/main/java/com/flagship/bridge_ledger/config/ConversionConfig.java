package com.flagship.bridge_ledger.config;

import com.flagship.bridge_ledger.conversion.FeeSchedule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
public class ConversionConfig {

    /**
     * Fee charged on every conversion: percentage plus spread, plus a flat amount in sats.
     */
    @Bean
    public FeeSchedule feeSchedule(@Value("${conversion.fee-percent:0.015}") BigDecimal feePercent,
                                   @Value("${conversion.margin-spread:0.002}") BigDecimal marginSpread,
                                   @Value("${conversion.fee-flat-sats:50}") long flatFeeSats) {
        return new FeeSchedule(feePercent, marginSpread, flatFeeSats);
    }
}
