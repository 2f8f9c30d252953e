package com.punchwheel.autoconfig;

import com.punchwheel.core.metric.PunchMeterRegistryProvider;
import com.punchwheel.core.metric.PunchMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class PunchWheelMetricsAutoConfiguration {

    @Bean
    public PunchMeterRegistryProvider punchMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new PunchMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public PunchMetrics punchMetrics(PunchMeterRegistryProvider provider) {
        return PunchMetrics.create(provider.getRegistry());
    }
}
