package com.punchwheel.autoconfig;

import com.punchwheel.config.PunchGuardProperties;
import com.punchwheel.core.guard.CircuitGuard;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        PunchGuardProperties.class
})
public class PunchGuardAutoConfiguration {

    /**
     * 按 operation 的熔断器
     */
    @Bean
    @ConditionalOnMissingBean
    public CircuitGuard circuitGuard(PunchGuardProperties props) {
        return new CircuitGuard(props);
    }
}
