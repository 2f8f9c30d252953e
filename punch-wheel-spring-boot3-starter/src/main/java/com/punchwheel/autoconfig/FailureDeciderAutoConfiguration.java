package com.punchwheel.autoconfig;

import com.punchwheel.core.failure.RouterFailureDecider;
import com.punchwheel.core.failure.decider.*;
import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.core.spi.failure.FailureDecider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class FailureDeciderAutoConfiguration {

    // 默认内置一组分类器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(ActionExceptionHandler.class)
    public ActionExceptionHandler actionExceptionHandler(){ return new ActionExceptionHandler(); }

    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler(){ return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler(){ return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(IoHandler.class)
    public IoHandler ioHandler(){ return new IoHandler(); }

    @Bean
    @ConditionalOnMissingBean(ConfigHandler.class)
    public ConfigHandler configHandler(){ return new ConfigHandler(); }

    @Bean
    @ConditionalOnMissingBean(UnknownHandler.class)
    public UnknownHandler unknownHandler(){ return new UnknownHandler(); }

    // Router 分类器, 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider(List<FailureCaseHandler<?>> handlers) {
        return new RouterFailureDecider(handlers);
    }
}
