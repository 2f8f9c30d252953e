package com.punchwheel.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

public class PunchMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public PunchMeterRegistryProvider(List<MeterRegistry> discovered) {
        // 保底 Simple, 没有 actuator 时 status 也能读到计数
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
