package com.punchwheel.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnablePunchWheel {

    /**
     * 是否启动打卡调度
     */
    boolean value() default true;
}
