package com.punchwheel.core.spi;

/**
 * webhook 请求体序列化
 */
public interface PayloadSerializer {

    String serialize(Object payload);
}
