package com.punchwheel.app;

import com.punchwheel.annotation.EnablePunchWheel;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 入口：java -jar punch-wheel-app.jar [run | test-notifications]
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnablePunchWheel
public class PunchWheelApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(PunchWheelApplication.class, args);
        // run 命令在收到信号、容器关闭后才返回，此时交给 shutdown hook 收尾
        if (context.isActive()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
