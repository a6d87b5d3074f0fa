package com.example.purgebot;

import com.example.purgebot.config.CliCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PurgeBotApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(PurgeBotApplication.class);
        // --sync / --now 只执行一次操作，不需要启动 Web 服务
        if (CliCommandRunner.isCliInvocation(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        application.run(args);
    }

}
