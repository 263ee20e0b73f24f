package com.netbet.trustedsession;

import com.netbet.trustedsession.runner.OneShotRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class TrustedSessionApplication {

    public static void main(String[] args) {
        if (OneShotRunner.isOneShot(args)) {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(TrustedSessionApplication.class)
                    .web(WebApplicationType.NONE)
                    .properties("trusted-session.oneshot=true")
                    .run(args);
            System.exit(SpringApplication.exit(context));
        }
        SpringApplication.run(TrustedSessionApplication.class, args);
    }
}
