package org.nowstart.intraday.replay;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackages = "org.nowstart.intraday.replay")
@ConfigurationPropertiesScan(basePackages = "org.nowstart.intraday.replay")
public class ReplayMain {

    public static void main(String[] args) {
        try (var ignored = new SpringApplicationBuilder(ReplayMain.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .properties("replay.enabled=true")
                .run(args)) {
            // ApplicationRunner beans execute during startup.
        }
    }
}
