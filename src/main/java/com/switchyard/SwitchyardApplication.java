package com.switchyard;

import com.switchyard.agents.ShutdownCoordinator;
import com.switchyard.core.model.ShutdownReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class SwitchyardApplication {

    private static final Logger log = LoggerFactory.getLogger(SwitchyardApplication.class);

    public static void main(String[] args) {
        SpringApplicationBuilder builder = new SpringApplicationBuilder(SwitchyardApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                );

        ApplicationContext ctx = builder.run(args);

        // Close terminals before the context goes away; the JVM hook only covers signals
        ShutdownReport report = ctx.getBean(ShutdownCoordinator.class).shutdown();
        if (!report.clean()) {
            log.warn("Shutdown left {} terminal(s) open: {}", report.failures().size(), report.failures());
        }

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
