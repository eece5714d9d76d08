package com.runway;

import com.runway.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class RunwayApplication {

    public static void main(String[] args) {
        String subcommand = CliRunner.subcommandOf(args);
        boolean serveMode = "serve".equals(subcommand);
        // attach also needs the web server: completion notifications arrive over HTTP
        boolean webMode = serveMode || "attach".equals(subcommand);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(RunwayApplication.class);
        builder.properties(
                "spring.main.web-application-type=" + (webMode ? "servlet" : "none"),
                "spring.main.banner-mode=off"
        );

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
