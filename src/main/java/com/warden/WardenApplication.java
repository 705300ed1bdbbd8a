package com.warden;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@SpringBootApplication
public class WardenApplication {

    static final String CONFIG_OPTION = "--config=";
    static final String CONFIG_ENV = "WARDEN_CONFIG_PATH";

    public static void main(String[] args) {
        List<String> remaining = new ArrayList<>(Arrays.asList(args));
        String configPath = extractConfigPath(remaining, System.getenv(CONFIG_ENV));
        args = remaining.toArray(new String[0]);

        boolean serveMode = remaining.contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(WardenApplication.class);

        if (serveMode) {
            // Enable web server for the REST API
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }
        if (configPath != null) {
            builder.properties("spring.config.additional-location=optional:file:" + configPath);
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            // CLI app: exit after command execution
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
        // In serve mode, the embedded web server keeps the JVM alive
    }

    /**
     * Removes {@code --config=FILE} from the arguments and returns the file,
     * falling back to {@code fromEnv}. Returns {@code null} when neither is set.
     */
    static String extractConfigPath(List<String> args, String fromEnv) {
        String configPath = null;
        var it = args.iterator();
        while (it.hasNext()) {
            String arg = it.next();
            if (arg.startsWith(CONFIG_OPTION)) {
                configPath = arg.substring(CONFIG_OPTION.length());
                it.remove();
            }
        }
        if (configPath == null || configPath.isBlank()) {
            configPath = fromEnv;
        }
        return configPath == null || configPath.isBlank() ? null : configPath;
    }
}
