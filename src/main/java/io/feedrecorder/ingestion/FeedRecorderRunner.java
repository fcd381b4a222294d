package io.feedrecorder.ingestion;

import io.feedrecorder.ingestion.config.RecorderConfig;
import io.feedrecorder.ingestion.service.FeedRecorderJob;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the recorder once on startup. Accepts {@code --config=<path>} and {@code --output=<path>};
 * a leading {@code ~} is expanded to the user's home directory.
 */
@Component
@ConditionalOnProperty(prefix = "recorder.processing", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class FeedRecorderRunner implements ApplicationRunner, ExitCodeGenerator {

    private final FeedRecorderJob job;
    private final RecorderConfig recorderConfig;

    private int exitCode = FeedRecorderJob.EXIT_OK;

    public FeedRecorderRunner(FeedRecorderJob job, RecorderConfig recorderConfig) {
        this.job = job;
        this.recorderConfig = recorderConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path configPath = expandUser(option(args, "config", recorderConfig.configPath()));
        Path outputPath = expandUser(option(args, "output", recorderConfig.outputPath()));

        exitCode = job.run(configPath, outputPath);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private String option(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(values.size() - 1);
    }

    static Path expandUser(String path) {
        String home = System.getProperty("user.home");
        if (path.equals("~")) {
            return Path.of(home);
        }
        if (path.startsWith("~/")) {
            return Path.of(home, path.substring(2));
        }
        return Path.of(path);
    }
}
