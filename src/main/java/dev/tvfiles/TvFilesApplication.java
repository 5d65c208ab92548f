package dev.tvfiles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the TV file inventory.
 *
 * <p>Runs as a non-web command-line application: the requested syncs execute once and the
 * process exits with the code reported by {@link dev.tvfiles.cli.SyncCommandRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TvFilesApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TvFilesApplication.class, args)));
    }
}
