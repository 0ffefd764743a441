package org.gridsweep.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.net.URL;

import org.gridsweep.cli.CommandLineInterface;
import org.gridsweep.cli.config.LoggingConfigurator;
import org.gridsweep.junit.extensions.logging.ExpectLog;
import org.gridsweep.junit.extensions.logging.LogLevel;
import org.gridsweep.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;

/**
 * Smoke tests for the run command: option parsing, overrides and exit codes.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class RunCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Level rootLevelBefore;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
        rootLevelBefore = rootLogger().getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        rootLogger().setLevel(rootLevelBefore);
    }

    @Test
    void runSubcommandIsRegistered() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("run");
    }

    @Test
    void helpListsTheOverrides() {
        execute("run", "--help");

        assertThat(out.toString() + err.toString())
                .contains("--strategy")
                .contains("--seed")
                .contains("--capacity")
                .contains("--randomize-starts");
    }

    @Test
    void finishesAndReportsTheSeed() {
        int exitCode = execute("-c", testConfig(), "run", "--seed", "7");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_FINISHED);
        assertThat(out.toString())
                .contains("Seed: 7")
                .contains("Strategy: DECENTRALIZED")
                .contains("Status: FINISHED");
    }

    @Test
    void commandLineOverridesTheConfigFile() {
        int exitCode = execute("-c", testConfig(), "run", "--seed", "3", "--strategy", "CENTRALIZED",
                "--rows", "4", "--cols", "5", "--print-every", "1");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_FINISHED);
        assertThat(out.toString())
                .contains("Strategy: CENTRALIZED")
                .contains("--- tick 1 ---")
                .contains("Centralized controller, tick 1");
    }

    @Test
    void sameSeedSameOutcome() {
        execute("-c", testConfig(), "run", "--seed", "11");
        String first = out.toString();
        out.getBuffer().setLength(0);

        execute("-c", testConfig(), "run", "--seed", "11");

        assertThat(out.toString()).isEqualTo(first);
    }

    @Test
    void invalidSettingsExitWithOne() {
        int exitCode = execute("-c", testConfig(), "run", "--rows", "0");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_INVALID);
        assertThat(err.toString()).contains("Error: invalid settings");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Simulation", messagePattern = "Watchdog aborted.*")
    void watchdogAbortExitsWithTwo() {
        int exitCode = execute("-c", testConfig(), "run", "--seed", "5", "--fill", "1.0", "--max-ticks", "1");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_ABORTED);
        assertThat(out.toString()).contains("Status: ABORTED after 1 ticks (seed 5)");
    }

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String testConfig() {
        URL url = getClass().getResource("run-test.conf");
        assertThat(url).isNotNull();
        try {
            return new File(url.toURI()).getAbsolutePath();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
