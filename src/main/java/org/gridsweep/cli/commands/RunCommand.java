package org.gridsweep.cli.commands;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.gridsweep.cli.CommandLineInterface;
import org.gridsweep.runtime.Simulation;
import org.gridsweep.runtime.SimulationFactory;
import org.gridsweep.runtime.SimulationSettings;
import org.gridsweep.runtime.controller.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs one simulation from configuration, with command-line overrides, and prints the outcome.
 * <p>
 * Exit codes: 0 finished, 1 invalid settings, 2 aborted by the watchdog, 3 faulted.
 */
@Command(
    name = "run",
    description = "Run a cleaning simulation until it finishes or the watchdog fires"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_FINISHED = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_ABORTED = 2;
    static final int EXIT_FAULTED = 3;

    @Option(names = {"--strategy"}, description = "Coordination strategy: ${COMPLETION-CANDIDATES}")
    private Strategy strategy;

    @Option(names = {"--rows"}, description = "Grid rows")
    private Integer rows;

    @Option(names = {"--cols"}, description = "Grid columns")
    private Integer cols;

    @Option(names = {"--seed"}, description = "Run seed (random if omitted)")
    private Long seed;

    @Option(names = {"--fill"}, description = "Probability that a cell starts with trash")
    private Double fill;

    @Option(names = {"--wet-ratio"}, description = "Share of trash that is wet")
    private Double wetRatio;

    @Option(names = {"--bins"}, description = "Number of bins")
    private Integer bins;

    @Option(names = {"--capacity"}, description = "Garbage collector capacity")
    private Integer capacity;

    @Option(names = {"--max-ticks"}, description = "Watchdog limit (default: derived from grid size)")
    private Long maxTicks;

    @Option(names = {"--print-every"}, description = "Print the state every N ticks (0 = only at the end)",
            defaultValue = "0")
    private int printEvery;

    @Option(names = {"--randomize-starts"}, description = "Start agents on random cells instead of the corners")
    private Boolean randomizeStarts;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SimulationSettings settings;
        try {
            settings = SimulationSettings.fromConfig(withOverrides(parent.getConfig().getConfig("simulation")));
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Error: invalid settings: " + e.getMessage());
            return EXIT_INVALID;
        }

        Simulation simulation;
        try {
            simulation = SimulationFactory.create(settings);
        } catch (IllegalArgumentException e) {
            err.println("Error: cannot set up the run: " + e.getMessage());
            return EXIT_INVALID;
        }
        out.printf("Seed: %d%n", simulation.getSeed());
        out.printf("Strategy: %s, watchdog %d ticks%n", settings.strategy(), simulation.getMaxTicks());
        log.debug("Starting run with {}", settings);

        while (simulation.tick()) {
            if (printEvery > 0 && simulation.getCurrentTick() % printEvery == 0) {
                out.printf("--- tick %d ---%n%s", simulation.getCurrentTick(), simulation.getController().describe());
            }
        }
        Simulation.RunResult result = simulation.result();

        out.printf("Status: %s after %d ticks (seed %d)%n", result.status(), result.ticks(), result.seed());
        out.print(result.summary());
        out.flush();

        return switch (result.status()) {
            case FINISHED -> EXIT_FINISHED;
            case ABORTED -> EXIT_ABORTED;
            case FAULTED -> EXIT_FAULTED;
            case RUNNING -> throw new IllegalStateException("Run stopped while still running");
        };
    }

    private Config withOverrides(Config simulation) {
        Map<String, Object> overrides = new HashMap<>();
        putIfSet(overrides, "strategy", strategy == null ? null : strategy.name());
        putIfSet(overrides, "grid.rows", rows);
        putIfSet(overrides, "grid.cols", cols);
        putIfSet(overrides, "grid.fill-probability", fill);
        putIfSet(overrides, "grid.wet-ratio", wetRatio);
        putIfSet(overrides, "grid.bin-count", bins);
        putIfSet(overrides, "agents.garbage-capacity", capacity);
        putIfSet(overrides, "agents.randomize-starts", randomizeStarts);
        putIfSet(overrides, "watchdog.max-ticks", maxTicks);
        putIfSet(overrides, "seed", seed);
        return ConfigFactory.parseMap(overrides).withFallback(simulation);
    }

    private static void putIfSet(Map<String, Object> overrides, String path, Object value) {
        if (value != null) {
            overrides.put(path, value);
        }
    }
}
