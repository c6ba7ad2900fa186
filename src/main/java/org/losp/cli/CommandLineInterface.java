package org.losp.cli;

import com.typesafe.config.Config;
import org.losp.Session;
import org.losp.cli.commands.DebugCommand;
import org.losp.cli.commands.ReplCommand;
import org.losp.cli.commands.RunCommand;
import org.losp.cli.config.ConfigLoader;
import org.losp.cli.config.LoggingConfigurator;
import org.losp.runtime.VirtualMachine;
import org.losp.runtime.VmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "losp",
    mixinStandardHelpOptions = true,
    version = "losp 1.0",
    description = "Compiles and runs losp programs on the losp virtual machine.",
    subcommands = {
        ReplCommand.class,
        DebugCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean loggingApplied = false;

    public CommandLineInterface() {
    }

    /**
     * Creates the root command with a preloaded configuration instead of the one from {@link ConfigLoader}.
     * @param config The configuration to use.
     */
    public CommandLineInterface(Config config) {
        this.config = config;
    }

    @Override
    public Integer call() {
        // Without a subcommand there is nothing to do.
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * @return The configuration, loaded and applied to logging on first use.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load();
        }
        if (!loggingApplied) {
            LoggingConfigurator.configure(config);
            loggingApplied = true;
        }
        return config;
    }

    /**
     * Creates a session on a new VM configured from {@code losp.vm}.
     *
     * @param out The destination of program output and, when tracing, of the trace.
     * @param trace Whether every instruction is printed before it executes.
     * @return The session.
     */
    public Session createSession(PrintWriter out, boolean trace) {
        VmSettings settings = VmSettings.fromConfig(getConfig());
        LOG.debug("Creating VM with max-frames={} max-stack={} trace={}", settings.maxFrames(), settings.maxStack(), trace);
        VirtualMachine vm = new VirtualMachine(settings, out);
        if (trace) {
            vm.setObserver(new TracePrinter(out));
        }
        return new Session(vm);
    }
}
