package org.exprcalc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.exprcalc.Calculator;
import org.exprcalc.api.Calculation;
import org.exprcalc.api.Value;
import org.exprcalc.cli.config.CalculatorSettings;
import org.exprcalc.cli.config.CalculatorSettings.OutputFormat;
import org.exprcalc.cli.config.LoggingConfigurator;
import org.exprcalc.frontend.postfix.RpnElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "exprcalc",
    mixinStandardHelpOptions = true,
    version = "exprcalc 1.0",
    description = "Evaluates an arithmetic or comparison expression, e.g. 'cos(pi/3) + 2^-1'."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "exprcalc.conf";

    /** Exit code for an unusable configuration. */
    static final int CONFIG_ERROR_EXIT_CODE = 2;

    @Parameters(index = "0", arity = "0..1", paramLabel = "EXPRESSION", description = "The expression to evaluate.")
    private String expression;

    @Option(names = "--list", description = "List the available constants and functions instead of evaluating.")
    private boolean listRegistry;

    @Option(names = {"-c", "--config"}, description = "Path to a custom configuration file (default: ${DEFAULT-VALUE} in the working directory).",
            defaultValue = CONFIG_FILE_NAME, showDefaultValue = CommandLine.Help.Visibility.NEVER)
    private File configFile;

    @Option(names = "--rpn", description = "Also print the postfix (reverse polish) form of the expression.")
    private boolean printPostfix;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES}.")
    private OutputFormat format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Calculator calculator;

    public CommandLineInterface() {
        this(new Calculator());
    }

    CommandLineInterface(Calculator calculator) {
        this.calculator = calculator;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        System.exit(commandLine.execute(args));
    }

    @Override
    public Integer call() {
        if (expression == null && !listRegistry) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required parameter: 'EXPRESSION'");
        }
        final CalculatorSettings settings;
        try {
            final Config config = loadConfiguration();
            LoggingConfigurator.configure(config);
            settings = CalculatorSettings.from(config);
        } catch (ConfigException e) {
            LOGGER.error("Failed to load or parse configuration: {}", e.getMessage());
            return CONFIG_ERROR_EXIT_CODE;
        }

        final OutputFormat outputFormat = format != null ? format : settings.format();
        if (listRegistry) {
            return printRegistry(outputFormat);
        }
        final boolean showPostfix = printPostfix || settings.printPostfix();

        final Calculation<Value> result = calculator.calculate(expression);
        final List<RpnElement> postfix = showPostfix ? calculator.toPostfix(expression).value() : null;

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        if (outputFormat == OutputFormat.JSON) {
            out.println(new ResultRenderer().toJson(expression, result, postfix));
        } else {
            if (postfix != null) {
                out.println(ResultRenderer.formatPostfix(postfix));
            }
            if (result.isSuccess()) {
                out.println(ResultRenderer.format(result.value()));
            } else {
                err.println("ERROR: " + result.error());
            }
        }
        out.flush();
        err.flush();
        return result.isSuccess() ? 0 : settings.errorExitCode();
    }

    private int printRegistry(final OutputFormat outputFormat) {
        final PrintWriter out = spec.commandLine().getOut();
        if (outputFormat == OutputFormat.JSON) {
            out.println(new ResultRenderer().registryToJson(calculator.registry()));
        } else {
            ResultRenderer.formatRegistry(calculator.registry()).forEach(out::println);
        }
        out.flush();
        return 0;
    }

    /**
     * Load order: system properties, environment, configuration file, classpath defaults.
     * The file is the one given by {@code --config}, or {@value #CONFIG_FILE_NAME} in the
     * working directory if it exists.
     */
    private Config loadConfiguration() {
        Config fileConfig = ConfigFactory.empty();
        if (configFile.exists()) {
            LOGGER.debug("Using configuration file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else if (spec.commandLine().getParseResult().hasMatchedOption("--config")) {
            throw new ConfigException.IO(ConfigOriginFactory.newSimple("--config"),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }
}
