package org.exprcalc.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.exprcalc.cli.config.LoggingConfigurator;
import org.exprcalc.junit.extensions.logging.ExpectLog;
import org.exprcalc.junit.extensions.logging.LogLevel;
import org.exprcalc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the picocli command in-process with captured output streams.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private String stdout() {
        return out.toString().strip();
    }

    @Test
    void printsTheValue() {
        assertThat(run("2*(3+4)")).isZero();
        assertThat(stdout()).isEqualTo("14");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void printsBooleansAndFractions() {
        assertThat(run("pi>=e")).isZero();
        assertThat(run("4/5")).isZero();

        assertThat(stdout().lines()).containsExactly("true", "0.8");
    }

    @Test
    void expressionsStartingWithASignNeedTheOptionTerminator() {
        assertThat(run("--", "-2^2")).isZero();
        assertThat(stdout()).isEqualTo("4");
    }

    @Test
    void negativeZeroKeepsItsSign() {
        assertThat(run("--", "-0")).isZero();
        assertThat(stdout()).isEqualTo("-0");
    }

    @Test
    void listsTheStandardLibrary() {
        assertThat(run("--list")).isZero();

        assertThat(stdout().lines())
                .contains("pi = 3.141592653589793", "inf = inf", "hypot(2)", "log(1 to 2)")
                .startsWith("pi = 3.141592653589793");
    }

    @Test
    void listsTheStandardLibraryAsJson() {
        assertThat(run("--list", "--format", "JSON")).isZero();

        JsonObject json = JsonParser.parseString(stdout()).getAsJsonObject();
        assertThat(json.getAsJsonObject("constants").get("tau").getAsDouble()).isEqualTo(2 * Math.PI);
        assertThat(json.getAsJsonObject("functions").get("round").getAsString()).isEqualTo("1 to 2");
    }

    @Test
    void reportsErrorsOnStandardError() {
        assertThat(run("1/0")).isEqualTo(1);

        assertThat(stdout()).isEmpty();
        assertThat(err.toString()).startsWith("ERROR: Operation '/' failed: float division by zero");
    }

    @Test
    void emptyExpressionIsAnError() {
        assertThat(run("")).isEqualTo(1);
        assertThat(err.toString().strip()).isEqualTo("ERROR: Empty expression");
    }

    @Test
    void printsPostfixBeforeTheValue() {
        assertThat(run("--rpn", "1+2*3")).isZero();
        assertThat(stdout().lines()).containsExactly("1 2 3 * +", "7");
    }

    @Test
    void rendersJson() {
        assertThat(run("--format", "json", "--rpn", "1<2")).isZero();

        JsonObject json = JsonParser.parseString(stdout()).getAsJsonObject();
        assertThat(json.get("expression").getAsString()).isEqualTo("1<2");
        assertThat(json.get("value").getAsBoolean()).isTrue();
        assertThat(json.getAsJsonArray("postfix")).hasSize(3);
    }

    @Test
    void rendersJsonErrors() {
        assertThat(run("-f", "JSON", "1 + qwerty")).isEqualTo(1);

        JsonObject error = JsonParser.parseString(stdout()).getAsJsonObject().getAsJsonObject("error");
        assertThat(error.get("code").getAsString()).isEqualTo("UNKNOWN_TOKEN");
        assertThat(error.get("column").getAsInt()).isEqualTo(5);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void readsSettingsFromConfigFile(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("custom.conf");
        Files.writeString(config, "exprcalc.cli.error-exit-code = 3\nexprcalc.output.print-postfix = true\n");

        assertThat(run("--config", config.toString(), "abs()")).isEqualTo(3);
        assertThat(run("--config", config.toString(), "2^3")).isZero();
        assertThat(stdout().lines()).containsExactly("abs/0", "2 3 ^", "8");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to load or parse configuration.*")
    void missingConfigFileIsAConfigurationError(@TempDir Path dir) {
        int exitCode = run("--config", dir.resolve("missing.conf").toString(), "1+1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.CONFIG_ERROR_EXIT_CODE);
        assertThat(stdout()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to load or parse configuration.*")
    void invalidSettingIsAConfigurationError(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("bad.conf");
        Files.writeString(config, "exprcalc.output.format = XML\n");

        assertThat(run("--config", config.toString(), "1+1")).isEqualTo(CommandLineInterface.CONFIG_ERROR_EXIT_CODE);
    }

    @Test
    void missingExpressionIsAUsageError() {
        assertThat(run()).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("EXPRESSION");
    }
}
