package org.convcase.cli;

import org.convcase.cli.service.ConversionService;
import org.convcase.config.ConfigurationLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CcaseCliTest {

    @TempDir Path tmp;

    private static class StreamCaptor implements AutoCloseable {
        private final PrintStream origOut = System.out;
        private final PrintStream origErr = System.err;
        private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
        private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
        StreamCaptor() {
            System.setOut(new PrintStream(outBuf, true));
            System.setErr(new PrintStream(errBuf, true));
        }
        String out() { return outBuf.toString(); }
        String err() { return errBuf.toString(); }
        @Override public void close() {
            System.setOut(origOut);
            System.setErr(origErr);
        }
    }

    private CommandLine cli() {
        return new CommandLine(new CcaseCli(new ConversionService(new ConfigurationLoader(tmp))));
    }

    @Test
    @DisplayName("-t snake: converts each argument on its own line")
    void convertsEachArgument() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("-t", "snake", "myVarName", "XMLHttpRequest");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out().lines()).containsExactly("my_var_name", "xml_http_request");
        }
    }

    @Test
    @DisplayName("-f narrows splitting to the source case")
    void declaredSource() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("--from", "snake", "--to", "title", "2020-04-16_my_cat_cali");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out().lines()).containsExactly("2020-04-16 My Cat Cali");
        }
    }

    @Test
    @DisplayName("Case names are accepted in any convention")
    void caseNameInAnyConvention() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("-t", "ScreamingSnake", "my variable");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out().lines()).containsExactly("MY_VARIABLE");
        }
    }

    @Test
    @DisplayName("Unknown case name -> usage error, exit 2")
    void unknownCase() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("-t", "flat", "myVar");

            assertThat(code).isEqualTo(2);
            assertThat(sc.err()).contains("Unknown case: flat");
        }
    }

    @Test
    @DisplayName("No target case and no profile -> exit 1")
    void missingTarget() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("myVar");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("Missing target case");
        }
    }

    @Test
    @DisplayName("No text -> exit 1")
    void missingText() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("-t", "snake");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("No text given");
        }
    }

    @Test
    @DisplayName("Target and source come from the selected profile")
    void targetFromProfile() throws IOException {
        Files.writeString(tmp.resolve("ccase.yaml"), """
                profiles:
                  ci:
                    conversion:
                      to: cobol
                      from: kebab
                """);

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("--profile", "ci", "my-var_name");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out().lines()).containsExactly("MY-VAR_NAME");
        }
    }

    @Test
    @DisplayName("Unknown case in the profile is ignored with a warning")
    void invalidCaseInProfile() throws IOException {
        Files.writeString(tmp.resolve("ccase.yaml"), """
                profiles:
                  dev:
                    conversion:
                      from: bogus
                """);

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("--profile", "dev", "-t", "snake", "myVar");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out().lines()).containsExactly("my_var");
            assertThat(sc.err()).contains("Invalid case 'bogus' in configuration");
        }
    }

    @Test
    @DisplayName("list prints every case with a sample")
    void listCases() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = cli().execute("list");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out().lines()).hasSize(13);
            assertThat(sc.out())
                    .contains("snake")
                    .contains("my_variable_22_name")
                    .contains("upper-camel")
                    .contains("mY vArIaBlE 22 nAmE");
            assertThat(sc.out().lines())
                    .anySatisfy(line -> assertThat(line).startsWith("screaming-snake").endsWith("MY_VARIABLE_22_NAME"))
                    .anySatisfy(line -> assertThat(line).startsWith("camel").endsWith("myVariable22Name"))
                    .anySatisfy(line -> assertThat(line).startsWith("train").endsWith("My-Variable-22-Name"));
        }
    }
}
