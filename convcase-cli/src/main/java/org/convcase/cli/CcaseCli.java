package org.convcase.cli;

import org.convcase.cli.service.ConversionService;
import org.convcase.model.Case;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for ccase.
 * Converts each argument to the target case and prints one result per line.
 */
@CommandLine.Command(
        name = "ccase",
        mixinStandardHelpOptions = true,
        version = "ccase 0.1.0",
        description = "Converts text between naming conventions (snake_case, camelCase, Title Case, ...).",
        subcommands = {
                ListCommand.class
        }
)
public class CcaseCli implements Callable<Integer> {

    @CommandLine.Option(names = {"-t", "--to"}, description = "Target case, e.g. snake, camel, title", converter = CaseTypeConverter.class)
    private Case to;

    @CommandLine.Option(names = {"-f", "--from"}, description = "Case the input is already written in", converter = CaseTypeConverter.class)
    private Case from;

    @CommandLine.Option(names = "--profile", description = "Profile in ccase.yaml to read defaults from")
    private String profile;

    @CommandLine.Parameters(paramLabel = "TEXT", arity = "0..*", description = "Text to convert")
    private List<String> inputs;

    private final ConversionService conversionService;

    public CcaseCli() {
        this(new ConversionService());
    }

    public CcaseCli(ConversionService conversionService) {
        this.conversionService = conversionService;
    }

    @Override
    public Integer call() {
        if (inputs == null || inputs.isEmpty()) {
            System.err.println("No text given. Usage: ccase -t <case> [-f <case>] TEXT...");
            return 1;
        }
        try {
            ConversionService.ResolvedCases cases = conversionService.resolveCases(to, from, profile);
            for (String result : conversionService.convert(inputs, cases)) {
                System.out.println(result);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Conversion failed: " + e.getMessage());
            return 1;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CcaseCli()).execute(args);
        System.exit(exitCode);
    }
}
