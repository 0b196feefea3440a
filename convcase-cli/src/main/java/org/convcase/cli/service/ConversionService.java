package org.convcase.cli.service;

import org.convcase.CaseConverter;
import org.convcase.config.ConfigurationLoader;
import org.convcase.model.Case;
import org.convcase.options.ConvCaseOptions;

import java.util.List;
import java.util.Map;

/**
 * Resolves the source and target case from command-line options and the active
 * profile, then converts the inputs.
 */
public class ConversionService {

    private final ConfigurationLoader configurationLoader;

    public ConversionService() {
        this(new ConfigurationLoader());
    }

    public ConversionService(ConfigurationLoader configurationLoader) {
        this.configurationLoader = configurationLoader;
    }

    /**
     * Command-line values win over the profile. The profile is only read when an option is missing.
     *
     * @param to target case from the command line (nullable)
     * @param from source case from the command line (nullable)
     * @param profile profile name (nullable)
     * @return resolved cases; the source stays null when neither side declares one
     * @throws IllegalStateException if no target case is given anywhere
     */
    public ResolvedCases resolveCases(Case to, Case from, String profile) {
        if (to != null && from != null) {
            return new ResolvedCases(to, from);
        }

        Map<String, String> config = configurationLoader.loadConfiguration(profile);
        Case target = to != null ? to : parseOrNull(config.get(ConvCaseOptions.Conversion.TO_KEY));
        Case source = from != null ? from : parseOrNull(config.get(ConvCaseOptions.Conversion.FROM_KEY));

        if (target == null) {
            throw new IllegalStateException("Missing target case. Use --to or set conversion.to in "
                    + ConvCaseOptions.Profile.CONFIG_FILE);
        }
        return new ResolvedCases(target, source);
    }

    public List<String> convert(List<String> inputs, ResolvedCases cases) {
        return inputs.stream()
                .map(input -> CaseConverter.convert(input, cases.source(), cases.target()))
                .toList();
    }

    private static Case parseOrNull(String name) {
        if (name == null) {
            return null;
        }
        try {
            return Case.parse(name);
        } catch (IllegalArgumentException e) {
            System.err.println("Warning: Invalid case '" + name + "' in configuration. Ignoring.");
            return null;
        }
    }

    public record ResolvedCases(Case target, Case source) {
    }
}
