package org.convcase.cli;

import org.convcase.model.Case;
import picocli.CommandLine;

/**
 * Accepts a case name in any convention: snake, ScreamingSnake, upper-camel, ...
 */
public class CaseTypeConverter implements CommandLine.ITypeConverter<Case> {

    @Override
    public Case convert(String value) {
        try {
            return Case.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage() + " (run 'ccase list' for supported cases)");
        }
    }
}
