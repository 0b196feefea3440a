package org.convcase.cli;

import org.convcase.Casing;
import org.convcase.model.Case;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Prints every supported case with a sample rendering.
 */
@CommandLine.Command(
        name = "list",
        mixinStandardHelpOptions = true,
        description = "Lists the supported cases."
)
public class ListCommand implements Callable<Integer> {

    static final String SAMPLE = "my variable 22 name";

    @Override
    public Integer call() {
        for (Case c : Case.values()) {
            String name = Casing.of(c.name()).fromCase(Case.SCREAMING_SNAKE).toCase(Case.KEBAB);
            System.out.printf("%-16s %s%n", name, Casing.of(SAMPLE).fromCase(Case.LOWER).toCase(c));
        }
        return 0;
    }
}
