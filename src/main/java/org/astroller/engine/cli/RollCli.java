package org.astroller.engine.cli;

import org.astroller.dsl.RollException;
import org.astroller.engine.Roller;
import org.astroller.engine.execution.RandomSource;
import org.astroller.engine.result.ResultNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage: RollCli [-v] [--seed N] [roll words...]
 *
 * The words are joined with single spaces; with no words "1d20" is rolled.
 * Prints the final value, or the full trace with -v.
 */
public final class RollCli {

    private static final Logger log = LoggerFactory.getLogger(RollCli.class);

    static final String DEFAULT_ROLL = "1d20";

    private final PrintStream out;

    RollCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new RollCli(System.out).run(args));
    }

    /**
     * @return The process exit status
     */
    int run(String[] args) {
        boolean verbose = false;
        RandomSource random = RandomSource.threadLocal();
        List<String> words = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-v")) {
                verbose = true;
            } else if (arg.equals("--seed")) {
                if (i + 1 >= args.length) {
                    out.println("Error: --seed needs a value");
                    return 2;
                }
                String seed = args[++i];
                try {
                    random = RandomSource.seeded(Long.parseLong(seed));
                } catch (NumberFormatException e) {
                    out.println("Error: invalid seed " + seed);
                    return 2;
                }
            } else {
                words.add(arg);
            }
        }

        String rollString = words.isEmpty() ? DEFAULT_ROLL : String.join(" ", words);
        try {
            ResultNode result = new Roller(random).roll(rollString);
            out.println(verbose ? result.render() : result.valueText());
            return 0;
        } catch (RollException e) {
            log.debug("Roll '{}' failed", rollString, e);
            out.println("Could not process roll string " + rollString);
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
