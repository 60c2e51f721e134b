package net.littleredcomputer.crossword;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('_' marks a fillable cell)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "filename of PNG image of the solution")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Path path(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return Paths.get(cmd.getOptionValue(option));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword = Crossword.fromFiles(path(cmd, "structure"), path(cmd, "words"));
        Optional<Map<Variable, String>> assignment = new CrosswordSolver(crossword)
                .setLogInterval(logInterval(cmd))
                .solve();
        if (!assignment.isPresent()) {
            System.out.println("No solution.");
            return;
        }
        CrosswordRenderer renderer = new CrosswordRenderer(crossword);
        System.out.print(renderer.toText(assignment.get()));
        if (cmd.hasOption("output")) {
            renderer.saveImage(assignment.get(), path(cmd, "output"));
        }
    }
}
