package net.littleredcomputer.crossword;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream stdout;

    @Before
    public void captureOutput() throws IOException {
        stdout = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
    }

    @After
    public void restoreOutput() {
        System.setOut(stdout);
    }

    private String file(String name, String contents) throws IOException {
        File f = folder.newFile(name);
        Files.write(f.toPath(), contents.getBytes(StandardCharsets.UTF_8));
        return f.getPath();
    }

    private String output() throws IOException {
        return out.toString(StandardCharsets.UTF_8.name());
    }

    @Test
    public void printsSolution() throws Exception {
        Main.main(new String[]{
                "-structure", file("structure.txt", "#___#\n#_##_\n#_##_\n#_##_\n#____\n"),
                "-words", file("words.txt", "one\ntwo\nthree\nfour\nfive\nsix\nseven\neight\nnine\nten\n"),
                "-loginterval", "PT0.5S"});
        assertThat(output(), is("█SIX█\n█E██F\n█V██I\n█E██V\n█NINE\n"));
    }

    @Test
    public void reportsNoSolution() throws Exception {
        Main.main(new String[]{
                "-structure", file("structure.txt", "___\n##_\n##_\n"),
                "-words", file("words.txt", "cat\ndog\n")});
        assertThat(output().trim(), is("No solution."));
    }

    @Test(expected = IllegalArgumentException.class)
    public void structureIsRequired() throws Exception {
        Main.main(new String[]{"-words", file("words.txt", "cat\n")});
    }
}
