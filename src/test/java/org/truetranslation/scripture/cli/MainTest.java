package org.truetranslation.scripture.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.truetranslation.scripture.core.TestModules;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class MainTest {

    @TempDir
    Path home;

    private String originalHome;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        originalHome = System.getProperty("user.home");
        System.setProperty("user.home", home.toString());
    }

    @AfterEach
    void tearDown() {
        System.setProperty("user.home", originalHome);
    }

    @Test
    void testParseAsJson() {
        int exitCode = run("parse", "-r", "jn 3:16-17", "-j", "-s");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("\"name\": \"John\"")
                .contains("\"chapter\": 3")
                .contains("\"verseEnd\": 17")
                .contains("\"complete\": true");
    }

    @Test
    void testParseReportsUnknownBook() {
        int exitCode = run("parse", "-r", "Xyzzy 1:1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("Book \"Xyzzy\" not found");
    }

    @Test
    void testMatch() {
        int exitCode = run("match", "-q", "ex");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Exodus").contains("abbreviation");
        assertThat(run("match", "-q", "Xyzzy")).isEqualTo(1);
    }

    @Test
    void testSuggest() {
        assertThat(run("suggest", "-q", "Gen")).isZero();
        assertThat(out.toString()).contains("Genesis 1:1");

        assertThat(run("suggest", "-q", "John 3")).isZero();
        assertThat(out.toString()).contains("John 3:1");
    }

    @Test
    void testValidateWithoutModuleFails() {
        int exitCode = run("validate", "-r", "John 3:16");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No module specified");
    }

    @Test
    void testValidateAgainstModule() throws Exception {
        Path modules = Files.createDirectories(home.resolve("modules"));
        TestModules.createModule(modules, "TST");

        assertThat(run("versions", "-p", modules.toString())).isZero();
        assertThat(out.toString()).contains("TST").contains("Test Version");

        assertThat(run("validate", "-m", "TST", "-r", "John 1:52", "-s")).isEqualTo(1);
        assertThat(out.toString())
                .contains("Invalid: John 1 has only 51 verses")
                .contains("Did you mean: John 1:51");

        // The last used module is remembered.
        assertThat(run("validate", "-r", "jn 3:16", "-s")).isZero();
        assertThat(out.toString()).contains("John 3:16 exists in TST");
    }

    @Test
    void testVersionsRejectsMissingDirectory() {
        assertThat(run("versions", "-p", home.resolve("absent").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Not a directory");
    }

    @Test
    void testVersionOption() {
        assertThat(run("--version")).isZero();
        assertThat(out.toString()).contains("scripture-ref 1.0.0");
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }
}
