package org.truetranslation.scripture.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

import org.truetranslation.scripture.core.AbbreviationTable;
import org.truetranslation.scripture.core.BookCatalog;
import org.truetranslation.scripture.core.ConfigManager;
import org.truetranslation.scripture.core.JsonBookCatalog;
import org.truetranslation.scripture.core.LocalizationManager;
import org.truetranslation.scripture.core.ReferenceFormatter;
import org.truetranslation.scripture.core.ScriptureReferenceEngine;
import org.truetranslation.scripture.core.SqliteBookCatalog;
import org.truetranslation.scripture.core.SqliteVerseStore;
import org.truetranslation.scripture.core.VerseStore;
import org.truetranslation.scripture.core.VerseStoreException;
import org.truetranslation.scripture.core.VersionScanner;
import org.truetranslation.scripture.core.model.BookMatch;
import org.truetranslation.scripture.core.model.ParsedReference;
import org.truetranslation.scripture.core.model.Suggestion;
import org.truetranslation.scripture.core.model.ValidationResult;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "scripture-ref",
    mixinStandardHelpOptions = true,
    versionProvider = Main.VersionProvider.class,
    resourceBundle = "picocli.main",
    subcommands = {
        Main.ParseCommand.class,
        Main.ValidateCommand.class,
        Main.MatchCommand.class,
        Main.SuggestCommand.class,
        Main.VersionsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class Main implements Callable<Integer> {
    private static final LocalizationManager loc;
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    static {
        String language = System.getProperty("user.language");
        String country = System.getProperty("user.country");

        if (language != null && !language.isEmpty()) {
            if (country != null && !country.isEmpty()) {
                Locale.setDefault(new Locale(language, country));
            } else {
                Locale.setDefault(new Locale(language));
            }
        }
        loc = LocalizationManager.getInstance();
    }

    @Spec CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Options and engine setup shared by the commands that work on references.
     * Without a module the bundled catalog is used and nothing can be validated.
     */
    abstract static class EngineCommand implements Callable<Integer> {
        @Spec CommandSpec spec;

        @Option(names = {"-m", "--module-name"}, descriptionKey = "modulename")
        String moduleName;
        @Option(names = {"-j", "--json"}, descriptionKey = "json")
        boolean outputJson;
        @Option(names = {"-v", "--verbose"}, descriptionKey = "verbose")
        boolean verbose;
        @Option(names = {"-s", "--silent"}, descriptionKey = "silent")
        boolean silent;

        ConfigManager configManager;
        int verbosity;
        SqliteVerseStore verseStore;

        abstract int run(ScriptureReferenceEngine engine) throws Exception;

        boolean requiresModule() {
            return false;
        }

        ConfigManager createConfigManager() {
            return new ConfigManager();
        }

        @Override
        public Integer call() {
            configManager = createConfigManager();
            verbosity = configManager.getVerbosity();
            if (verbose) verbosity = 2;
            if (silent) verbosity = 0;
            try {
                ScriptureReferenceEngine engine = createEngine();
                if (engine == null) {
                    return 1;
                }
                return run(engine);
            } catch (Exception e) {
                err().println(loc.getString("error.unexpected", e.getMessage()));
                if (verbosity > 0) e.printStackTrace(err());
                return 1;
            } finally {
                if (verseStore != null) verseStore.close();
            }
        }

        private ScriptureReferenceEngine createEngine() throws IOException {
            String abbreviationsFile = configManager.getAbbreviationsFile();
            AbbreviationTable abbreviations = abbreviationsFile.isEmpty()
                    ? AbbreviationTable.getDefault()
                    : AbbreviationTable.loadOrDefault(Paths.get(abbreviationsFile), verbosity);

            if ((moduleName == null || moduleName.isEmpty()) && requiresModule()) {
                moduleName = configManager.getLastUsedModule();
                if (moduleName == null || moduleName.isEmpty()) {
                    err().println(loc.getString("error.module.nameMissing"));
                    return null;
                }
                if (verbosity > 0) err().println(loc.getString("msg.usingLastModule", moduleName));
            }

            if (moduleName == null || moduleName.isEmpty()) {
                VerseStore noStore = (version, bookId, chapter) -> CompletableFuture.failedFuture(
                        new VerseStoreException(loc.getString("error.module.nameMissing")));
                return new ScriptureReferenceEngine(JsonBookCatalog.loadDefault(), noStore, abbreviations,
                        configManager.getDefaultVerseCount(), verbosity);
            }

            String modulesPathStr = configManager.getModulesPath();
            if (modulesPathStr == null || modulesPathStr.isEmpty()) {
                err().println(loc.getString("error.module.notConfigured"));
                return null;
            }
            Path modulesDir = Paths.get(modulesPathStr);
            verseStore = new SqliteVerseStore(modulesDir);
            Path modulePath = verseStore.modulePath(moduleName);
            if (!Files.exists(modulePath)) {
                err().println(loc.getString("error.module.notFound", modulePath));
                return null;
            }
            BookCatalog catalog = new SqliteBookCatalog(modulePath, verbosity);
            if (catalog.listBooks().isEmpty()) {
                err().println(loc.getString("error.catalog.noBooks", modulePath));
                return null;
            }
            ScriptureReferenceEngine engine = new ScriptureReferenceEngine(catalog, verseStore, abbreviations,
                    configManager.getDefaultVerseCount(), verbosity);
            engine.switchVersion(moduleName);
            return engine;
        }

        PrintWriter out() {
            return spec.commandLine().getOut();
        }

        PrintWriter err() {
            return spec.commandLine().getErr();
        }

        void printJson(Object value) {
            out().println(GSON.toJson(value));
        }

        void printReference(ParsedReference reference) {
            out().println(loc.getString("parse.output.header", reference.getBookToken()));
            if (reference.hasBook()) {
                out().println(loc.getString("parse.output.book", reference.getBook().getName(), reference.getBook().getId()));
            }
            if (reference.getChapter() != null) {
                out().println(loc.getString("parse.output.chapter", reference.getChapter()));
            }
            if (reference.getVerseStart() != null) {
                Object verses = reference.getVerseEnd() != null
                        ? reference.getVerseStart() + "-" + reference.getVerseEnd()
                        : reference.getVerseStart();
                out().println(loc.getString("parse.output.verses", verses));
            }
            out().println(loc.getString("parse.output.status",
                    reference.isValid() ? loc.getString("parse.output.valid") : loc.getString("parse.output.invalid"),
                    reference.isComplete() ? loc.getString("parse.output.complete") : loc.getString("parse.output.partial")));
            if (reference.getError() != null) {
                out().println(loc.getString("parse.output.error", reference.getError()));
            }
        }
    }

    @Command(name = "parse", resourceBundle = "picocli.parse")
    static class ParseCommand extends EngineCommand {
        @Option(names = {"-r", "--reference"}, required = true, descriptionKey = "reference")
        String referenceString;

        @Override
        int run(ScriptureReferenceEngine engine) {
            ParsedReference reference = engine.parseReference(referenceString);
            if (outputJson) {
                printJson(reference);
            } else {
                printReference(reference);
            }
            return reference.isValid() ? 0 : 1;
        }
    }

    @Command(name = "validate", resourceBundle = "picocli.validate")
    static class ValidateCommand extends EngineCommand {
        @Option(names = {"-r", "--reference"}, required = true, descriptionKey = "reference")
        String referenceString;

        @Override
        boolean requiresModule() {
            return true;
        }

        @Override
        int run(ScriptureReferenceEngine engine) {
            ParsedReference reference = engine.parseReference(referenceString);
            ValidationResult result = engine.validateReference(reference).join();
            configManager.setLastUsedModule(moduleName);

            if (outputJson) {
                Map<String, Object> json = new LinkedHashMap<>();
                json.put("reference", reference);
                json.put("validation", result);
                printJson(json);
            } else if (result.isValid()) {
                out().println(loc.getString("validate.output.valid", ReferenceFormatter.format(reference), moduleName));
            } else {
                out().println(loc.getString("validate.output.invalid", result.getError()));
                if (result.hasAutoCorrection()) {
                    out().println(loc.getString("validate.output.correction", ReferenceFormatter.format(result.getAutoCorrection())));
                }
            }
            return result.isValid() ? 0 : 1;
        }
    }

    @Command(name = "match", resourceBundle = "picocli.match")
    static class MatchCommand extends EngineCommand {
        @Option(names = {"-q", "--query"}, required = true, descriptionKey = "query")
        String query;
        @Option(names = {"-n", "--limit"}, defaultValue = "5", descriptionKey = "limit")
        int limit;

        @Override
        int run(ScriptureReferenceEngine engine) {
            List<BookMatch> matches = engine.findBookMatches(query, limit);
            if (outputJson) {
                printJson(matches);
            } else if (matches.isEmpty()) {
                out().println(loc.getString("match.output.none", query));
            } else {
                for (int i = 0; i < matches.size(); i++) {
                    BookMatch match = matches.get(i);
                    out().printf("%2d. %-20s %-12s %7.1f%n", i + 1, match.getBook().getName(),
                            match.getMatchType().name().toLowerCase(Locale.ROOT), match.getScore());
                }
            }
            return matches.isEmpty() ? 1 : 0;
        }
    }

    @Command(name = "suggest", resourceBundle = "picocli.suggest")
    static class SuggestCommand extends EngineCommand {
        @Option(names = {"-q", "--query"}, required = true, descriptionKey = "query")
        String query;
        @Option(names = {"-n", "--limit"}, descriptionKey = "limit")
        Integer limit;

        @Override
        int run(ScriptureReferenceEngine engine) {
            int max = Math.max(0, limit != null ? limit : configManager.getSuggestionLimit());
            ParsedReference reference = engine.parseReference(query);
            List<Suggestion> suggestions;
            if (reference.isValid() && reference.hasBook() && reference.getChapter() != null) {
                // Book is settled; only the numbers are still being typed.
                suggestions = engine.completionSuggestions(reference.getBook(), query);
            } else {
                suggestions = engine.generateSuggestions(query, max);
            }
            if (suggestions.size() > max) {
                suggestions = new ArrayList<>(suggestions.subList(0, max));
            }

            if (outputJson) {
                printJson(suggestions);
            } else {
                for (Suggestion suggestion : suggestions) {
                    out().printf("%-30s %-9s %7.1f%n", suggestion.getText(),
                            suggestion.getType().name().toLowerCase(Locale.ROOT), suggestion.getScore());
                }
            }
            return 0;
        }
    }

    @Command(name = "versions", resourceBundle = "picocli.versions")
    static class VersionsCommand implements Callable<Integer> {
        @Spec CommandSpec spec;
        @Option(names = {"-p", "--path"}, descriptionKey = "path")
        Path modulesPath;
        @Option(names = {"-j", "--json"}, descriptionKey = "json")
        boolean outputJson;

        ConfigManager createConfigManager() {
            return new ConfigManager();
        }

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            ConfigManager configManager = createConfigManager();
            if (modulesPath != null) {
                if (!Files.isDirectory(modulesPath)) {
                    err.println(loc.getString("error.path.invalid", modulesPath));
                    return 1;
                }
                configManager.setModulesPath(modulesPath.toAbsolutePath().toString());
                out.println(loc.getString("msg.modulePathUpdated", modulesPath.toAbsolutePath()));
            }
            String currentModulesPath = configManager.getModulesPath();
            if (currentModulesPath == null || currentModulesPath.trim().isEmpty()) {
                err.println(loc.getString("error.module.notConfigured"));
                return 1;
            }
            try {
                List<VersionScanner.Version> versions = new VersionScanner().findVersions(Paths.get(currentModulesPath));
                if (outputJson) {
                    List<Map<String, String>> json = new ArrayList<>();
                    for (VersionScanner.Version version : versions) {
                        Map<String, String> entry = new LinkedHashMap<>();
                        entry.put("id", version.getId());
                        entry.put("language", version.getLanguage());
                        entry.put("description", version.getDescription());
                        json.add(entry);
                    }
                    out.println(GSON.toJson(json));
                } else if (versions.isEmpty()) {
                    out.println(loc.getString("msg.noModulesFound", currentModulesPath));
                } else {
                    versions.forEach(version -> out.printf("%s\t%s\t%s%n", version.getLanguage(), version.getId(), version.getDescription()));
                }
            } catch (IOException e) {
                err.println(loc.getString("error.directory.read", e.getMessage()));
                return 1;
            }
            return 0;
        }
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] { loc.getString("app.version") };
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
