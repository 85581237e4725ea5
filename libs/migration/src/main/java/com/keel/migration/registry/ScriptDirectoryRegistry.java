package com.keel.migration.registry;

import com.keel.migration.MigrationException;
import com.keel.migration.MigrationLoadException;
import com.keel.migration.MigrationNames;
import com.keel.migration.MigrationOperation;
import com.keel.migration.MigrationSource;
import com.keel.migration.MigrationUnit;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers SQL migration scripts in a directory.
 *
 * <p>Only regular files named {@code NNN_<anything>.<extension>} are picked up; names starting with
 * {@code __} are reserved and skipped. A directory that does not exist yields no migrations, which
 * is the normal state of a deployment that never had scripts. Scripts are read as text and split by
 * {@link SqlScriptParser}; nothing found in the directory is ever executed as code.
 */
public class ScriptDirectoryRegistry implements MigrationRegistry {

    /** Default script extension. */
    public static final String DEFAULT_EXTENSION = "sql";

    private static final Logger log = LoggerFactory.getLogger(ScriptDirectoryRegistry.class);

    private final Path directory;
    private final String extension;
    private final Pattern fileNamePattern;

    public ScriptDirectoryRegistry(Path directory) {
        this(directory, DEFAULT_EXTENSION);
    }

    /**
     * @param directory directory to scan
     * @param extension script extension without the dot
     */
    public ScriptDirectoryRegistry(Path directory, String extension) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (extension == null || extension.isBlank() || extension.startsWith(".")) {
            throw new IllegalArgumentException("Invalid script extension: " + extension);
        }
        this.directory = directory;
        this.extension = extension;
        this.fileNamePattern = Pattern.compile("^\\d{3}_.*\\." + Pattern.quote(extension) + "$");
    }

    @Override
    public List<MigrationSource> discover() {
        if (!Files.isDirectory(directory)) {
            log.debug("Migration directory {} does not exist", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::isMigrationFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(ScriptFile::new)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MigrationLoadException("Cannot scan migration directory " + directory, e);
        }
    }

    @Override
    public MigrationUnit load(MigrationSource source) {
        if (!(source instanceof ScriptFile script)) {
            throw new MigrationLoadException("Not a migration script: " + source.location());
        }
        String name = nameOf(script);
        if (!MigrationNames.isValidName(name)) {
            throw new MigrationLoadException(
                    "Invalid migration name '" + name + "' for " + script.location());
        }
        String text;
        try {
            text = Files.readString(script.path(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationLoadException("Cannot read migration " + script.location(), e);
        }
        SqlScriptParser.ParsedScript parsed = SqlScriptParser.parse(text, script.location());
        return new MigrationUnit(name, operation(parsed.up()), operation(parsed.down()));
    }

    @Override
    public boolean supports(MigrationSource source) {
        return source instanceof ScriptFile;
    }

    /**
     * Writes an empty script numbered after the highest discovered version.
     *
     * @param description letters and underscores
     * @return path of the new script
     */
    public Path createScript(String description) {
        return createScript(description, List.of());
    }

    /**
     * Writes an empty script numbered after the highest version found either in this directory or
     * among {@code knownNames}, so scripts never reuse a version owned by another registry.
     *
     * @param description letters and underscores
     * @param knownNames migration names or file names provided elsewhere
     * @return path of the new script
     */
    public Path createScript(String description, Collection<String> knownNames) {
        List<String> existing = new ArrayList<>(knownNames);
        discover().stream().map(MigrationSource::fileName).forEach(existing::add);
        String fileName = MigrationNames.nextFileName(description, existing, extension);
        Path script = directory.resolve(fileName);
        String template =
                "-- "
                        + MigrationNames.nameOf(fileName)
                        + "\n\n-- migrate:up\n\n\n-- migrate:down\n\n";
        try {
            Files.createDirectories(directory);
            Files.writeString(script, template, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationException("Cannot write migration script " + script, e);
        }
        log.info("Created migration script {}", script);
        return script;
    }

    public Path directory() {
        return directory;
    }

    public String extension() {
        return extension;
    }

    private boolean isMigrationFile(Path path) {
        String fileName = path.getFileName().toString();
        return !fileName.startsWith("__") && fileNamePattern.matcher(fileName).matches();
    }

    private static MigrationOperation operation(List<String> statements) {
        if (statements == null) {
            return null;
        }
        List<String> copy = List.copyOf(statements);
        return executor -> {
            for (String statement : copy) {
                executor.execute(statement);
            }
        };
    }
}
