package org.dbmanager.batches.locators;

import com.typesafe.config.Config;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.BatchCommand;
import org.dbmanager.api.batches.ConflictingRequirementException;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.IBatchLocator;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.batches.TransactionRequirement;
import org.dbmanager.utils.EnumNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Base class for batch locators that turn script text into batch commands.
 * <p>
 * <strong>Command separation:</strong> a script is split at every line that consists only of the
 * command separator (default {@value #DEFAULT_COMMAND_SEPARATOR}, compared case-insensitively).
 * Segments are trimmed and blank segments dropped.
 * <p>
 * <strong>Inline options:</strong> each command may carry directives matched by the options pattern,
 * which must define the named groups {@code key} and {@code value}. The default pattern recognizes
 * {@code /* DBMANAGER:Key=Value *}{@code /}. Recognized keys are {@code TransactionRequirement},
 * {@code IsolationLevel} and {@code ExecutionType}; unknown keys are ignored and unparseable values
 * are ignored with a warning.
 * <p>
 * <strong>Options:</strong> {@code commandSeparator}, {@code optionsPattern}.
 */
public abstract class AbstractBatchLocator implements IBatchLocator {

    private static final Logger log = LoggerFactory.getLogger(AbstractBatchLocator.class);

    public static final String DEFAULT_COMMAND_SEPARATOR = "GO";

    public static final String DEFAULT_OPTIONS_PATTERN =
            "/\\*\\s*DBMANAGER\\s*:\\s*(?<key>\\w+)\\s*=\\s*(?<value>[^*]*?)\\s*\\*/";

    private String commandSeparator = DEFAULT_COMMAND_SEPARATOR;
    private Pattern optionsPattern = Pattern.compile(DEFAULT_OPTIONS_PATTERN);

    protected AbstractBatchLocator() {
    }

    protected AbstractBatchLocator(Config options) {
        Objects.requireNonNull(options, "Locator options cannot be null");
        if (options.hasPath("commandSeparator")) {
            setCommandSeparator(options.getString("commandSeparator"));
        }
        if (options.hasPath("optionsPattern")) {
            setOptionsPattern(options.getString("optionsPattern"));
        }
    }

    public String getCommandSeparator() {
        return commandSeparator;
    }

    /**
     * @param commandSeparator the default separator; {@code null} or blank disables splitting
     */
    public void setCommandSeparator(String commandSeparator) {
        this.commandSeparator = commandSeparator;
    }

    public Pattern getOptionsPattern() {
        return optionsPattern;
    }

    /**
     * @throws IllegalArgumentException if the pattern is invalid or lacks the {@code key} or {@code value} group
     */
    public void setOptionsPattern(String pattern) {
        Objects.requireNonNull(pattern, "Options pattern cannot be null");
        try {
            Pattern compiled = Pattern.compile(pattern);
            if (!pattern.contains("(?<key>") || !pattern.contains("(?<value>")) {
                throw new IllegalArgumentException(
                        "Options pattern must define the named groups 'key' and 'value': " + pattern);
            }
            this.optionsPattern = compiled;
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid options pattern: " + pattern, e);
        }
    }

    @Override
    public final Optional<Batch> getBatch(String name, String commandSeparator, Supplier<Batch> batchFactory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Batch name cannot be null or blank");
        }
        Objects.requireNonNull(batchFactory, "Batch factory cannot be null");

        String separator = commandSeparator != null ? commandSeparator : this.commandSeparator;
        Batch batch = batchFactory.get();
        if (!fillBatch(batch, name, separator)) {
            log.debug("{} has no batch named '{}'", getClass().getSimpleName(), name);
            return Optional.empty();
        }
        return Optional.of(batch);
    }

    /**
     * Adds the commands of batch {@code name} to {@code batch}.
     *
     * @param commandSeparator the separator to split scripts with; {@code null} or blank for no splitting
     * @return false if this locator does not know {@code name}
     */
    protected abstract boolean fillBatch(Batch batch, String name, String commandSeparator);

    /**
     * Splits {@code script} into commands and adds them to {@code batch}, applying inline options.
     *
     * @param transactionRequirement requirement preset for these commands, {@code null} for none
     * @param isolationLevel         isolation level preset for these commands, {@code null} for none
     * @throws ConflictingRequirementException if a directive contradicts a preset
     */
    protected void addScriptCommands(Batch batch, String script, String commandSeparator,
                                     TransactionRequirement transactionRequirement, IsolationLevel isolationLevel) {
        for (String commandText : separateScriptCommands(script, commandSeparator)) {
            ScriptCommandOptions commandOptions = extractOptions(commandText);

            TransactionRequirement preset = transactionRequirement != null ? transactionRequirement : TransactionRequirement.DONT_CARE;
            TransactionRequirement effectiveRequirement = preset.merge(
                    commandOptions.transactionRequirement().orElse(TransactionRequirement.DONT_CARE));

            IsolationLevel effectiveLevel = isolationLevel;
            if (commandOptions.isolationLevel().isPresent()) {
                IsolationLevel requested = commandOptions.isolationLevel().get();
                if (isolationLevel != null && isolationLevel != requested) {
                    throw new ConflictingRequirementException(String.format(
                            "Conflicting isolation levels: %s and %s", isolationLevel, requested));
                }
                effectiveLevel = requested;
            }

            batch.addScript(commandText, effectiveRequirement, effectiveLevel,
                    commandOptions.executionType().orElse(ExecutionType.NON_QUERY));
        }
    }

    /**
     * Reads the inline directives of one command.
     */
    public ScriptCommandOptions extractOptions(String commandText) {
        if (commandText == null || commandText.isEmpty()) {
            return ScriptCommandOptions.none();
        }

        Optional<TransactionRequirement> transactionRequirement = Optional.empty();
        Optional<IsolationLevel> isolationLevel = Optional.empty();
        Optional<ExecutionType> executionType = Optional.empty();

        Matcher matcher = optionsPattern.matcher(commandText);
        while (matcher.find()) {
            String key = matcher.group("key");
            String value = matcher.group("value");
            if (key == null) {
                continue;
            }
            switch (key.trim().replace("_", "").toLowerCase(Locale.ROOT)) {
                case "transactionrequirement" -> transactionRequirement = parseOption(TransactionRequirement.class, key, value);
                case "isolationlevel" -> isolationLevel = parseOption(IsolationLevel.class, key, value);
                case "executiontype" -> executionType = parseOption(ExecutionType.class, key, value);
                default -> log.debug("Ignoring unknown script option '{}'", key);
            }
        }
        return new ScriptCommandOptions(transactionRequirement, isolationLevel, executionType);
    }

    private static <E extends Enum<E>> Optional<E> parseOption(Class<E> type, String key, String value) {
        Optional<E> parsed = EnumNames.parse(type, value);
        if (parsed.isEmpty()) {
            log.warn("Ignoring script option '{}' with unparseable value '{}'", key, value);
        }
        return parsed;
    }

    /**
     * Splits script text into commands.
     * <p>
     * Line endings are normalized to {@code \n}. Every line consisting only of {@code separator}
     * (ignoring surrounding whitespace and case) ends a command. Commands are trimmed; blank ones
     * are dropped.
     *
     * @param script    the script text, may be {@code null}
     * @param separator the separator; {@code null} or blank returns the whole (trimmed) script as one command
     * @return the commands, empty for blank script text
     */
    public static List<String> separateScriptCommands(String script, String separator) {
        if (script == null || script.isBlank()) {
            return Collections.emptyList();
        }
        String normalized = script.replace("\r\n", "\n").replace('\r', '\n');
        if (separator == null || separator.isBlank()) {
            return List.of(normalized.trim());
        }

        String token = separator.trim();
        List<String> commands = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : normalized.split("\n", -1)) {
            if (line.trim().equalsIgnoreCase(token)) {
                addCommand(commands, current);
                current.setLength(0);
            } else {
                current.append(line).append('\n');
            }
        }
        addCommand(commands, current);
        return commands;
    }

    private static void addCommand(List<String> commands, StringBuilder text) {
        String command = text.toString().trim();
        if (!command.isEmpty()) {
            commands.add(command);
        }
    }
}
