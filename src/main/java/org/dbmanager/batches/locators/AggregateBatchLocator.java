package org.dbmanager.batches.locators;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.IBatchLocator;
import org.dbmanager.utils.EnumNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Combines several locators into one.
 * <p>
 * <strong>Modes:</strong>
 * <ul>
 *   <li>{@link Mode#WATERFALL}: the first locator (in registration order) that knows the name provides the batch</li>
 *   <li>{@link Mode#MERGE}: every locator must know the name; their commands are concatenated in
 *       registration order. If any locator lacks the name, the lookup fails.</li>
 * </ul>
 * {@link #getNames()} is the case-insensitive union of all locators' names in both modes.
 * <p>
 * <strong>Options:</strong> {@code mode} (default WATERFALL) and {@code locators}, a list of
 * {@code { className = ..., options { ... } }} blocks instantiated through their public
 * {@code (Config)} constructor. {@code commandSeparator} and {@code optionsPattern} given here
 * apply to every locator that does not set its own.
 */
public class AggregateBatchLocator implements IBatchLocator {

    private static final Logger log = LoggerFactory.getLogger(AggregateBatchLocator.class);

    public enum Mode {
        WATERFALL,
        MERGE
    }

    private final Mode mode;
    private final List<IBatchLocator> locators = new CopyOnWriteArrayList<>();

    public AggregateBatchLocator(Mode mode, List<? extends IBatchLocator> locators) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        locators.forEach(this::add);
    }

    public AggregateBatchLocator(Mode mode, IBatchLocator... locators) {
        this(mode, List.of(locators));
    }

    public AggregateBatchLocator(Config options) {
        String modeName = options.hasPath("mode") ? options.getString("mode") : Mode.WATERFALL.name();
        this.mode = EnumNames.parse(Mode.class, modeName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown aggregate locator mode: " + modeName));
        Config sharedOptions = ConfigFactory.empty();
        for (String key : List.of("commandSeparator", "optionsPattern")) {
            if (options.hasPath(key)) {
                sharedOptions = sharedOptions.withValue(key, options.getValue(key));
            }
        }
        if (options.hasPath("locators")) {
            for (Config locatorConfig : options.getConfigList("locators")) {
                add(createLocator(locatorConfig, sharedOptions));
            }
        }
    }

    public Mode getMode() {
        return mode;
    }

    public AggregateBatchLocator add(IBatchLocator locator) {
        locators.add(Objects.requireNonNull(locator, "locator cannot be null"));
        return this;
    }

    public List<IBatchLocator> getLocators() {
        return Collections.unmodifiableList(new ArrayList<>(locators));
    }

    @Override
    public Set<String> getNames() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (IBatchLocator locator : locators) {
            names.addAll(locator.getNames());
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public Optional<Batch> getBatch(String name, String commandSeparator, Supplier<Batch> batchFactory) {
        if (locators.isEmpty()) {
            return Optional.empty();
        }
        return mode == Mode.WATERFALL
                ? getFirstBatch(name, commandSeparator, batchFactory)
                : getMergedBatch(name, commandSeparator, batchFactory);
    }

    private Optional<Batch> getFirstBatch(String name, String commandSeparator, Supplier<Batch> batchFactory) {
        for (IBatchLocator locator : locators) {
            Optional<Batch> batch = locator.getBatch(name, commandSeparator, batchFactory);
            if (batch.isPresent()) {
                return batch;
            }
        }
        return Optional.empty();
    }

    private Optional<Batch> getMergedBatch(String name, String commandSeparator, Supplier<Batch> batchFactory) {
        Batch merged = batchFactory.get();
        for (IBatchLocator locator : locators) {
            Optional<Batch> batch = locator.getBatch(name, commandSeparator, batchFactory);
            if (batch.isEmpty()) {
                log.debug("Batch '{}' not provided by {}, merged lookup fails", name, locator.getClass().getSimpleName());
                return Optional.empty();
            }
            merged.getCommands().addAll(batch.get().getCommands());
        }
        return Optional.of(merged);
    }

    /**
     * Instantiates a locator from a {@code { className, options }} block.
     *
     * @param sharedOptions fallback for the locator's options (e.g. a common command separator)
     * @throws IllegalArgumentException if the class is missing, has the wrong type or no {@code (Config)} constructor
     */
    public static IBatchLocator createLocator(Config locatorConfig, Config sharedOptions) {
        if (!locatorConfig.hasPath("className")) {
            throw new IllegalArgumentException("Batch locator configuration requires 'className'");
        }
        String className = locatorConfig.getString("className");
        Config locatorOptions = locatorConfig.hasPath("options")
                ? locatorConfig.getConfig("options").withFallback(sharedOptions)
                : sharedOptions;
        try {
            Class<?> locatorClass = Class.forName(className);
            IBatchLocator locator = (IBatchLocator) locatorClass
                    .getDeclaredConstructor(Config.class)
                    .newInstance(locatorOptions);
            log.debug("Loaded batch locator: {}", className);
            return locator;
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException(
                    "Batch locator class not found: " + className +
                    ". Make sure the class exists and is in the classpath.", e);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException(
                    "Batch locator class must implement IBatchLocator: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    "Batch locator must have public constructor(Config): " + className, e);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    "Failed to instantiate batch locator: " + className + ". Error: " + e.getMessage(), e);
        }
    }
}
