package org.dbmanager.batches.locators;

import com.typesafe.config.Config;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.IBatchCallback;
import org.dbmanager.api.batches.IBatchLocator;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.batches.TransactionRequirement;
import org.dbmanager.utils.EnumNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Registry of callback batches.
 * <p>
 * Callbacks are registered explicitly by the host application, either with their metadata or as
 * {@link ICallbackBatch} instances carrying a {@link CallbackBatch} annotation. Several callbacks
 * registered under one name form one batch, in registration order.
 * <p>
 * <strong>Options:</strong>
 * <ul>
 *   <li>{@code classNames}: {@link ICallbackBatch} classes to instantiate and register</li>
 *   <li>{@code serviceLoader} (default false): also register all {@link ICallbackBatch} services
 *       visible to the context class loader</li>
 * </ul>
 */
public class CallbackBatchLocator implements IBatchLocator {

    private static final Logger log = LoggerFactory.getLogger(CallbackBatchLocator.class);

    private record Registration(IBatchCallback callback, TransactionRequirement transactionRequirement,
                                IsolationLevel isolationLevel, ExecutionType executionType) {
    }

    private final Map<String, List<Registration>> registrations = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public CallbackBatchLocator() {
    }

    public CallbackBatchLocator(Config options) {
        Objects.requireNonNull(options, "Locator options cannot be null");
        if (options.hasPath("classNames")) {
            for (String className : options.getStringList("classNames")) {
                register(instantiate(className));
            }
        }
        if (options.hasPath("serviceLoader") && options.getBoolean("serviceLoader")) {
            registerServices(Thread.currentThread().getContextClassLoader());
        }
    }

    /**
     * Registers a callback under the name and metadata of its {@link CallbackBatch} annotation.
     * Without annotation the simple class name and default metadata are used.
     *
     * @return the batch name the callback was registered under
     */
    public String register(ICallbackBatch callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        CallbackBatch metadata = callback.getClass().getAnnotation(CallbackBatch.class);
        if (metadata == null) {
            String name = callback.getClass().getSimpleName();
            register(name, callback, TransactionRequirement.DONT_CARE, null, ExecutionType.NON_QUERY);
            return name;
        }

        String name = metadata.name().isBlank() ? callback.getClass().getSimpleName() : metadata.name();
        IsolationLevel isolationLevel = null;
        if (!metadata.isolationLevel().isBlank()) {
            isolationLevel = EnumNames.parse(IsolationLevel.class, metadata.isolationLevel())
                    .orElseThrow(() -> new IllegalArgumentException(String.format(
                            "Unknown isolation level '%s' on callback batch %s",
                            metadata.isolationLevel(), callback.getClass().getName())));
        }
        register(name, callback, metadata.transactionRequirement(), isolationLevel, metadata.executionType());
        return name;
    }

    public synchronized CallbackBatchLocator register(String name, IBatchCallback callback,
                                                      TransactionRequirement transactionRequirement,
                                                      IsolationLevel isolationLevel, ExecutionType executionType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Batch name cannot be null or blank");
        }
        Objects.requireNonNull(callback, "callback cannot be null");
        registrations.computeIfAbsent(name, key -> new ArrayList<>())
                .add(new Registration(callback, transactionRequirement, isolationLevel, executionType));
        log.debug("Registered callback batch '{}': {}", name, callback.getClass().getName());
        return this;
    }

    /**
     * Registers every {@link ICallbackBatch} service declared under {@code META-INF/services}.
     *
     * @return the number of callbacks registered
     */
    public int registerServices(ClassLoader classLoader) {
        int count = 0;
        for (ICallbackBatch callback : ServiceLoader.load(ICallbackBatch.class, classLoader)) {
            register(callback);
            count++;
        }
        log.debug("Registered {} callback batch service(s)", count);
        return count;
    }

    public synchronized boolean unregister(String name) {
        return registrations.remove(name) != null;
    }

    @Override
    public synchronized Set<String> getNames() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(registrations.keySet());
        return Collections.unmodifiableSet(names);
    }

    @Override
    public synchronized Optional<Batch> getBatch(String name, String commandSeparator, Supplier<Batch> batchFactory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Batch name cannot be null or blank");
        }
        List<Registration> registered = registrations.get(name);
        if (registered == null) {
            return Optional.empty();
        }
        Batch batch = batchFactory.get();
        for (Registration registration : registered) {
            batch.addCallback(registration.callback(), registration.transactionRequirement(),
                    registration.isolationLevel(), registration.executionType());
        }
        return Optional.of(batch);
    }

    private static ICallbackBatch instantiate(String className) {
        try {
            Class<?> callbackClass = Class.forName(className);
            return (ICallbackBatch) callbackClass.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException(
                    "Callback batch class not found: " + className +
                    ". Make sure the class exists and is in the classpath.", e);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException(
                    "Callback batch class must implement ICallbackBatch: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    "Callback batch must have a public no-argument constructor: " + className, e);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    "Failed to instantiate callback batch: " + className + ". Error: " + e.getMessage(), e);
        }
    }
}
