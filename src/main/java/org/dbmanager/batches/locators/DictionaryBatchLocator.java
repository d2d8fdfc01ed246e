package org.dbmanager.batches.locators;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.IBatchCallback;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.batches.TransactionRequirement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Provides batches registered in memory, by name.
 * <p>
 * A name can hold several scripts and callbacks; they form the batch in registration order.
 * Scripts are split into commands when the batch is requested.
 * <p>
 * Options: {@code scripts} maps batch names to script text, e.g.
 * <pre>
 * scripts {
 *   "create-settings" = "CREATE TABLE ..."
 * }
 * </pre>
 */
public class DictionaryBatchLocator extends AbstractBatchLocator {

    private record Entry(String script, IBatchCallback callback, TransactionRequirement transactionRequirement,
                         IsolationLevel isolationLevel, ExecutionType executionType) {
    }

    private final Map<String, List<Entry>> entries = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public DictionaryBatchLocator() {
    }

    public DictionaryBatchLocator(Config options) {
        super(options);
        if (options.hasPath("scripts")) {
            for (Map.Entry<String, ConfigValue> script : options.getObject("scripts").entrySet()) {
                if (script.getValue().valueType() != ConfigValueType.STRING) {
                    throw new IllegalArgumentException(String.format(
                            "Script '%s' must be a string, but is %s", script.getKey(), script.getValue().valueType()));
                }
                addScript(script.getKey(), (String) script.getValue().unwrapped());
            }
        }
    }

    public DictionaryBatchLocator addScript(String name, String script) {
        return addScript(name, script, null, null);
    }

    /**
     * @param transactionRequirement preset for all commands of the script; inline directives must not contradict it
     * @param isolationLevel         preset for all commands of the script, {@code null} for none
     */
    public synchronized DictionaryBatchLocator addScript(String name, String script,
                                                         TransactionRequirement transactionRequirement,
                                                         IsolationLevel isolationLevel) {
        Objects.requireNonNull(script, "script cannot be null");
        entriesOf(name).add(new Entry(script, null, transactionRequirement, isolationLevel, null));
        return this;
    }

    public DictionaryBatchLocator addCallback(String name, IBatchCallback callback) {
        return addCallback(name, callback, TransactionRequirement.DONT_CARE, null, ExecutionType.NON_QUERY);
    }

    public synchronized DictionaryBatchLocator addCallback(String name, IBatchCallback callback,
                                                           TransactionRequirement transactionRequirement,
                                                           IsolationLevel isolationLevel, ExecutionType executionType) {
        Objects.requireNonNull(callback, "callback cannot be null");
        entriesOf(name).add(new Entry(null, callback, transactionRequirement, isolationLevel, executionType));
        return this;
    }

    public synchronized boolean remove(String name) {
        return entries.remove(name) != null;
    }

    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public synchronized Set<String> getNames() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(entries.keySet());
        return Collections.unmodifiableSet(names);
    }

    @Override
    protected synchronized boolean fillBatch(Batch batch, String name, String commandSeparator) {
        List<Entry> registered = entries.get(name);
        if (registered == null) {
            return false;
        }
        for (Entry entry : registered) {
            if (entry.script() != null) {
                addScriptCommands(batch, entry.script(), commandSeparator, entry.transactionRequirement(), entry.isolationLevel());
            } else {
                batch.addCallback(entry.callback(), entry.transactionRequirement(), entry.isolationLevel(), entry.executionType());
            }
        }
        return true;
    }

    private List<Entry> entriesOf(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Batch name cannot be null or blank");
        }
        return entries.computeIfAbsent(name, key -> new ArrayList<>());
    }
}
