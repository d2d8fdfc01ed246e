package org.dbmanager.batches.locators;

import com.typesafe.config.Config;
import org.dbmanager.api.batches.Batch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.JarURLConnection;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLConnection;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Provides batches from script files packaged as classpath resources.
 * <p>
 * Every file below one of the configured locations whose file name matches the name format
 * becomes a batch; the format's {@code name} group is the batch name. Locations are scanned in
 * directories and in jars. The scan runs on first use and again after {@link #refresh()}.
 * <p>
 * <strong>Options:</strong>
 * <ul>
 *   <li>{@code locations} (default {@code ["db/batches"]})</li>
 *   <li>{@code nameFormat} (default {@value #DEFAULT_NAME_FORMAT})</li>
 *   <li>{@code encoding} (default UTF-8)</li>
 *   <li>{@code commandSeparator}, {@code optionsPattern} (see {@link AbstractBatchLocator})</li>
 * </ul>
 */
public class ClasspathScriptBatchLocator extends AbstractBatchLocator {

    private static final Logger log = LoggerFactory.getLogger(ClasspathScriptBatchLocator.class);

    public static final String DEFAULT_NAME_FORMAT = "(?<name>^.+?)\\.sql$";
    public static final String DEFAULT_LOCATION = "db/batches";

    private final ClassLoader classLoader;
    private final List<String> locations;
    private final Pattern nameFormat;
    private final Charset encoding;

    private Map<String, String> resourcesByName;

    public ClasspathScriptBatchLocator(ClassLoader classLoader, List<String> locations) {
        this(classLoader, locations, DEFAULT_NAME_FORMAT, StandardCharsets.UTF_8);
    }

    public ClasspathScriptBatchLocator(ClassLoader classLoader, List<String> locations, String nameFormat, Charset encoding) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader cannot be null");
        this.locations = List.copyOf(locations).stream().map(ClasspathScriptBatchLocator::normalizeLocation).toList();
        this.nameFormat = compileNameFormat(nameFormat);
        this.encoding = Objects.requireNonNull(encoding, "encoding cannot be null");
    }

    public ClasspathScriptBatchLocator(Config options) {
        super(options);
        this.classLoader = Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : ClasspathScriptBatchLocator.class.getClassLoader();
        this.locations = (options.hasPath("locations") ? options.getStringList("locations") : List.of(DEFAULT_LOCATION))
                .stream().map(ClasspathScriptBatchLocator::normalizeLocation).toList();
        this.nameFormat = compileNameFormat(options.hasPath("nameFormat") ? options.getString("nameFormat") : DEFAULT_NAME_FORMAT);
        this.encoding = Charset.forName(options.hasPath("encoding") ? options.getString("encoding") : "UTF-8");
    }

    public List<String> getLocations() {
        return locations;
    }

    /**
     * Discards the scan result; the next lookup scans the locations again.
     */
    public synchronized void refresh() {
        resourcesByName = null;
    }

    @Override
    public Set<String> getNames() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(resources().keySet());
        return Collections.unmodifiableSet(names);
    }

    @Override
    protected boolean fillBatch(Batch batch, String name, String commandSeparator) {
        String resource = resources().get(name);
        if (resource == null) {
            return false;
        }
        addScriptCommands(batch, readResource(resource), commandSeparator, null, null);
        return true;
    }

    private String readResource(String resource) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Resource disappeared from classpath: " + resource);
            }
            return new String(in.readAllBytes(), encoding);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read batch script " + resource, e);
        }
    }

    private synchronized Map<String, String> resources() {
        if (resourcesByName == null) {
            Map<String, String> found = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (String location : locations) {
                for (String resource : listResources(location)) {
                    String fileName = resource.substring(resource.lastIndexOf('/') + 1);
                    Matcher matcher = nameFormat.matcher(fileName);
                    if (!matcher.find()) {
                        continue;
                    }
                    String batchName = matcher.group("name");
                    if (batchName == null || batchName.isBlank()) {
                        continue;
                    }
                    String previous = found.putIfAbsent(batchName, resource);
                    if (previous != null) {
                        log.warn("Ignoring batch script '{}': batch '{}' is already provided by '{}'",
                                resource, batchName, previous);
                    }
                }
            }
            log.debug("Found {} batch script(s) in {}", found.size(), locations);
            resourcesByName = found;
        }
        return resourcesByName;
    }

    private List<String> listResources(String location) {
        List<String> resources = new ArrayList<>();
        try {
            Enumeration<URL> urls = classLoader.getResources(location);
            while (urls.hasMoreElements()) {
                URL url = urls.nextElement();
                switch (url.getProtocol()) {
                    case "file" -> listDirectory(location, Paths.get(url.toURI()), resources);
                    case "jar" -> listJar(location, url, resources);
                    default -> log.warn("Cannot scan batch location '{}': unsupported protocol '{}'", url, url.getProtocol());
                }
            }
        } catch (IOException | URISyntaxException e) {
            log.warn("Failed to scan batch location '{}': {}", location, e.getMessage());
            log.debug("Scan failure details for '{}':", location, e);
        }
        return resources;
    }

    private static void listDirectory(String location, Path directory, List<String> resources) throws IOException {
        try (Stream<Path> files = Files.walk(directory)) {
            files.filter(Files::isRegularFile)
                    .map(file -> location + "/" + directory.relativize(file).toString().replace('\\', '/'))
                    .sorted()
                    .forEach(resources::add);
        }
    }

    private static void listJar(String location, URL url, List<String> resources) throws IOException {
        URLConnection connection = url.openConnection();
        if (!(connection instanceof JarURLConnection jarConnection)) {
            return;
        }
        jarConnection.setUseCaches(false);
        try (JarFile jar = jarConnection.getJarFile()) {
            String prefix = location + "/";
            List<String> entries = new ArrayList<>();
            Enumeration<JarEntry> jarEntries = jar.entries();
            while (jarEntries.hasMoreElements()) {
                JarEntry entry = jarEntries.nextElement();
                if (!entry.isDirectory() && entry.getName().startsWith(prefix)) {
                    entries.add(entry.getName());
                }
            }
            Collections.sort(entries);
            resources.addAll(entries);
        }
    }

    private static Pattern compileNameFormat(String nameFormat) {
        Objects.requireNonNull(nameFormat, "nameFormat cannot be null");
        if (!nameFormat.contains("(?<name>")) {
            throw new IllegalArgumentException("Name format must define the named group 'name': " + nameFormat);
        }
        return Pattern.compile(nameFormat, Pattern.CASE_INSENSITIVE);
    }

    private static String normalizeLocation(String location) {
        String normalized = location.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
