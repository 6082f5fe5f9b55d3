package com.account.relationship.domain;

import com.account.relationship.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the disallow-list from a CSV file.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * bad_domains
 * gmail.com
 * "mailinator.com"
 * </pre>
 *
 * <p>The header must contain a {@code bad_domains} column; other columns are ignored.
 * A leading byte-order mark, tabs and quotes are stripped. Locations prefixed with
 * {@code classpath:} are read from the classpath, anything else from the filesystem.</p>
 *
 * <p>Any failure, including an empty list, raises {@link ConfigurationException}.</p>
 */
public class BadDomainListLoader {
    private static final Logger log = LoggerFactory.getLogger(BadDomainListLoader.class);

    public static final String CLASSPATH_PREFIX = "classpath:";
    public static final String DEFAULT_LOCATION = CLASSPATH_PREFIX + "bad_domains.csv";
    static final String COLUMN = "bad_domains";
    private static final char BOM = '\uFEFF';

    /**
     * Loads the list from a {@code classpath:} or filesystem location.
     */
    public BadDomainList load(String location) {
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("Bad domain list location is not configured");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
        }
        return fromPath(Path.of(location));
    }

    public BadDomainList fromClasspath(String resource) {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = BadDomainListLoader.class.getClassLoader();
        }
        InputStream input = loader.getResourceAsStream(name);
        if (input == null) {
            throw new ConfigurationException("Bad domain list resource not found: " + CLASSPATH_PREFIX + name);
        }
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return read(reader, CLASSPATH_PREFIX + name);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read bad domain list " + CLASSPATH_PREFIX + name, e);
        }
    }

    public BadDomainList fromPath(Path path) {
        if (!Files.isReadable(path)) {
            throw new ConfigurationException("Bad domain list file not readable: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read bad domain list " + path, e);
        }
    }

    /**
     * Parses CSV content from a reader. The reader is not closed.
     */
    public BadDomainList read(Reader reader, String source) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        String header = br.readLine();
        if (header == null) {
            throw new ConfigurationException("Bad domain list is empty: " + source);
        }
        int column = findColumn(header);
        if (column < 0) {
            throw new ConfigurationException("Bad domain list " + source + " has no '" + COLUMN + "' column");
        }

        List<String> domains = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            String[] fields = line.split(",", -1);
            if (column >= fields.length) {
                continue;
            }
            String domain = cleanField(fields[column]);
            if (!domain.isEmpty()) {
                domains.add(domain);
            }
        }

        BadDomainList list = BadDomainList.of(domains, source);
        if (list.isEmpty()) {
            throw new ConfigurationException("Bad domain list contains no domains: " + source);
        }
        log.info("bad-domains.loaded count={} source={}", list.size(), source);
        return list;
    }

    private int findColumn(String header) {
        String[] names = header.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            if (COLUMN.equals(cleanField(names[i]))) {
                return i;
            }
        }
        return -1;
    }

    private String cleanField(String field) {
        String value = field;
        if (!value.isEmpty() && value.charAt(0) == BOM) {
            value = value.substring(1);
        }
        return value.replace("\t", "")
                .replace("\"", "")
                .trim()
                .toLowerCase(Locale.ROOT);
    }
}
