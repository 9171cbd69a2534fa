/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Calculator settings.
 *
 * <p>A setting is looked up in a system property first, then in an
 * environment variable (the key upper cased with dots replaced by
 * underscores, {@code CALCULATOR_PARALLELISM} for example), then in the
 * loaded properties, and finally falls back to a built-in default.</p>
 */
public class CalculatorConfig
{
    /**
     * Number of threads used by the {@link BatchEvaluator}.
     */
    public static final String PARALLELISM_KEY = "calculator.parallelism";

    /**
     * Whether integer overflow is reported as an arithmetic error.
     */
    public static final String EXACT_KEY = "calculator.exact";

    private static final String DEFAULT_RESOURCE = "calculator.properties";

    private final Properties conf;

    /**
     * Returns the configuration loaded from {@code calculator.properties}
     * on the class path, or an empty configuration if there is none.
     */
    public static CalculatorConfig getDefault() {
        Properties props = new Properties();
        ClassLoader loader = MoreObjects.firstNonNull(
            Thread.currentThread().getContextClassLoader(),
            CalculatorConfig.class.getClassLoader());
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException(
                String.format("Could not read config resource %s: %s", DEFAULT_RESOURCE, ex.getMessage()), ex);
        }
        return new CalculatorConfig(props);
    }

    /**
     * Loads the configuration from the given properties file.
     */
    public static CalculatorConfig load(Path path) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException ex) {
            throw new IllegalArgumentException(
                String.format("Could not open config file %s: %s", path, ex.getMessage()), ex);
        }
        return new CalculatorConfig(props);
    }

    public CalculatorConfig() {
        this(new Properties());
    }

    public CalculatorConfig(Properties props) {
        this.conf = new Properties();
        this.conf.putAll(props);
    }

    public String get(String name) {
        String value = System.getProperty(name);
        if (value == null)
            value = System.getenv(Ascii.toUpperCase(name.replace('.', '_')));
        if (value == null)
            value = conf.getProperty(name);
        return value;
    }

    public String get(String name, String deflt) {
        String value = get(name);
        return value != null ? value : deflt;
    }

    public boolean getBool(String name, boolean deflt) {
        String value = get(name);
        return value != null ? Boolean.parseBoolean(value.trim()) : deflt;
    }

    public int getInt(String name, int deflt) {
        String value = get(name);
        if (value == null)
            return deflt;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(
                String.format("Invalid integer value for %s: %s", name, value), ex);
        }
    }

    /**
     * Returns the number of threads for batch evaluation, defaults to the
     * number of available processors.
     */
    public int getParallelism() {
        int n = getInt(PARALLELISM_KEY, Runtime.getRuntime().availableProcessors());
        Preconditions.checkArgument(n > 0, "%s must be positive: %s", PARALLELISM_KEY, n);
        return n;
    }

    /**
     * Returns true if integer overflow fails the evaluation, defaults to true.
     * When false, results wrap around as Java int arithmetic does. Division
     * by zero is an error in both modes.
     */
    public boolean isExactArithmetic() {
        return getBool(EXACT_KEY, true);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("parallelism", getParallelism())
            .add("exact", isExactArithmetic())
            .toString();
    }
}
