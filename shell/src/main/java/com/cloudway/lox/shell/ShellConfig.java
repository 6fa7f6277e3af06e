/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.shell;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Properties;
import static java.util.Objects.requireNonNull;

import com.google.common.io.Resources;

/**
 * Shell settings. Values are looked up first in the system properties and
 * then in a properties resource on the class path.
 */
public class ShellConfig
{
    public static final String DEFAULT_RESOURCE = "lox.properties";

    public static final String PROMPT_KEY = "lox.prompt";
    public static final String CHARSET_KEY = "lox.charset";

    private static final String DEFAULT_PROMPT = "Input Lox: ";

    private final Properties conf;

    public static ShellConfig getDefault() {
        return new ShellConfig(DEFAULT_RESOURCE);
    }

    /**
     * Loads the configuration from the named class path resource. A missing
     * resource yields an empty configuration.
     */
    public ShellConfig(String resource) {
        this(load(requireNonNull(resource)));
    }

    public ShellConfig(Properties conf) {
        this.conf = requireNonNull(conf);
    }

    private static Properties load(String resource) {
        Properties props = new Properties();
        URL url = ShellConfig.class.getClassLoader().getResource(resource);
        if (url != null) {
            try (Reader in = Resources.asCharSource(url, StandardCharsets.UTF_8).openStream()) {
                props.load(in);
            } catch (IOException ex) {
                throw new UncheckedIOException("Cannot load " + resource, ex);
            }
        }
        return props;
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.getProperty(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public String getPrompt() {
        return get(PROMPT_KEY, DEFAULT_PROMPT);
    }

    public Charset getCharset() {
        return get(CHARSET_KEY).map(Charset::forName).orElse(StandardCharsets.UTF_8);
    }

    public String toString() {
        return conf.toString();
    }
}
