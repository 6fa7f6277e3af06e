/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.shell;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.Test;
import static org.junit.Assert.*;

public class ShellConfigTest {
    @Test
    public void defaultResource() {
        ShellConfig config = ShellConfig.getDefault();
        assertEquals("Input Lox: ", config.getPrompt());
        assertEquals(StandardCharsets.UTF_8, config.getCharset());
    }

    @Test
    public void missingResourceUsesDefaults() {
        ShellConfig config = new ShellConfig("no-such-file.properties");
        assertEquals("Input Lox: ", config.getPrompt());
        assertFalse(config.get("lox.charset").isPresent());
    }

    @Test
    public void explicitProperties() {
        Properties props = new Properties();
        props.setProperty(ShellConfig.PROMPT_KEY, "> ");
        props.setProperty(ShellConfig.CHARSET_KEY, "ISO-8859-1");

        ShellConfig config = new ShellConfig(props);
        assertEquals("> ", config.getPrompt());
        assertEquals(StandardCharsets.ISO_8859_1, config.getCharset());
    }

    @Test
    public void systemPropertyOverrides() {
        Properties props = new Properties();
        props.setProperty(ShellConfig.PROMPT_KEY, "> ");

        System.setProperty(ShellConfig.PROMPT_KEY, "lox> ");
        try {
            assertEquals("lox> ", new ShellConfig(props).getPrompt());
        } finally {
            System.clearProperty(ShellConfig.PROMPT_KEY);
        }
    }
}
