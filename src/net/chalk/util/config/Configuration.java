package net.chalk.util.config;

/**
 * A source of string-valued configuration entries.
 * Keys are dot-separated names like "chalk.indent"; get() returns null for
 * absent keys.
 */
public interface Configuration {

    String get(String key);

}
