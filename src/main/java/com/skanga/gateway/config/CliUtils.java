package com.skanga.gateway.config;

import com.skanga.gateway.db.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for loading gateway configuration from the command line, a config file,
 * environment variables and system properties.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    public static final String SERVER_NAME = "DBGateway";
    public static final String SERVER_VERSION = "1.0.0";

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        shortToLong.put("c", "config_file");

        // Database connection
        shortToLong.put("b", "db_backend");
        shortToLong.put("H", "db_host");
        shortToLong.put("p", "db_port");
        shortToLong.put("U", "db_user");
        shortToLong.put("P", "db_password");
        shortToLong.put("d", "db_name");
        shortToLong.put("a", "db_auth_source");

        // Connection pool settings
        shortToLong.put("m", "db_min_pool_size");
        shortToLong.put("M", "db_max_pool_size");
        shortToLong.put("t", "connection_timeout_ms");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports both short form (-b) and long form (--db_backend) arguments.
     * Handles both key=value and key value formats for both forms.
     * Converts keys to uppercase for consistent lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String argKey = null;
            String argValue;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);

                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    argKey = argParts[0];
                    argValue = argParts[1];
                } else {
                    argKey = argWithoutPrefix;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[i + 1];
                        i++;
                    } else {
                        argValue = "true"; // Flag without value
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);

                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    argKey = shortToLong.get(argParts[0]);
                    argValue = argParts[1];
                } else {
                    argKey = shortToLong.get(shortArg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[i + 1];
                        i++;
                    } else {
                        argValue = "true";
                    }
                }
            } else {
                logger.debug("Ignoring positional argument: {}", currArg);
                continue;
            }

            if (argKey != null) {
                argsMap.put(argKey.toUpperCase(), argValue);
            } else {
                logger.warn("Unknown command line option: {}", currArg);
            }
        }

        return argsMap;
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables and system properties.
     * Uses priority order: CLI args (--db_host) > config file > environment variables (DB_HOST) >
     * system properties (-Ddb.host=) > hard coded defaults.
     *
     * @param args Command line arguments in --key=value format
     * @return Configured ConfigParams instance
     * @throws IOException            if the config file cannot be read
     * @throws ConfigurationException if a required value is missing or a number cannot be parsed
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(configFile);
                logger.info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException(ResourceManager.getErrorMessage("config.file.load.failed", configFile), e);
            }
        }

        // The backend is validated on connect, so an unknown name still loads here
        String dbBackend = requireValue("DB_BACKEND", cliArgs, fileConfig);
        String dbHost = requireValue("DB_HOST", cliArgs, fileConfig);
        String dbName = requireValue("DB_NAME", cliArgs, fileConfig);
        String dbPort = getConfigValue("DB_PORT", "0", cliArgs, fileConfig);
        String dbUser = getConfigValue("DB_USER", "", cliArgs, fileConfig);
        String dbPassword = getConfigValue("DB_PASSWORD", "", cliArgs, fileConfig);
        String authSource = getConfigValue("DB_AUTH_SOURCE", ConfigParams.DEFAULT_AUTH_SOURCE, cliArgs, fileConfig);
        String minPoolSize = getConfigValue("DB_MIN_POOL_SIZE",
                String.valueOf(ConfigParams.DEFAULT_MIN_POOL_SIZE), cliArgs, fileConfig);
        String maxPoolSize = getConfigValue("DB_MAX_POOL_SIZE",
                String.valueOf(ConfigParams.DEFAULT_MAX_POOL_SIZE), cliArgs, fileConfig);
        String connectionTimeoutMs = getConfigValue("CONNECTION_TIMEOUT_MS",
                String.valueOf(ConfigParams.DEFAULT_CONNECTION_TIMEOUT_MS), cliArgs, fileConfig);

        return new ConfigParams(dbBackend, dbHost,
                parseIntegerConfig("DB_PORT", dbPort),
                dbUser, dbPassword, dbName,
                parseIntegerConfig("DB_MIN_POOL_SIZE", minPoolSize),
                parseIntegerConfig("DB_MAX_POOL_SIZE", maxPoolSize),
                parseIntegerConfig("CONNECTION_TIMEOUT_MS", connectionTimeoutMs),
                authSource);
    }

    /**
     * Gets a configuration value using the priority order:
     * CLI args > config file > env vars > system properties > default.
     * Config file parameter is optional - if null, it's skipped in the priority chain.
     *
     * @param varName      Config parameter name (uppercase)
     * @param defaultValue Default value if not found in any source
     * @param cliArgs      Parsed command line arguments
     * @param fileConfig   Configuration from file (can be null if no config file)
     * @return The configuration value from the highest priority source
     */
    static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs, Map<String, String> fileConfig) {
        String cliValue = cliArgs.get(varName.toUpperCase());
        if (cliValue != null) {
            return cliValue;
        }

        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName.toUpperCase());
            if (fileValue != null) {
                return fileValue;
            }
        }

        String envValue = System.getenv(varName);
        if (envValue != null) {
            return envValue;
        }

        // System property (envVar.lower().replace('_', '.'))
        String propValue = System.getProperty(varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        return defaultValue;
    }

    private static String requireValue(String varName, Map<String, String> cliArgs, Map<String, String> fileConfig) {
        String configValue = getConfigValue(varName, null, cliArgs, fileConfig);
        if (configValue == null || configValue.trim().isEmpty()) {
            throw new ConfigurationException(ResourceManager.getErrorMessage("config.required.missing", varName));
        }
        return configValue.trim();
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are treated as comments.
     * Empty lines are ignored.
     *
     * @param configFilePath Path to the configuration file
     * @return Map of configuration key-value pairs
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(String configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = new BufferedReader(new FileReader(configFilePath))) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase();
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                // Remove quotes if present
                if (paramValue.length() >= 2 && ((paramValue.startsWith("\"") && paramValue.endsWith("\""))
                        || (paramValue.startsWith("'") && paramValue.endsWith("'")))) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASSWORD") ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    /**
     * Parses an integer configuration value with detailed error context.
     *
     * @param paramName The parameter name for error reporting
     * @param value     The string value to parse
     * @return Parsed integer value
     * @throws ConfigurationException if the value cannot be parsed as an integer
     */
    private static int parseIntegerConfig(String paramName, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, value), e);
        }
    }
}
