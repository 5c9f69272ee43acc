package org.broadinstitute.varanno.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.UserException;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * Path variables in {@link org.aeonbits.owner.Config.Sources} annotations are resolved before a configuration is
 * created so that unset variables fall through to the next source instead of being read as literal paths.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Get the variable names used in the {@link org.aeonbits.owner.Config.Sources} of the given class.
     * @param configClass the configuration interface to inspect.  Must not be {@code null}.
     * @return the names of the variables, in declaration order.
     */
    @VisibleForTesting
    static List<String> getSourcesAnnotationPathVariables(final Class<? extends Config> configClass) {
        Utils.nonNull(configClass);

        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for ( final String source : annotation.value() ) {
                final Matcher matcher = sourcesAnnotationPathVariablePattern.matcher(source);
                if ( matcher.find() ) {
                    configPathVariableNames.add(matcher.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    private synchronized void resolvePathVariables(final Class<? extends Config> clazz) {
        if ( alreadyResolvedPathVariables.contains(clazz) ) {
            return;
        }

        for ( final String property : getSourcesAnnotationPathVariables(clazz) ) {
            if ( System.getenv().containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + System.getenv(property) + " - will search for config here.");
            }
            else if ( System.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + System.getProperty(property) + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable already set in Config Factory Properties: " + property);
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
        alreadyResolvedPathVariables.add(clazz);
    }

    /**
     * Quick way to get the shared annotation configuration.
     * The returned values are validated once; unusable values raise {@link UserException.BadConfiguration}.
     * @return The annotation configuration.
     */
    public VarAnnoConfig getVarAnnoConfig() {
        final VarAnnoConfig config = getOrCreate(VarAnnoConfig.class);
        validate(config);
        return config;
    }

    /**
     * Creates a new {@link Config} instance from the specified interface, bypassing the cache.
     * @param clazz   the interface extending from {@link Config} that you want to instantiate.
     * @param imports additional variables to be used to resolve the properties.
     * @param <T>     type of the interface.
     * @return an object implementing the given interface, which maps methods to property values.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Gets from the cache or creates an instance of the given configuration interface.
     * @param clazz     the interface extending from {@link Config} that you want to instantiate.
     * @param imports   additional variables to be used to resolve the properties.
     * @param <T>       type of the interface.
     * @return          an object implementing the given interface, possibly taken from the cache.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    /**
     * Checks that the values in the given configuration can be used.
     * @param config configuration to check.  Must not be {@code null}.
     * @throws UserException.BadConfiguration if a value is out of range.
     */
    public static void validate(final VarAnnoConfig config) {
        Utils.nonNull(config);
        if ( config.symbolicDeletionThreshold() < 1 ) {
            throw new UserException.BadConfiguration("allele.symbolic_deletion_threshold", config.symbolicDeletionThreshold(), "must be positive");
        }
        if ( config.storedAlleleMaxLength() < 1 ) {
            throw new UserException.BadConfiguration("allele.stored_max_length", config.storedAlleleMaxLength(), "must be positive");
        }
        if ( config.engineThreads() < 1 ) {
            throw new UserException.BadConfiguration("engine.threads", config.engineThreads(), "must be at least 1");
        }
    }

    /**
     * Logs all the parameters in the given {@link Config} object at {@link Level#DEBUG}
     * @param config A {@link Config} object from which to log all parameters and values.
     * @param <T> any {@link Config} type to use to log all configuration information.
     */
    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Level.DEBUG);
    }

    public static <T extends Config> void logConfigFields(final T config, final Level level) {
        Utils.nonNull(config);
        Utils.nonNull(level);

        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    /**
     * Gets the value of each {@link org.aeonbits.owner.Config.Key}-annotated option in the given configuration.
     * @param config configuration to read.  Must not be {@code null}.
     * @return property names mapped to their current values, sorted by property name.
     */
    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap(final T config) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        final List<Method> keyedMethods = new ArrayList<>();
        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }
            for ( final Method propertyMethod : classInterface.getDeclaredMethods() ) {
                if ( propertyMethod.getAnnotation(Config.Key.class) != null && propertyMethod.getParameterCount() == 0 ) {
                    keyedMethods.add(propertyMethod);
                }
            }
        }
        keyedMethods.sort(Comparator.comparing(m -> m.getAnnotation(Config.Key.class).value()));

        for ( final Method propertyMethod : keyedMethods ) {
            try {
                configMap.put(propertyMethod.getAnnotation(Config.Key.class).value(), propertyMethod.invoke(config));
            }
            catch (final IllegalAccessException | InvocationTargetException ex) {
                throw new VarAnnoException("Could not read configuration option " + propertyMethod.getName(), ex);
            }
        }
        return configMap;
    }
}
