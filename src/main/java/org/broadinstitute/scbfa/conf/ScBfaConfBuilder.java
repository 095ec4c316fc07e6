package org.broadinstitute.scbfa.conf;

import org.apache.commons.configuration.AbstractConfiguration;
import org.apache.commons.configuration.BaseConfiguration;
import org.apache.commons.configuration.Configuration;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.broadinstitute.scbfa.exceptions.ScBfaException;
import org.broadinstitute.scbfa.exceptions.UserException;
import org.broadinstitute.scbfa.utils.Utils;

import java.io.File;
import java.net.URL;
import java.util.Iterator;

/**
 * Assembles a {@link ScBfaConf} from the bundled defaults, optional properties files and programmatic overrides.
 * Later calls override earlier ones.
 */
public final class ScBfaConfBuilder {

    public static final String DEFAULT_PROPERTIES_RESOURCE = "org/broadinstitute/scbfa/scbfa.properties";

    private final AbstractConfiguration configuration;

    public ScBfaConfBuilder() {
        this.configuration = new BaseConfiguration();
        this.configuration.setDelimiterParsingDisabled(true);
    }

    public static ScBfaConf getDefaultConfiguration() {
        return new ScBfaConfBuilder().setDefaults().getConfiguration();
    }

    public static ScBfaConf useConfiguration(final Configuration configuration) {
        return new ScBfaConf(configuration);
    }

    /**
     * Loads the defaults shipped in {@value #DEFAULT_PROPERTIES_RESOURCE}.
     */
    public ScBfaConfBuilder setDefaults() {
        final URL resource = ScBfaConfBuilder.class.getClassLoader().getResource(DEFAULT_PROPERTIES_RESOURCE);
        if (resource == null) {
            throw new ScBfaException("Default configuration resource not found on the classpath: " + DEFAULT_PROPERTIES_RESOURCE);
        }
        try {
            return copyFrom(new PropertiesConfiguration(resource));
        } catch (final ConfigurationException e) {
            throw new ScBfaException("Cannot parse the default configuration " + DEFAULT_PROPERTIES_RESOURCE, e);
        }
    }

    /**
     * Overrides the current values with those found in a properties file. Keys must carry the
     * {@value ScBfaConf#SCBFA_PROPERTY_PREFIX} prefix.
     */
    public ScBfaConfBuilder loadFile(final File file) {
        Utils.nonNull(file, "the configuration file cannot be null");
        try {
            return copyFrom(new PropertiesConfiguration(file));
        } catch (final ConfigurationException e) {
            throw new UserException("Couldn't read configuration file " + file.getAbsolutePath(), e);
        }
    }

    public ScBfaConfBuilder setProperty(final String key, final Object value) {
        Utils.nonNull(key, "the property key cannot be null");
        Utils.nonNull(value, "the property value cannot be null");
        configuration.setProperty(ScBfaConf.SCBFA_PROPERTY_PREFIX + key, value);
        return this;
    }

    public ScBfaConf getConfiguration() {
        return new ScBfaConf(configuration);
    }

    private ScBfaConfBuilder copyFrom(final Configuration source) {
        final Iterator<String> keys = source.getKeys();
        while (keys.hasNext()) {
            final String key = keys.next();
            configuration.setProperty(key, source.getProperty(key));
        }
        return this;
    }
}
