/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.vizprep.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Properties;

import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Environment} is used to store common env like 'VIZPREP_HOME' and the preprocessing and visualization
 * settings, returned to user by calling {@link #getProperty(String)} method.
 */
public class Environment {

    public static final String VIZPREP_HOME = "VIZPREP_HOME";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();

    static {
        String homePath = ((System.getenv(VIZPREP_HOME) == null) ? System.getProperty(VIZPREP_HOME) : System
                .getenv(VIZPREP_HOME));
        properties.put(VIZPREP_HOME, ((homePath == null) ? "" : homePath));

        try {
            loadVizPrepConfig();
        } catch (IOException e) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_VIZPREP_CONFIG, e);
        }

        if(properties.size() == 1) {
            logger.debug("No vizprep config is found or there is no content in it, defaults are used.");
        }
    }

    /*
     * Load properties from
     * 1. ${VIZPREP_HOME}/conf/vizprep.config
     * 2. /etc/vizprepconfig
     * 3. ~/.vizprepconfig
     * 4. -Dvizprep.* system properties
     * 
     * Later ones override earlier ones. Provide function to reload.
     */
    public static void loadVizPrepConfig() throws IOException {
        loadProperties(properties, getProperty(VIZPREP_HOME) + File.separator + "conf" + File.separator
                + "vizprep.config");

        loadProperties(properties, File.separator + "etc" + File.separator + "vizprepconfig");

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + ".vizprepconfig");

        for(String name: System.getProperties().stringPropertyNames()) {
            if(name.startsWith("vizprep.")) {
                properties.put(name, System.getProperty(name));
            }
        }
    }

    /*
     * Get global property by property name
     */
    public static String getProperty(String propertyName) {
        return properties.getProperty(propertyName);
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    public static void removeProperty(String propertyName) {
        properties.remove(propertyName);
    }

    /*
     * Get property, if null return default value
     */
    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    /*
     * Get property as Double value, if null return default value
     */
    public static Double getDouble(String propertyName, Double defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Double.valueOf(propertyValue.trim());
    }

    /**
     * Get property as enum constant, name is matched case-insensitively.
     * 
     * @param propertyName
     *            the property name
     * @param enumType
     *            the enum class
     * @param defValue
     *            value used if property is not set
     * @return the enum constant
     * @throws VizPrepException
     *             if property is set to an unknown constant
     */
    public static <E extends Enum<E>> E getEnum(String propertyName, Class<E> enumType, E defValue) {
        String propertyValue = getProperty(propertyName);
        if(StringUtils.isBlank(propertyValue)) {
            return defValue;
        }
        for(E constant: enumType.getEnumConstants()) {
            if(constant.name().equalsIgnoreCase(propertyValue.trim())) {
                return constant;
            }
        }
        throw new VizPrepException(VizPrepErrorCode.ERROR_VIZPREP_CONFIG, "Invalid value '" + propertyValue
                + "' of " + propertyName + ", should be one of " + Arrays.toString(enumType.getEnumConstants()));
    }

    /*
     * Load config into properties
     */
    private static void loadProperties(Properties props, String fileName) throws IOException {
        File configFile = new File(fileName);
        if(!configFile.exists()) {
            return;
        }

        logger.debug("Loading vizprep config from {}", fileName);
        FileInputStream inStream = null;
        try {
            inStream = new FileInputStream(configFile);
            props.load(inStream);
        } finally {
            IOUtils.closeQuietly(inStream);
        }
    }
}
