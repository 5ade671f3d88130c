package edu.tum.cs.grid;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Default settings of the grid classes. Values are read from the file named by the system property
 * {@value #CONFIG_FILE_PROPERTY} or, if that is not set, from the classpath resource {@code /grid.properties}.
 * Local keys are prefixed with the simple name of the class passed to the constructor.
 */
public class GridConfiguration extends Properties {

	private static final long serialVersionUID = -2915620741326583349L;
	private static final Logger logger = Logger.getLogger(GridConfiguration.class.getName());

	public static final String CONFIG_FILE_PROPERTY = "edu.tum.cs.grid.config";
	private static final String defaultResource = "/grid.properties";

	// well-known local properties
	public static final String PROP_INITIAL_CAPACITY = "initialCapacity";
	public static final String PROP_EMPTY_ROW_POLICY = "emptyRowPolicy";
	public static final String PROP_COLUMN_SEPARATOR = "columnSeparator";

	private final String root;

	public GridConfiguration(Class<?> cls) {
		try {
			String configFileName = System.getProperty(CONFIG_FILE_PROPERTY);
			if (configFileName != null) {
				Reader reader = new FileReader(configFileName);
				try {
					load(reader);
				} finally {
					reader.close();
				}
				logger.config("loaded grid configuration from " + configFileName);
			} else {
				InputStream in = GridConfiguration.class.getResourceAsStream(defaultResource);
				if (in != null) {
					try {
						load(in);
					} finally {
						in.close();
					}
					logger.config("loaded grid configuration from classpath resource " + defaultResource);
				}
			}
		} catch (IOException ex) {
			throw new RuntimeException("error reading configuration", ex);
		}
		root = cls.getSimpleName();
	}

	private String makeGlobal(String key) {
		return root + "." + key;
	}

	@Override
	public String getProperty(String key, String defaultValue) {
		String value = super.getProperty(key);
		if (value == null) {
			value = defaultValue;
			if (value == null)
				throw new RuntimeException("required property '" + key + "' not specified");
		}
		return value;
	}

	public String getLocalProperty(String key, String defaultValue) {
		return getProperty(makeGlobal(key), defaultValue);
	}

	@Override
	public String getProperty(String key) {
		return getProperty(key, null);
	}

	public String getLocalProperty(String key) {
		return getLocalProperty(key, null);
	}

	public int getIntProperty(String key, Integer defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Integer.parseInt(rawValue.trim());
		} catch (NumberFormatException ex) {
			throw new RuntimeException("invalid integer '" + rawValue + "' for key '" + key + "'", ex);
		}
	}

	public int getLocalIntProperty(String key, Integer defaultValue) {
		return getIntProperty(makeGlobal(key), defaultValue);
	}

	public int getIntProperty(String key) {
		return getIntProperty(key, null);
	}

	public int getLocalIntProperty(String key) {
		return getLocalIntProperty(key, null);
	}

	public <E extends Enum<E>> E getEnumProperty(String key, Class<E> type, E defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.name() : null);
		try {
			return Enum.valueOf(type, rawValue.trim());
		} catch (IllegalArgumentException ex) {
			throw new RuntimeException("invalid value '" + rawValue + "' for key '" + key + "'", ex);
		}
	}

	public <E extends Enum<E>> E getLocalEnumProperty(String key, Class<E> type, E defaultValue) {
		return getEnumProperty(makeGlobal(key), type, defaultValue);
	}

}
