package de.codesourcery.treewalk;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.commons.lang.BooleanUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library settings.
 *
 * <p>Defaults are read from <code>/treewalk.properties</code> on the classpath
 * (if present). System properties with the same keys take precedence.</p>
 */
public final class TreewalkConfig
{
	private static final Logger LOG = LoggerFactory.getLogger(TreewalkConfig.class);

	public static final String DEFAULT_RESOURCE = "/treewalk.properties";

	public static final String KEY_CURSOR_CACHE = "treewalk.collection.cursorCache";
	public static final String KEY_COMPARE_DOCUMENTS = "treewalk.equality.compareDocuments";

	private static volatile TreewalkConfig defaultConfig;

	private final boolean cursorCache;
	private final boolean compareDocuments;

	public TreewalkConfig(boolean cursorCache,boolean compareDocuments)
	{
		this.cursorCache = cursorCache;
		this.compareDocuments = compareDocuments;
	}

	public static TreewalkConfig getDefault()
	{
		if ( defaultConfig == null ) {
			defaultConfig = load( DEFAULT_RESOURCE );
		}
		return defaultConfig;
	}

	/**
	 * Loads settings from a classpath resource, applying system property overrides.
	 *
	 * @param resource classpath resource, a missing resource yields the built-in defaults
	 * @return
	 */
	public static TreewalkConfig load(String resource)
	{
		final Properties props = new Properties();
		try ( InputStream in = TreewalkConfig.class.getResourceAsStream( resource ) )
		{
			if ( in != null ) {
				props.load( in );
				LOG.debug("Loaded configuration from {}", resource );
			} else {
				LOG.debug("No configuration found at {}, using defaults", resource );
			}
		}
		catch(IOException e) {
			throw new RuntimeException("Failed to load configuration from "+resource,e);
		}
		return fromProperties( props );
	}

	public static TreewalkConfig fromProperties(Properties props)
	{
		final boolean cursorCache = getBoolean( props , KEY_CURSOR_CACHE , true );
		final boolean compareDocuments = getBoolean( props , KEY_COMPARE_DOCUMENTS , false );
		return new TreewalkConfig( cursorCache , compareDocuments );
	}

	private static boolean getBoolean(Properties props,String key,boolean defaultValue)
	{
		String value = System.getProperty( key );
		if ( StringUtils.isBlank( value ) ) {
			value = props.getProperty( key );
		}
		if ( StringUtils.isBlank( value ) ) {
			return defaultValue;
		}
		final Boolean result = BooleanUtils.toBooleanObject( value.trim() );
		if ( result == null ) {
			throw new IllegalArgumentException("Configuration property "+key+" needs to be a boolean but was '"+value+"'");
		}
		return result.booleanValue();
	}

	public boolean isCursorCache() {
		return cursorCache;
	}

	public boolean isCompareDocuments() {
		return compareDocuments;
	}

	public TreewalkConfig withCursorCache(boolean yesNo) {
		return new TreewalkConfig( yesNo , compareDocuments );
	}

	public TreewalkConfig withCompareDocuments(boolean yesNo) {
		return new TreewalkConfig( cursorCache , yesNo );
	}

	@Override
	public String toString() {
		return KEY_CURSOR_CACHE+"="+cursorCache+", "+KEY_COMPARE_DOCUMENTS+"="+compareDocuments;
	}
}
