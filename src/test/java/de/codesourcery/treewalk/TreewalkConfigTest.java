package de.codesourcery.treewalk;

import java.util.Properties;

import de.codesourcery.treewalk.dom.Document;
import junit.framework.TestCase;

public class TreewalkConfigTest extends TestCase {

	public void testMissingResourceYieldsDefaults()
	{
		final TreewalkConfig config = TreewalkConfig.load("/does-not-exist.properties");
		assertTrue( config.isCursorCache() );
		assertFalse( config.isCompareDocuments() );
	}

	public void testDefaultConfig()
	{
		final TreewalkConfig config = TreewalkConfig.getDefault();
		assertSame( config , TreewalkConfig.getDefault() );
		assertTrue( config.isCursorCache() );
		assertFalse( config.isCompareDocuments() );
		assertSame( config , new Document().getConfig() );
	}

	public void testLoadFromResource()
	{
		final TreewalkConfig config = TreewalkConfig.load("/treewalk-custom.properties");
		assertFalse( config.isCursorCache() );
		assertTrue( config.isCompareDocuments() );
	}

	public void testInvalidValue()
	{
		try {
			TreewalkConfig.load("/treewalk-broken.properties");
			fail("Should have failed");
		} catch(IllegalArgumentException e) {
			assertTrue( e.getMessage() , e.getMessage().contains( TreewalkConfig.KEY_CURSOR_CACHE ) );
		}
	}

	public void testSystemPropertyOverridesResource()
	{
		System.setProperty( TreewalkConfig.KEY_CURSOR_CACHE , "true" );
		try {
			final TreewalkConfig config = TreewalkConfig.load("/treewalk-custom.properties");
			assertTrue( config.isCursorCache() );
			assertTrue( config.isCompareDocuments() );
		} finally {
			System.clearProperty( TreewalkConfig.KEY_CURSOR_CACHE );
		}
	}

	public void testFromProperties()
	{
		final Properties props = new Properties();
		props.setProperty( TreewalkConfig.KEY_COMPARE_DOCUMENTS , " on " );
		props.setProperty( TreewalkConfig.KEY_CURSOR_CACHE , "" );
		final TreewalkConfig config = TreewalkConfig.fromProperties( props );
		assertTrue( config.isCursorCache() );
		assertTrue( config.isCompareDocuments() );
	}

	public void testWithers()
	{
		final TreewalkConfig config = new TreewalkConfig( true , false );
		assertFalse( config.withCursorCache( false ).isCursorCache() );
		assertFalse( config.withCursorCache( false ).isCompareDocuments() );
		assertTrue( config.withCompareDocuments( true ).isCompareDocuments() );
		assertTrue( config.withCompareDocuments( true ).isCursorCache() );
		assertTrue( config.isCursorCache() );
		assertFalse( config.isCompareDocuments() );
	}
}
