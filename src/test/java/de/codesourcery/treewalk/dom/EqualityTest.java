package de.codesourcery.treewalk.dom;

import de.codesourcery.treewalk.TreeFixtures;
import de.codesourcery.treewalk.TreewalkConfig;
import junit.framework.TestCase;

public class EqualityTest extends TestCase {

	private Document doc;

	@Override
	protected void setUp() throws Exception {
		doc = new Document();
	}

	public void testReflexive()
	{
		final INode[] nodes = { doc , doc.createElement("p") , doc.createTextNode("x") , doc.createComment("x") ,
				doc.createCDATASection("x") , doc.createProcessingInstruction("pi","x") , doc.createDocumentType("html","p","s") ,
				doc.createDocumentFragment() , doc.createAttribute("a") };
		for ( final INode n : nodes ) {
			assertTrue( n.toString() , n.isEqualNode( n ) );
			assertFalse( n.toString() , n.isEqualNode( null ) );
		}
	}

	public void testDifferentKindsAreNeverEqual()
	{
		assertFalse( doc.createTextNode("x").isEqualNode( doc.createComment("x") ) );
		assertFalse( doc.createComment("x").isEqualNode( doc.createTextNode("x") ) );
		assertFalse( doc.createTextNode("x").isEqualNode( doc.createCDATASection("x") ) );
		assertFalse( doc.createDocumentFragment().isEqualNode( doc.createElement("p") ) );
	}

	public void testDocumentType()
	{
		final DocumentType html5 = doc.createDocumentType("html",null,null);
		assertEquals( "" , html5.getPublicId() );
		assertEquals( "" , html5.getSystemId() );
		assertEquals( "<!DOCTYPE html>" , html5.toString() );
		assertTrue( html5.isEqualNode( doc.createDocumentType("html","","") ) );
		assertTrue( html5.isEqualNode( new Document().createDocumentType("html",null,null) ) );

		final DocumentType strict = doc.createDocumentType("html","-//W3C//DTD HTML 4.01//EN","http://www.w3.org/TR/html4/strict.dtd");
		assertTrue( strict.isEqualNode( doc.createDocumentType("html","-//W3C//DTD HTML 4.01//EN","http://www.w3.org/TR/html4/strict.dtd") ) );
		assertFalse( strict.isEqualNode( doc.createDocumentType("svg","-//W3C//DTD HTML 4.01//EN","http://www.w3.org/TR/html4/strict.dtd") ) );
		assertFalse( strict.isEqualNode( doc.createDocumentType("html","other","http://www.w3.org/TR/html4/strict.dtd") ) );
		assertFalse( strict.isEqualNode( doc.createDocumentType("html","-//W3C//DTD HTML 4.01//EN","other") ) );
	}

	public void testCharacterData()
	{
		assertTrue( doc.createTextNode("x").isEqualNode( doc.createTextNode("x") ) );
		assertFalse( doc.createTextNode("x").isEqualNode( doc.createTextNode("y") ) );
		assertTrue( doc.createComment("c").isEqualNode( doc.createComment("c") ) );

		final Text text = doc.createTextNode("x");
		final Text other = doc.createTextNode("y");
		other.setData("x");
		assertTrue( text.isEqualNode( other ) );
		other.appendData("!");
		assertFalse( text.isEqualNode( other ) );
	}

	public void testProcessingInstruction()
	{
		assertTrue( doc.createProcessingInstruction("a","data").isEqualNode( doc.createProcessingInstruction("a","data") ) );
		assertFalse( doc.createProcessingInstruction("a","data").isEqualNode( doc.createProcessingInstruction("b","data") ) );
		assertFalse( doc.createProcessingInstruction("a","data").isEqualNode( doc.createProcessingInstruction("a","other") ) );
	}

	public void testAttribute()
	{
		final Attribute a1 = doc.createAttribute("a");
		final Attribute a2 = doc.createAttribute("a");
		assertTrue( a1.isEqualNode( a2 ) );
		a2.setValue("v");
		assertFalse( a1.isEqualNode( a2 ) );
		assertFalse( doc.createAttributeNS("urn:x","p:a").isEqualNode( doc.createAttribute("a") ) );
		// prefix does not matter, namespace and local name do
		assertTrue( doc.createAttributeNS("urn:x","p:a").isEqualNode( doc.createAttributeNS("urn:x","q:a") ) );
	}

	public void testElementsCompareAttributesIgnoringOrder()
	{
		final Element e1 = doc.createElement("p");
		e1.setAttribute("a","1");
		e1.setAttribute("b","2");
		final Element e2 = doc.createElement("p");
		e2.setAttribute("b","2");
		e2.setAttribute("a","1");
		assertTrue( e1.isEqualNode( e2 ) );

		e2.setAttribute("b","3");
		assertFalse( e1.isEqualNode( e2 ) );

		e2.setAttribute("b","2");
		e2.setAttribute("c","3");
		assertFalse( e1.isEqualNode( e2 ) );

		assertFalse( doc.createElement("p").isEqualNode( doc.createElement("div") ) );
		assertFalse( doc.createElement("p").isEqualNode( doc.createElementNS("urn:x","p") ) );
	}

	public void testElementsCompareChildren()
	{
		final TreeFixtures t1 = new TreeFixtures();
		final TreeFixtures t2 = new TreeFixtures();
		assertNotSame( t1.root , t2.root );
		assertTrue( t1.root.isEqualNode( t2.root ) );

		t2.c.appendChild( t2.doc.createTextNode("x") );
		assertFalse( t1.root.isEqualNode( t2.root ) );

		t1.c.appendChild( t1.doc.createTextNode("x") );
		assertTrue( t1.root.isEqualNode( t2.root ) );

		t1.a.removeChild( t1.b );
		assertFalse( t1.root.isEqualNode( t2.root ) );
	}

	public void testFragments()
	{
		final DocumentFragment f1 = doc.createDocumentFragment();
		final DocumentFragment f2 = doc.createDocumentFragment();
		assertTrue( f1.isEqualNode( f2 ) );

		f1.appendChild( doc.createTextNode("x") );
		assertFalse( f1.isEqualNode( f2 ) );

		f2.appendChild( doc.createTextNode("x") );
		assertTrue( f1.isEqualNode( f2 ) );

		f2.appendChild( doc.createComment("y") );
		assertFalse( f1.isEqualNode( f2 ) );
	}

	public void testDocumentsAreNotComparedByDefault()
	{
		final TreewalkConfig config = new TreewalkConfig( true , false );
		final Document d1 = new TreeFixtures( new Document( config ) ).doc;
		final Document d2 = new TreeFixtures( new Document( config ) ).doc;
		assertFalse( d1.isEqualNode( d2 ) );
		assertTrue( d1.isEqualNode( d1 ) );
	}

	public void testDocumentComparisonCanBeEnabled()
	{
		final TreewalkConfig config = new TreewalkConfig( true , true );
		final TreeFixtures t1 = new TreeFixtures( new Document( config ) );
		final TreeFixtures t2 = new TreeFixtures( new Document( config ) );
		assertTrue( t1.doc.isEqualNode( t2.doc ) );

		t2.d.setAttribute("x","y");
		assertFalse( t1.doc.isEqualNode( t2.doc ) );
	}

	public void testSameNode()
	{
		final Element p = doc.createElement("p");
		assertTrue( p.isSameNode( p ) );
		assertFalse( p.isSameNode( doc.createElement("p") ) );
	}
}
