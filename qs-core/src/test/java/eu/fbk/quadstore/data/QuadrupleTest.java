package eu.fbk.quadstore.data;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.SESAME;

public class QuadrupleTest {

    private static final ValueFactory FACTORY = Terms.getValueFactory();

    private static final URI C = FACTORY.createURI("http://ex.org/c");

    private static final URI S = FACTORY.createURI("http://ex.org/s");

    private static final URI P = FACTORY.createURI("http://ex.org/p");

    private static final URI O = FACTORY.createURI("http://ex.org/o");

    @Test
    public void testID() {
        final Quadruple quadruple = Quadruple.create(C, S, P, O);
        Assert.assertEquals(-6680701106203664038L, quadruple.getID());
        Assert.assertEquals(quadruple.getID(), Quadruple.create(C, S, P, O).getID());
        Assert.assertEquals(QuadrupleIdentity.hash("http://ex.org/c http://ex.org/s "
                + "http://ex.org/p http://ex.org/o"), quadruple.getID());
        Assert.assertNotEquals(quadruple.getID(), Quadruple.create(S, C, P, O).getID());
    }

    @Test
    public void testKey() {
        Assert.assertEquals(-3512318148977156507L,
                QuadrupleIdentity.computeKey(FACTORY.createURI("ex:x")));
        Assert.assertEquals(QuadrupleIdentity.hash("\"ex:x\""),
                QuadrupleIdentity.computeKey(FACTORY.createLiteral("ex:x")));
        Assert.assertNotEquals(QuadrupleIdentity.computeKey(FACTORY.createURI("ex:x")),
                QuadrupleIdentity.computeKey(FACTORY.createLiteral("ex:x")));
    }

    @Test
    public void testFlavor() {
        final Literal literal = FACTORY.createLiteral("ex:x");
        final URI uri = FACTORY.createURI("ex:x");
        final Quadruple q1 = Quadruple.create(C, S, P, uri);
        final Quadruple q2 = Quadruple.create(C, S, P, literal);
        Assert.assertEquals(Flavor.RESOURCE_OBJECT, q1.getFlavor());
        Assert.assertEquals(Flavor.LITERAL_OBJECT, q2.getFlavor());
        Assert.assertEquals(Flavor.RESOURCE_OBJECT,
                Quadruple.create(C, S, P, FACTORY.createBNode("b")).getFlavor());
        Assert.assertNotEquals(q1, q2);
        Assert.assertNotEquals(q1.getID(), q2.getID());
    }

    @Test
    public void testEquality() {
        final Quadruple q1 = Quadruple.create(C, S, P, FACTORY.createLiteral("x", "en"));
        final Quadruple q2 = Quadruple.create(C, S, P, FACTORY.createLiteral("x", "en"));
        final Quadruple q3 = Quadruple.create(C, S, P, FACTORY.createLiteral("x"));
        Assert.assertEquals(q1, q2);
        Assert.assertEquals(q1.hashCode(), q2.hashCode());
        Assert.assertNotEquals(q1, q3);
        Assert.assertNotEquals(q1.getID(), q3.getID());
    }

    @Test(expected = NullPointerException.class)
    public void testNullTerm() {
        Quadruple.create(C, null, P, O);
    }

    @Test
    public void testFromStatement() {
        final Statement triple = FACTORY.createStatement(S, P, O);
        Assert.assertEquals(SESAME.NIL, Quadruple.create(triple, null).getContext());
        Assert.assertEquals(C, Quadruple.create(triple, C).getContext());
        final Statement quad = FACTORY.createStatement(S, P, O, O);
        Assert.assertEquals(O, Quadruple.create(quad, C).getContext());
        Assert.assertEquals(quad, Quadruple.create(quad, null).toStatement());
    }

    @Test
    public void testRow() {
        final Quadruple quadruple = Quadruple.create(FACTORY.createBNode("g"), S, P,
                FACTORY.createLiteral("1", FACTORY.createURI("http://ex.org/type")));
        final QuadrupleRow row = QuadrupleRow.create(quadruple);
        Assert.assertEquals(quadruple.getID(), row.getID());
        Assert.assertEquals("_:g", row.getContext());
        Assert.assertEquals("\"1\"^^<http://ex.org/type>", row.getObject());
        Assert.assertEquals(QuadrupleIdentity.computeKey(S), row.getSubjectKey());
        Assert.assertEquals(quadruple, row.toQuadruple());
    }

}
