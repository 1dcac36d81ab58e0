package eu.fbk.quadstore.planner;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Literal;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;

import eu.fbk.quadstore.data.Flavor;
import eu.fbk.quadstore.data.Quadruple;
import eu.fbk.quadstore.data.Terms;

public class PatternTest {

    private static final ValueFactory FACTORY = Terms.getValueFactory();

    private static final URI C = FACTORY.createURI("http://ex.org/c");

    private static final URI S = FACTORY.createURI("http://ex.org/s");

    private static final URI P = FACTORY.createURI("http://ex.org/p");

    private static final URI O = FACTORY.createURI("ex:x");

    private static final Literal L = FACTORY.createLiteral("ex:x");

    @Test
    public void testLabels() {
        Assert.assertEquals("", Pattern.ANY.getLabel());
        Assert.assertEquals("C", Pattern.builder().context(C).build().getLabel());
        Assert.assertEquals("CSPO", Pattern.create(C, S, P, O).getLabel());
        Assert.assertEquals("CSPL", Pattern.create(C, S, P, L).getLabel());
        Assert.assertEquals("SL", Pattern.builder().subject(S).object(L).build().getLabel());
        Assert.assertEquals("PO", Pattern.builder().predicate(P).object(O).build().getLabel());
    }

    @Test
    public void testAny() {
        Assert.assertSame(Pattern.ANY, Pattern.create(null, null, null, null));
        Assert.assertSame(Pattern.ANY, Pattern.builder().build());
        Assert.assertEquals(Shape.ANY, Pattern.ANY.getShape());
        Assert.assertNull(Pattern.ANY.getFlavor());
    }

    @Test
    public void testFlavor() {
        Assert.assertEquals(Flavor.RESOURCE_OBJECT, Pattern.create(null, null, null, O)
                .getFlavor());
        Assert.assertEquals(Flavor.LITERAL_OBJECT, Pattern.create(null, null, null, L)
                .getFlavor());
        Assert.assertEquals(Shape.O, Pattern.create(null, null, null, L).getShape());
        Assert.assertNotEquals(Pattern.create(null, null, null, O),
                Pattern.create(null, null, null, L));
    }

    @Test
    public void testMatches() {
        final Quadruple resource = Quadruple.create(C, S, P, O);
        final Quadruple literal = Quadruple.create(C, S, P, L);
        Assert.assertTrue(Pattern.ANY.matches(resource));
        Assert.assertTrue(Pattern.create(resource).matches(resource));
        Assert.assertFalse(Pattern.create(resource).matches(literal));
        Assert.assertTrue(Pattern.builder().context(C).predicate(P).build().matches(literal));
        Assert.assertFalse(Pattern.builder().subject(P).build().matches(literal));
        Assert.assertTrue(Pattern.builder().object(L).build().matches(literal));
        Assert.assertFalse(Pattern.builder().object(L).build().matches(resource));
    }

}
