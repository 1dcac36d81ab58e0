package eu.fbk.quadstore.executor;

import java.io.IOException;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.Lists;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;

import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.Quadruple;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.data.Terms;
import eu.fbk.quadstore.planner.Pattern;
import eu.fbk.quadstore.planner.QueryPlanner;

public class MemoryQuadrupleExecutorTest {

    private static final ValueFactory FACTORY = Terms.getValueFactory();

    private static final URI C = FACTORY.createURI("http://ex.org/c");

    private static final URI S = FACTORY.createURI("http://ex.org/s");

    private static final URI P = FACTORY.createURI("http://ex.org/p");

    private static final QuadrupleRow ROW1 = QuadrupleRow.create(Quadruple.create(C, S, P,
            FACTORY.createURI("http://ex.org/o1")));

    private static final QuadrupleRow ROW2 = QuadrupleRow.create(Quadruple.create(C, S, P,
            FACTORY.createLiteral("o2")));

    private QuadrupleExecutor executor;

    @Before
    public void setUp() throws IOException {
        this.executor = new MemoryQuadrupleExecutor();
        this.executor.init();
    }

    @After
    public void tearDown() throws IOException {
        this.executor.close();
    }

    @Test
    public void testCommit() throws IOException {
        final QuadrupleTransaction tx = this.executor.begin(false);
        Assert.assertTrue(tx.insert(ROW1));
        Assert.assertFalse(tx.insert(ROW1));
        Assert.assertTrue(tx.insert(ROW2));
        Assert.assertEquals(2, tx.count());
        tx.end(true);

        final QuadrupleTransaction tx2 = this.executor.begin(true);
        Assert.assertTrue(tx2.contains(ROW1.getID()));
        Assert.assertEquals(ROW2, select(tx2, Pattern.builder().object(
                FACTORY.createLiteral("o2")).build()).get(0));
        tx2.end(true);
    }

    @Test
    public void testRollback() throws IOException {
        final QuadrupleTransaction tx = this.executor.begin(false);
        tx.insert(ROW1);
        tx.end(false);

        final QuadrupleTransaction tx2 = this.executor.begin(true);
        Assert.assertFalse(tx2.contains(ROW1.getID()));
        Assert.assertEquals(0, tx2.count());
        tx2.end(false);
    }

    @Test
    public void testIsolation() throws IOException {
        final QuadrupleTransaction reader = this.executor.begin(true);
        final QuadrupleTransaction writer = this.executor.begin(false);
        writer.insert(ROW1);
        Assert.assertFalse(reader.contains(ROW1.getID()));
        writer.end(true);
        Assert.assertFalse(reader.contains(ROW1.getID()));
        reader.end(true);
    }

    @Test
    public void testDeleteLookupAndClear() throws IOException {
        final QuadrupleTransaction tx = this.executor.begin(false);
        tx.insert(ROW1);
        tx.insert(ROW2);
        Assert.assertEquals(1, tx.delete(QueryPlanner.plan(Pattern.builder().object(
                FACTORY.createURI("http://ex.org/o1")).build())));
        Assert.assertEquals(1, tx.count());
        Assert.assertTrue(tx.delete(ROW2.getID()));
        Assert.assertFalse(tx.delete(ROW2.getID()));
        tx.insert(ROW1);
        Assert.assertEquals(1, tx.clear());
        Assert.assertEquals(0, tx.count());
        tx.end(true);
    }

    @Test(expected = IllegalStateException.class)
    public void testReadOnly() throws IOException {
        final QuadrupleTransaction tx = this.executor.begin(true);
        try {
            tx.insert(ROW1);
        } finally {
            tx.end(false);
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testEnded() throws IOException {
        final QuadrupleTransaction tx = this.executor.begin(true);
        tx.end(true);
        tx.count();
    }

    @Test
    public void testConcurrentModification() throws IOException {
        final QuadrupleTransaction tx1 = this.executor.begin(false);
        final QuadrupleTransaction tx2 = this.executor.begin(false);
        tx1.insert(ROW1);
        tx2.insert(ROW2);
        tx1.end(true);
        try {
            tx2.end(true);
            Assert.fail();
        } catch (final IOException ex) {
            // expected
        }
        final QuadrupleTransaction tx3 = this.executor.begin(true);
        Assert.assertTrue(tx3.contains(ROW1.getID()));
        Assert.assertFalse(tx3.contains(ROW2.getID()));
        tx3.end(true);
    }

    @Test
    public void testLogging() throws IOException {
        final QuadrupleExecutor logging = new LoggingQuadrupleExecutor(this.executor);
        final QuadrupleTransaction tx = logging.begin(false);
        Assert.assertTrue(tx.insert(ROW1));
        Assert.assertEquals(1, select(tx, Pattern.ANY).size());
        tx.end(true);
        Assert.assertTrue(logging.toString().contains("MemoryQuadrupleExecutor"));
    }

    static List<QuadrupleRow> select(final QuadrupleTransaction transaction,
            final Pattern pattern) throws IOException {
        final List<QuadrupleRow> rows = Lists.newArrayList();
        final boolean[] ended = new boolean[1];
        transaction.select(QueryPlanner.plan(pattern), new Handler<QuadrupleRow>() {

            @Override
            public void handle(@Nullable final QuadrupleRow row) {
                if (row != null) {
                    Assert.assertFalse(ended[0]);
                    rows.add(row);
                } else {
                    ended[0] = true;
                }
            }

        });
        Assert.assertTrue(ended[0]);
        return rows;
    }

}
