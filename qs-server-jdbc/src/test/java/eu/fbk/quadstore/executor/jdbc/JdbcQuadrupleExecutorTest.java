package eu.fbk.quadstore.executor.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;

import eu.fbk.quadstore.ExecutorFailureException;
import eu.fbk.quadstore.QuadrupleStore;
import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.Quadruple;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.data.Terms;
import eu.fbk.quadstore.executor.QuadrupleTransaction;
import eu.fbk.quadstore.planner.Pattern;
import eu.fbk.quadstore.planner.QueryPlanner;
import eu.fbk.quadstore.runtime.DataCorruptedException;

public class JdbcQuadrupleExecutorTest {

    private static final ValueFactory FACTORY = Terms.getValueFactory();

    private static final URI C = FACTORY.createURI("http://ex.org/c");

    private static final URI S = FACTORY.createURI("http://ex.org/s");

    private static final URI P = FACTORY.createURI("http://ex.org/p");

    private static final QuadrupleRow ROW1 = QuadrupleRow.create(Quadruple.create(C, S, P,
            FACTORY.createURI("ex:x")));

    private static final QuadrupleRow ROW2 = QuadrupleRow.create(Quadruple.create(C, S, P,
            FACTORY.createLiteral("ex:x")));

    private String url;

    private JdbcQuadrupleExecutor executor;

    @Before
    public void setUp() throws IOException {
        this.url = H2Databases.create();
        this.executor = new JdbcQuadrupleExecutor(this.url, "sa", "", null, 2, 10, 5);
        this.executor.init();
    }

    @After
    public void tearDown() {
        this.executor.close();
    }

    @Test
    public void testProperties() {
        final Properties properties = new Properties();
        properties.setProperty("quadstore.jdbc.url", "jdbc:h2:mem:unused");
        properties.setProperty("quadstore.jdbc.fetchSize", " 50 ");
        final JdbcQuadrupleExecutor executor = JdbcQuadrupleExecutor.fromProperties(properties);
        Assert.assertEquals("quadruples", executor.getTable());
        Assert.assertEquals(50, executor.getFetchSize());
        Assert.assertEquals(120, executor.getQueryTimeout());
        executor.close();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingURL() {
        JdbcQuadrupleExecutor.fromProperties(new Properties());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTable() {
        new JdbcQuadrupleExecutor(this.url, null, null, "quadruples; DROP TABLE x", null, null,
                null);
    }

    @Test(expected = IllegalStateException.class)
    public void testNotInitialized() throws IOException {
        new JdbcQuadrupleExecutor(this.url, "sa", "", null, null, null, null).begin(true);
    }

    @Test
    public void testCommitAndRollback() throws IOException {
        final QuadrupleTransaction tx1 = this.executor.begin(false);
        Assert.assertTrue(tx1.insert(ROW1));
        Assert.assertFalse(tx1.insert(ROW1));
        tx1.end(true);

        final QuadrupleTransaction tx2 = this.executor.begin(false);
        Assert.assertTrue(tx2.insert(ROW2));
        Assert.assertEquals(2L, tx2.count());
        tx2.end(false);

        final QuadrupleTransaction tx3 = this.executor.begin(true);
        Assert.assertTrue(tx3.contains(ROW1.getID()));
        Assert.assertFalse(tx3.contains(ROW2.getID()));
        Assert.assertEquals(1L, tx3.count());
        tx3.end(true);
    }

    @Test
    public void testDeleteByLookup() throws IOException {
        final QuadrupleTransaction tx = this.executor.begin(false);
        tx.insert(ROW1);
        tx.insert(ROW2);
        Assert.assertEquals(1L, tx.delete(QueryPlanner.plan(Pattern.builder().subject(S)
                .object(FACTORY.createLiteral("ex:x")).build())));
        Assert.assertTrue(tx.contains(ROW1.getID()));
        Assert.assertFalse(tx.contains(ROW2.getID()));
        Assert.assertEquals(1L, tx.clear());
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

    @Test
    public void testMissingTable() throws IOException {
        final JdbcQuadrupleExecutor executor = new JdbcQuadrupleExecutor(this.url, "sa", "",
                "missing", 1, null, null);
        executor.init();
        try {
            new QuadrupleStore(executor).size();
            Assert.fail();
        } catch (final ExecutorFailureException ex) {
            Assert.assertTrue(ex.getCause() instanceof IOException);
        } finally {
            executor.close();
        }
    }

    @Test
    public void testUnknownFlavorInTable() throws IOException, SQLException {
        try (Connection connection = DriverManager.getConnection(this.url, "sa", "");
                Statement statement = connection.createStatement()) {
            statement.executeUpdate("INSERT INTO quadruples VALUES (7, 9, 'ex:c', 1, 'ex:s', 2, "
                    + "'ex:p', 3, 'ex:o', 4)");
        }
        final QuadrupleTransaction tx = this.executor.begin(true);
        try {
            tx.select(QueryPlanner.plan(Pattern.ANY), new Handler<QuadrupleRow>() {

                @Override
                public void handle(final QuadrupleRow row) {
                }

            });
            Assert.fail();
        } catch (final DataCorruptedException ex) {
            Assert.assertTrue(ex.getMessage().contains("row 7"));
            Assert.assertTrue(ex.getCause() instanceof IllegalArgumentException);
        } finally {
            tx.end(false);
        }
    }

}
