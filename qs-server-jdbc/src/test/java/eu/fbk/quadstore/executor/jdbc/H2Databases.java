package eu.fbk.quadstore.executor.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Charsets;
import com.google.common.base.Splitter;
import com.google.common.io.ByteStreams;

/**
 * Creates in-memory H2 databases holding an empty quadruple table, one per call.
 */
final class H2Databases {

    private static final AtomicInteger COUNTER = new AtomicInteger(0);

    private H2Databases() {
    }

    static String create() throws IOException {
        final String url = "jdbc:h2:mem:quadstore" + COUNTER.incrementAndGet()
                + ";DB_CLOSE_DELAY=-1";
        final String ddl;
        try (InputStream in = H2Databases.class.getResourceAsStream("/quadstore-schema.sql")) {
            ddl = new String(ByteStreams.toByteArray(in), Charsets.UTF_8);
        }
        try (Connection connection = DriverManager.getConnection(url, "sa", "");
                Statement statement = connection.createStatement()) {
            for (final String sql : Splitter.on(';').trimResults().omitEmptyStrings()
                    .split(ddl)) {
                statement.execute(sql);
            }
        } catch (final SQLException ex) {
            throw new IOException("Could not create schema in " + url, ex);
        }
        return url;
    }

}
