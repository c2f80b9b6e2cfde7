import io.github.flameyossnowy.tabula.sql.SimpleTransactionContext;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SimpleTransactionContextTest {

    @Test
    void disables_auto_commit_and_delegates() throws SQLException {
        Connection connection = mock(Connection.class);

        try (SimpleTransactionContext transaction = new SimpleTransactionContext(connection)) {
            assertSame(connection, transaction.connection());
            transaction.commit();
        }

        InOrder order = inOrder(connection);
        order.verify(connection).setAutoCommit(false);
        order.verify(connection).commit();
        order.verify(connection).close();
        verify(connection, never()).rollback();
    }

    @Test
    void rollback_reaches_the_connection() throws SQLException {
        Connection connection = mock(Connection.class);

        SimpleTransactionContext transaction = new SimpleTransactionContext(connection);
        transaction.rollback();
        transaction.close();

        verify(connection).rollback();
        verify(connection).close();
        verify(connection, never()).commit();
    }
}
