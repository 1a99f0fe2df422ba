package wikidb;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import wikidb.exception.SessionClosedException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionTest {
    private static final String FIND_PAGE = "SELECT * FROM pages WHERE id = ?";

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    private Session session;

    private Logger sessionLogger;

    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() throws SQLException {
        session = new Session(connection, false, false);

        sessionLogger = (Logger) LoggerFactory.getLogger(Session.class);
        sessionLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        sessionLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        sessionLogger.detachAppender(logAppender);
        sessionLogger.setLevel(null);
    }

    private void stubPageRow(long id, String title, String content) throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getObject("id", Long.class)).thenReturn(id);
        when(resultSet.getObject("title", String.class)).thenReturn(title);
        when(resultSet.getObject("body", String.class)).thenReturn(content);
    }

    @Test
    void turnsOffAutoCommit() throws SQLException {
        verify(connection).setAutoCommit(false);
    }

    @Test
    void findByIdIsServedFromIdentityMap() throws SQLException {
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false);

        Page first = session.find(Page.class, 1L);
        Page second = session.find(Page.class, 1L);

        assertSame(first, second);
        assertEquals("Main", first.getTitle());
        assertEquals("Welcome", first.getContent());
        verify(connection, times(1)).prepareStatement(FIND_PAGE);
        verify(statement).setObject(1, 1L);
    }

    @Test
    void findByIdSharesInstanceLoadedByFindAll() throws SQLException {
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false);

        Page loaded = session.find(Page.class).get(0);

        assertSame(loaded, session.find(Page.class, 1));
        assertSame(loaded, session.find(Page.class, 1L));
        verify(connection, never()).prepareStatement(FIND_PAGE);
    }

    @Test
    void findByIdNormalizesKeyType() throws SQLException {
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false);

        Page page = session.find(Page.class, 1);
        page.setTitle("Home");
        session.flush();

        assertSame(page, session.find(Page.class, 1L));
        verify(statement).setObject(1, 1L);
        verify(connection, times(1)).prepareStatement(FIND_PAGE);
        verify(statement, times(1)).executeUpdate();
    }

    @Test
    void findByIdRejectsUnrelatedKeyType() {
        assertThrows(IllegalArgumentException.class, () -> session.find(Page.class, "main"));
    }

    @Test
    void echoLogsStatementsAtInfo() throws SQLException {
        Session echoing = new Session(connection, true, false);
        when(connection.prepareStatement(anyString())).thenReturn(statement);

        Page page = new Page();
        page.setTitle("Echoed");
        echoing.persist(page);
        echoing.flush();

        assertEquals(1, logAppender.list.size());
        ILoggingEvent event = logAppender.list.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("INSERT INTO pages (title) VALUES (?)"));
        assertTrue(event.getFormattedMessage().contains("Echoed"));
    }

    @Test
    void statementsLogAtDebugWithoutEcho() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);

        Page page = new Page();
        page.setId(3L);
        session.remove(page);
        session.flush();

        assertEquals(1, logAppender.list.size());
        assertEquals(Level.DEBUG, logAppender.list.get(0).getLevel());
        assertTrue(logAppender.list.get(0).getFormattedMessage().contains("DELETE FROM pages WHERE id = ?"));
    }

    @Test
    void findByIdReturnsNullForMissingRow() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        assertNull(session.find(Page.class, 42L));
    }

    @Test
    void findAllKeepsCachedInstances() throws SQLException {
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false, true, false);

        Page cached = session.find(Page.class, 1L);
        List<Page> pages = session.find(Page.class);

        assertEquals(1, pages.size());
        assertSame(cached, pages.get(0));
        verify(connection).prepareStatement("SELECT * FROM pages");
    }

    @Test
    void flushUpdatesModifiedEntities() throws SQLException {
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false);

        Page page = session.find(Page.class, 1L);
        page.setTitle("Home");
        session.flush();

        verify(connection).prepareStatement("UPDATE pages SET body = ?, title = ? WHERE id = ?");
        verify(statement).setObject(1, "Welcome");
        verify(statement).setObject(2, "Home");
        verify(statement).setObject(1, 1L);
        verify(statement).setObject(3, 1L);
        verify(statement).executeUpdate();

        session.flush();

        verify(statement, times(1)).executeUpdate();
    }

    @Test
    void flushRunsInsertsBeforeDeletes() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);

        Page stale = new Page();
        stale.setId(5L);
        Page fresh = new Page();
        fresh.setTitle("New page");

        session.remove(stale);
        session.persist(fresh);
        session.flush();

        InOrder inOrder = inOrder(connection);
        inOrder.verify(connection).prepareStatement("INSERT INTO pages (title) VALUES (?)");
        inOrder.verify(connection).prepareStatement("DELETE FROM pages WHERE id = ?");
        verify(statement, times(2)).executeUpdate();
    }

    @Test
    void persistIncludesAssignedId() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);

        Page page = new Page();
        page.setId(9L);
        page.setTitle("Assigned");
        page.setContent("Text");

        session.persist(page);
        session.commit();

        verify(connection).prepareStatement("INSERT INTO pages (id, body, title) VALUES (?, ?, ?)");
        verify(connection).commit();
    }

    @Test
    void loadedEntitiesSurviveCommit() throws SQLException {
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false);

        Page page = session.find(Page.class, 1L);
        session.commit();

        assertSame(page, session.find(Page.class, 1L));
        verify(connection, times(1)).prepareStatement(FIND_PAGE);
    }

    @Test
    void expireOnCommitEmptiesIdentityMap() throws SQLException {
        Session expiring = new Session(connection, false, true);
        stubPageRow(1L, "Main", "Welcome");
        when(resultSet.next()).thenReturn(true, false, true, false);

        Page page = expiring.find(Page.class, 1L);
        expiring.commit();

        assertNotSame(page, expiring.find(Page.class, 1L));
        verify(connection, times(2)).prepareStatement(FIND_PAGE);
    }

    @Test
    void rollbackDropsQueuedActions() throws SQLException {
        Page page = new Page();
        page.setTitle("Discarded");

        session.persist(page);
        session.rollback();
        session.flush();

        verify(connection).rollback();
        verify(connection, never()).prepareStatement(anyString());
    }

    @Test
    void closeRollsBackAndReleasesConnectionOnce() throws SQLException {
        session.close();
        session.close();

        assertFalse(session.isOpen());
        verify(connection, times(1)).rollback();
        verify(connection, times(1)).close();
        verify(connection, never()).commit();
    }

    @Test
    void closedSessionRejectsWork() throws SQLException {
        session.close();

        assertThrows(SessionClosedException.class, () -> session.persist(new Page()));
        assertThrows(SessionClosedException.class, () -> session.find(Page.class));
        assertThrows(SessionClosedException.class, session::commit);
    }

    @Test
    void releasesConnectionWhenAutoCommitCannotBeChanged() throws SQLException {
        Connection broken = mock(Connection.class);
        doThrow(new SQLException("read-only")).when(broken).setAutoCommit(false);

        assertThrows(SQLException.class, () -> new Session(broken, false, false));
        verify(broken).close();
    }
}
