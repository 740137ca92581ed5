package com.switchyard.sessions;

import com.switchyard.TestFixtures;
import com.switchyard.TestFixtures.MutableClock;
import com.switchyard.agents.TerminalBackend;
import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.errors.InvalidSessionStateException;
import com.switchyard.core.errors.SessionAlreadyExistsException;
import com.switchyard.core.errors.SessionNotFoundException;
import com.switchyard.core.errors.WorktreeAlreadyExistsException;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.CancellationResult;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.model.SessionStatus;
import com.switchyard.core.model.Spec;
import com.switchyard.core.persistence.DatabaseConfig;
import com.switchyard.core.persistence.JdbcGitStatsStore;
import com.switchyard.core.persistence.JdbcSessionStore;
import com.switchyard.core.persistence.JdbcSpecStore;
import com.switchyard.git.BranchOperations;
import com.switchyard.git.GitStatsCalculator;
import com.switchyard.git.WorktreeOperations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Session lifecycle over real SQLite stores. Git operations are mocked so the tests
 * only exercise bookkeeping and ordering.
 */
class SessionServiceTest {

    @TempDir
    Path tempDir;

    private Path repo;
    private JdbcSessionStore sessionStore;
    private JdbcSpecStore specStore;
    private WorktreeOperations worktrees;
    private BranchOperations branches;
    private TerminalBackend terminals;
    private EventBus eventBus;
    private SessionService service;

    @BeforeEach
    void setUp() throws Exception {
        repo = tempDir.resolve("repo");
        SwitchyardProperties properties = TestFixtures.properties(repo, tempDir.resolve("db.sqlite"));
        DataSource dataSource = DatabaseConfig.sqliteDataSource(tempDir.resolve("db.sqlite"));
        sessionStore = new JdbcSessionStore(dataSource);
        specStore = new JdbcSpecStore(dataSource);
        JdbcGitStatsStore statsStore = new JdbcGitStatsStore(dataSource);
        sessionStore.createTables();
        specStore.createTables();
        statsStore.createTables();

        worktrees = mock(WorktreeOperations.class);
        branches = mock(BranchOperations.class);
        terminals = mock(TerminalBackend.class);
        eventBus = new EventBus();
        MutableClock clock = new MutableClock(TestFixtures.T0);
        SwitchyardMetrics metrics = new SwitchyardMetrics(new SimpleMeterRegistry());

        GitStatsCache statsCache = new GitStatsCache(statsStore, mock(GitStatsCalculator.class), clock,
                properties, metrics, eventBus);
        SessionFinalizer finalizer = new SessionFinalizer(sessionStore, statsCache, clock);
        CancellationCoordinator cancellation = new CancellationCoordinator(terminals, worktrees, branches,
                sessionStore, clock);
        service = new SessionService(properties, sessionStore, specStore, statsStore, branches, worktrees,
                new NameReservationRegistry(), finalizer, statsCache, cancellation, eventBus, metrics, clock);
    }

    @Nested
    @DisplayName("createSession")
    class Create {

        @Test
        @DisplayName("creates the worktree from the parent and persists a running session")
        void createsRunningSession() {
            Session session = service.createSession(CreateSessionRequest.of("alpha", "develop", "do it"));

            assertEquals(SessionState.RUNNING, session.sessionState());
            assertEquals(SessionStatus.ACTIVE, session.status());
            assertEquals("switchyard/alpha", session.branch());
            assertEquals("develop", session.parentBranch());
            assertEquals("develop", session.originalParentBranch());
            assertEquals(TestFixtures.T0, session.lastActivity());
            verify(worktrees).createWorktreeFromBase(repo.toAbsolutePath().normalize(), "switchyard/alpha",
                    session.worktreePath(), "develop");
            assertEquals(session.id(), service.getSession("alpha").id());
        }

        @Test
        @DisplayName("falls back to the default parent branch")
        void defaultParent() {
            Session session = service.createSession(CreateSessionRequest.of("alpha", "  ", null));
            assertEquals("main", session.parentBranch());
        }

        @Test
        @DisplayName("publishes a session added event")
        void publishesEvent() {
            List<SwitchyardEvent> events = new ArrayList<>();
            eventBus.subscribeAll(events::add);

            service.createSession(CreateSessionRequest.of("alpha", null, null));

            assertEquals(1, events.size());
            assertEquals(SwitchyardEvent.Type.SESSION_ADDED, events.get(0).type());
            assertEquals(TestFixtures.T0, events.get(0).timestamp());
        }

        @Test
        @DisplayName("rejects invalid names before touching git")
        void rejectsInvalidName() {
            assertThrows(InvalidInputException.class,
                    () -> service.createSession(CreateSessionRequest.of("bad name", null, null)));
            verifyNoInteractions(worktrees);
        }

        @Test
        @DisplayName("rejects a name already used by a live session or a spec")
        void rejectsDuplicates() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));
            service.createSpec("beta", "draft");

            assertThrows(SessionAlreadyExistsException.class,
                    () -> service.createSession(CreateSessionRequest.of("alpha", null, null)));
            assertThrows(SessionAlreadyExistsException.class,
                    () -> service.createSession(CreateSessionRequest.of("beta", null, null)));
        }

        @Test
        @DisplayName("a cancelled session's name can be reused")
        void reusesCancelledName() {
            Session first = service.createSession(CreateSessionRequest.of("alpha", null, null));
            service.cancelSession("alpha", false);

            Session second = service.createSession(CreateSessionRequest.of("alpha", null, null));

            assertNotEquals(first.id(), second.id());
            assertTrue(sessionStore.findById(first.id()).isEmpty());
        }

        @Test
        @DisplayName("a failed worktree creation persists nothing")
        void worktreeFailureLeavesNoRow() {
            doThrow(new WorktreeAlreadyExistsException(repo.resolve("x")))
                    .when(worktrees).createWorktreeFromBase(any(), anyString(), any(), anyString());

            assertThrows(WorktreeAlreadyExistsException.class,
                    () -> service.createSession(CreateSessionRequest.of("alpha", null, null)));
            assertTrue(service.findSession("alpha").isEmpty());
        }

        @Test
        @DisplayName("concurrent creates of one name produce exactly one session")
        void concurrentCreates() throws Exception {
            doAnswer(inv -> {
                Thread.sleep(200);
                return null;
            }).when(worktrees).createWorktreeFromBase(any(), anyString(), any(), anyString());

            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            Callable<Session> create = () -> {
                start.await();
                return service.createSession(CreateSessionRequest.of("alpha", null, null));
            };
            try {
                Future<Session> a = pool.submit(create);
                Future<Session> b = pool.submit(create);
                start.countDown();

                int created = 0;
                int rejected = 0;
                for (Future<Session> f : List.of(a, b)) {
                    try {
                        f.get(10, TimeUnit.SECONDS);
                        created++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(SessionAlreadyExistsException.class, e.getCause());
                        rejected++;
                    }
                }
                assertEquals(1, created);
                assertEquals(1, rejected);
                verify(worktrees, times(1)).createWorktreeFromBase(any(), anyString(), any(), anyString());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("state transitions and review")
    class Transitions {

        @Test
        @DisplayName("markReady moves a clean session to reviewed")
        void markReadyClean() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));
            when(worktrees.uncommittedSamplePaths(any(), anyInt())).thenReturn(List.of());

            assertTrue(service.markReady("alpha"));

            Session session = service.getSession("alpha");
            assertEquals(SessionState.REVIEWED, session.sessionState());
            assertTrue(session.readyToMerge());
        }

        @Test
        @DisplayName("markReady refuses a dirty worktree and changes nothing")
        void markReadyDirty() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));
            when(worktrees.uncommittedSamplePaths(any(), anyInt())).thenReturn(List.of("a.txt"));

            assertFalse(service.markReady("alpha"));
            assertEquals(SessionState.RUNNING, service.getSession("alpha").sessionState());
        }

        @Test
        @DisplayName("markReviewed rejects an already reviewed session")
        void markReviewedTwice() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));
            assertTrue(service.markReviewed("alpha"));

            assertThrows(InvalidSessionStateException.class, () -> service.markReviewed("alpha"));
        }

        @Test
        @DisplayName("unmarkReady returns a reviewed session to running")
        void unmarkReady() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));
            service.markReady("alpha");

            service.unmarkReady("alpha");

            Session session = service.getSession("alpha");
            assertEquals(SessionState.RUNNING, session.sessionState());
            assertFalse(session.readyToMerge());
        }

        @Test
        @DisplayName("a follow-up prompt resets only reviewed sessions")
        void followUp() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));
            assertFalse(service.unmarkReviewedOnFollowUp("alpha"));

            service.markReady("alpha");
            assertTrue(service.unmarkReviewedOnFollowUp("alpha"));
            assertEquals(SessionState.RUNNING, service.getSession("alpha").sessionState());
        }

        @Test
        @DisplayName("moving to spec retires the worktree and keeps the prompt")
        void toSpec() {
            Session created = service.createSession(CreateSessionRequest.of("alpha", null, "build it"));
            when(branches.branchExists(any(), eq("switchyard/alpha"))).thenReturn(true);

            Session spec = service.transitionState("alpha", SessionState.SPEC);

            assertEquals(SessionState.SPEC, spec.sessionState());
            assertEquals("build it", spec.specContent());
            verify(branches).deleteBranch(created.repositoryPath(), "switchyard/alpha");
        }

        @Test
        @DisplayName("spec to reviewed is rejected")
        void invalidTransition() {
            service.createSession(CreateSessionRequest.spec("alpha", "draft"));

            assertThrows(InvalidSessionStateException.class,
                    () -> service.transitionState("alpha", SessionState.REVIEWED));
            verifyNoInteractions(worktrees);
        }

        @Test
        @DisplayName("concurrent starts of one spec session materialize a single worktree")
        void concurrentStartsOfSpecSession() throws Exception {
            service.createSession(CreateSessionRequest.spec("alpha", "draft"));
            doAnswer(inv -> {
                Thread.sleep(300);
                return null;
            }).when(worktrees).createWorktreeFromBase(any(), anyString(), any(), anyString());

            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            Callable<Session> transition = () -> {
                start.await();
                return service.transitionState("alpha", SessionState.RUNNING);
            };
            try {
                Future<Session> a = pool.submit(transition);
                Future<Session> b = pool.submit(transition);
                start.countDown();

                for (Future<Session> f : List.of(a, b)) {
                    try {
                        assertEquals(SessionState.RUNNING, f.get(10, TimeUnit.SECONDS).sessionState());
                    } catch (ExecutionException e) {
                        assertInstanceOf(InvalidSessionStateException.class, e.getCause());
                    }
                }
                verify(worktrees, times(1)).createWorktreeFromBase(any(), anyString(), any(), anyString());
                verify(worktrees, never()).removeWorktree(any(), any());
                assertEquals(SessionState.RUNNING, service.getSession("alpha").sessionState());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("unknown sessions are reported")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> service.markReady("ghost"));
        }
    }

    @Nested
    @DisplayName("specs")
    class Specs {

        @Test
        @DisplayName("startSpec promotes the spec into a running session and deletes it")
        void startSpec() {
            service.createSpec("alpha", "write the parser");

            Session session = service.startSpec("alpha", null);

            assertEquals(SessionState.RUNNING, session.sessionState());
            assertEquals("write the parser", session.initialPrompt());
            assertTrue(session.pendingNameGeneration());
            assertFalse(session.resumeAllowed());
            assertTrue(service.listSpecs().isEmpty());
        }

        @Test
        @DisplayName("convertSessionToSpec cancels the session and stores its prompt")
        void convert() {
            service.createSession(CreateSessionRequest.of("alpha", null, "original prompt"));

            Spec spec = service.convertSessionToSpec("alpha");

            assertEquals("original prompt", spec.content());
            assertTrue(service.findSession("alpha").isEmpty());
            assertEquals(List.of("alpha"), service.listSpecs().stream().map(Spec::name).toList());
        }

        @Test
        @DisplayName("updateSpecContent and deleteSpec")
        void updateAndDelete() {
            service.createSpec("alpha", "v1");

            assertEquals("v2", service.updateSpecContent("alpha", "v2").content());

            service.deleteSpec("alpha");
            assertThrows(SessionNotFoundException.class, () -> service.deleteSpec("alpha"));
        }
    }

    @Nested
    @DisplayName("cancelSession")
    class Cancel {

        @Test
        @DisplayName("closes the session's terminals, removes the worktree and marks the row cancelled")
        void cancels() {
            Session session = service.createSession(CreateSessionRequest.of("alpha", null, null));
            when(terminals.listTerminals()).thenReturn(List.of("session-alpha-top", "session-beta-top"));
            when(branches.branchExists(any(), eq("switchyard/alpha"))).thenReturn(true);

            CancellationResult result = service.cancelSession("alpha", false);

            assertEquals(List.of("session-alpha-top"), result.closedTerminals());
            assertTrue(result.worktreeRemoved());
            assertTrue(result.branchDeleted());
            assertTrue(result.errors().isEmpty());
            verify(terminals, never()).closeTerminal("session-beta-top");
            assertEquals(SessionStatus.CANCELLED, sessionStore.findById(session.id()).orElseThrow().status());
            assertTrue(service.listSessions(false).isEmpty());
            assertEquals(1, service.listSessions(true).size());
        }

        @Test
        @DisplayName("keeps the branch when asked")
        void keepsBranch() {
            service.createSession(CreateSessionRequest.of("alpha", null, null));

            CancellationResult result = service.cancelSession("alpha", true);

            assertFalse(result.branchDeleted());
            verify(branches, never()).deleteBranch(any(), anyString());
        }

        @Test
        @DisplayName("spec sessions cannot be cancelled")
        void specRejected() {
            service.createSession(CreateSessionRequest.spec("alpha", "draft"));
            assertThrows(InvalidSessionStateException.class, () -> service.cancelSession("alpha", false));
        }
    }
}
