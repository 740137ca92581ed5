package com.switchyard.dispatch.cli;

import com.switchyard.TestFixtures;
import com.switchyard.agents.AgentLaunchSpec;
import com.switchyard.agents.AgentManifest;
import com.switchyard.agents.LaunchCoordinator;
import com.switchyard.agents.TerminalBackend;
import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.MergeConflictException;
import com.switchyard.core.errors.SessionNotFoundException;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.model.MergeMode;
import com.switchyard.core.model.MergeOutcome;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.model.Spec;
import com.switchyard.core.model.UpdateSessionFromParentResult;
import com.switchyard.core.model.UpdateStatus;
import com.switchyard.git.CloneService;
import com.switchyard.merge.MergeService;
import com.switchyard.sessions.CreateSessionRequest;
import com.switchyard.sessions.EpicService;
import com.switchyard.sessions.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.lang.reflect.Constructor;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests for the Switchyard CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, exit codes and output.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final Path repo = Path.of("/tmp/switchyard-cli-repo");

    private SessionService sessions;
    private MergeService merges;
    private EpicService epics;
    private LaunchCoordinator launcher;
    private EventBus eventBus;
    private Map<Class<?>, Object> dependencies;

    @BeforeEach
    void setUp() {
        sessions = mock(SessionService.class);
        merges = mock(MergeService.class);
        epics = mock(EpicService.class);
        launcher = mock(LaunchCoordinator.class);
        eventBus = new EventBus();
        dependencies = new HashMap<>();
        dependencies.put(SessionService.class, sessions);
        dependencies.put(MergeService.class, merges);
        dependencies.put(EpicService.class, epics);
        dependencies.put(LaunchCoordinator.class, launcher);
        dependencies.put(AgentManifest.class, new AgentManifest(new SwitchyardProperties()));
        dependencies.put(TerminalBackend.class, mock(TerminalBackend.class));
        dependencies.put(CloneService.class, mock(CloneService.class));
    }

    /**
     * Builds every command through its constructor, resolving parameters from the mocks above.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                Constructor<?>[] constructors = cls.getConstructors();
                if (constructors.length == 1 && constructors[0].getParameterCount() > 0) {
                    Class<?>[] types = constructors[0].getParameterTypes();
                    Object[] args = new Object[types.length];
                    for (int i = 0; i < types.length; i++) {
                        args[i] = dependencies.computeIfAbsent(types[i], t -> mock(t));
                    }
                    return (K) constructors[0].newInstance(args);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        try {
            System.setOut(capturePrintStream);
            CommandLine cmd = new CommandLine(new SwitchyardCommand(eventBus), createFactory())
                    .setCaseInsensitiveEnumValuesAllowed(true);
            cmd.setOut(new PrintWriter(capturePrintStream, true));
            cmd.setErr(new PrintWriter(capturePrintStream, true));
            int exitCode = cmd.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    private Session session(String name) {
        return TestFixtures.session(repo, name).build();
    }

    @Nested
    @DisplayName("root command")
    class Root {

        @Test
        @DisplayName("no arguments prints usage listing the subcommands")
        void usage() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("create"));
            assertTrue(result.output().contains("merge"));
            assertTrue(result.output().contains("launch"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Switchyard 0.1.0"));
        }

        @Test
        @DisplayName("unknown subcommands are usage errors")
        void unknown() {
            assertEquals(2, execute("frobnicate").exitCode());
        }
    }

    @Nested
    @DisplayName("sessions")
    class Sessions {

        @Test
        @DisplayName("create passes options through to the service")
        void create() {
            when(sessions.createSession(any())).thenReturn(session("alpha"));

            CliResult result = execute("create", "alpha", "-p", "develop", "--prompt", "do it",
                    "--agent", "codex", "--skip-permissions");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Created session alpha"));
            ArgumentCaptor<CreateSessionRequest> captor = ArgumentCaptor.forClass(CreateSessionRequest.class);
            verify(sessions).createSession(captor.capture());
            CreateSessionRequest request = captor.getValue();
            assertEquals("develop", request.parentBranch());
            assertEquals("do it", request.initialPrompt());
            assertEquals("codex", request.agentType());
            assertEquals(Boolean.TRUE, request.skipPermissions());
            assertFalse(request.asSpec());
        }

        @Test
        @DisplayName("--events prints lifecycle events published while the command runs")
        void printsEvents() {
            when(sessions.createSession(any())).thenAnswer(inv -> {
                eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.SESSION_ADDED, "id-alpha", "alpha",
                        Map.of("branch", "switchyard/alpha"), Clock.systemUTC()));
                return session("alpha");
            });

            CliResult quiet = execute("create", "alpha");
            CliResult verbose = execute("--events", "create", "alpha");

            assertFalse(quiet.output().contains("[session.added]"));
            assertTrue(verbose.output().contains("[session.added] alpha {branch=switchyard/alpha}"));
        }

        @Test
        @DisplayName("a missing session exits with its error code")
        void showMissing() {
            when(sessions.getSession("ghost")).thenThrow(new SessionNotFoundException("ghost"));

            CliResult result = execute("show", "ghost");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("ghost"));
        }

        @Test
        @DisplayName("list --json prints sessions as JSON")
        void listJson() {
            when(sessions.listSessions(false)).thenReturn(List.of(session("alpha")));

            CliResult result = execute("list", "--json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"name\" : \"alpha\""));
            assertTrue(result.output().contains("2026-01-15T10:00:00Z"));
        }

        @Test
        @DisplayName("ready exits 1 when the worktree is dirty")
        void readyDirty() {
            when(sessions.markReady("alpha")).thenReturn(false);

            assertEquals(1, execute("ready", "alpha").exitCode());
        }

        @Test
        @DisplayName("transition accepts lowercase state names")
        void transition() {
            when(sessions.transitionState("alpha", SessionState.REVIEWED))
                    .thenReturn(session("alpha").toBuilder().sessionState(SessionState.REVIEWED).build());

            CliResult result = execute("transition", "alpha", "reviewed");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("alpha is now reviewed"));
        }

        @Test
        @DisplayName("spec create delegates to the service")
        void specCreate() {
            when(sessions.createSpec("beta", "draft")).thenReturn(
                    new Spec("id", "beta", null, null, repo, "repo", "draft", TestFixtures.T0, TestFixtures.T0));

            assertEquals(0, execute("spec", "create", "beta", "-c", "draft").exitCode());
        }
    }

    @Nested
    @DisplayName("merge and update")
    class Merging {

        @Test
        @DisplayName("merge defaults to squash")
        void mergeSquash() {
            when(merges.applyMerge("alpha", MergeMode.SQUASH, "ship it"))
                    .thenReturn(new MergeOutcome("switchyard/alpha", "main", "0123456789abcdef", MergeMode.SQUASH));

            CliResult result = execute("merge", "alpha", "-m", "ship it");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("01234567"));
        }

        @Test
        @DisplayName("conflicts exit 7 and list the paths")
        void mergeConflict() {
            when(merges.applyMerge(eq("alpha"), eq(MergeMode.REAPPLY), isNull()))
                    .thenThrow(new MergeConflictException(List.of("src/App.java"), "conflict"));

            CliResult result = execute("merge", "alpha", "--mode", "reapply");

            assertEquals(7, result.exitCode());
            assertTrue(result.output().contains("src/App.java"));
        }

        @Test
        @DisplayName("update reports conflicts with exit 1")
        void updateConflicts() {
            when(merges.updateSessionFromParent("alpha")).thenReturn(new UpdateSessionFromParentResult(
                    UpdateStatus.HAS_CONFLICTS, "main", "conflicts", List.of("a.txt")));

            CliResult result = execute("update", "alpha");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("a.txt"));
        }

        @Test
        @DisplayName("update up to date exits 0")
        void updateUpToDate() {
            when(merges.updateSessionFromParent("alpha")).thenReturn(
                    UpdateSessionFromParentResult.of(UpdateStatus.ALREADY_UP_TO_DATE, "main", "Already up to date"));

            assertEquals(0, execute("update", "alpha").exitCode());
        }
    }

    @Nested
    @DisplayName("launch")
    class Launch {

        @Test
        @DisplayName("uses the session's agent and a session-scoped terminal id")
        void launchesSessionAgent() {
            when(sessions.getSession("alpha"))
                    .thenReturn(session("alpha").toBuilder().originalAgentType("codex").build());
            when(launcher.launchInTerminal(anyString(), any(), any(), any())).thenReturn("cd x && codex");

            CliResult result = execute("launch", "alpha", "--prompt", "next step", "--detach");

            assertEquals(0, result.exitCode());
            ArgumentCaptor<AgentLaunchSpec> spec = ArgumentCaptor.forClass(AgentLaunchSpec.class);
            verify(launcher).launchInTerminal(eq("session-alpha-top"), spec.capture(), isNull(), isNull());
            assertTrue(spec.getValue().shellCommand().contains("codex \"next step\""));
            verify(sessions).unmarkReviewedOnFollowUp("alpha");
        }

        @Test
        @DisplayName("--detach releases the terminal so exit teardown leaves it running")
        void detachReleasesTerminal() {
            TerminalBackend terminals = (TerminalBackend) dependencies.get(TerminalBackend.class);
            when(sessions.getSession("alpha")).thenReturn(session("alpha"));
            when(launcher.launchInTerminal(anyString(), any(), any(), any())).thenReturn("cd x && claude");

            assertEquals(0, execute("launch", "alpha", "--detach").exitCode());

            verify(terminals).detachTerminal("session-alpha-top");
            verify(terminals, never()).closeTerminal(anyString());
        }

        @Test
        @DisplayName("spec sessions cannot be launched")
        void specRejected() {
            when(sessions.getSession("alpha"))
                    .thenReturn(session("alpha").toBuilder().sessionState(SessionState.SPEC).build());

            assertEquals(10, execute("launch", "alpha").exitCode());
            verifyNoInteractions(launcher);
        }
    }
}
