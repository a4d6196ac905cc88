package org.brighted.cli;

import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    private static final Pattern SESSION_ID = Pattern.compile("Session ([0-9a-f-]{36}) ");

    private CommandLineInterface cli;
    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cli = new CommandLineInterface();
        cmd = CommandLineInterface.newCommandLine(cli);
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    @AfterEach
    void tearDown() {
        cli.close();
    }

    @Test
    void cliInitialization() {
        assertThat(cmd.getCommandName()).isEqualTo("brighted");
        assertThat(cmd.getSubcommands()).containsKeys("session", "progress", "status", "help");
    }

    @Test
    void playsARegistrationThroughTheCommandLine() {
        String id = startSession();

        int decided = run("--at", "2026-03-01T10:00:00Z", "session", "-u", "u1", "decide", id, "business_register",
                "-p", "businessName=Acme");
        assertThat(decided).isZero();
        assertThat(out.toString()).contains("status=PENDING").contains("1 minute(s) remaining");

        int viewed = run("--at", "2026-03-01T10:00:30Z", "session", "-u", "u1", "view", id);
        assertThat(viewed).isZero();
        assertThat(out.toString()).contains("status=APPROVED");
    }

    @Test
    void engineErrorsExitWithCodeTwo() {
        String id = startSession();

        int exit = run("--at", "2026-03-01T10:00:00Z", "session", "-u", "u1", "decide", id, "business_rob_bank");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown choice");
    }

    @Test
    void progressCommandsReportAwards() {
        assertThat(run("--at", "2026-03-01T10:00:00Z", "progress", "-u", "u1", "xp", "190")).isZero();
        assertThat(run("--at", "2026-03-01T10:05:00Z", "progress", "-u", "u1", "xp", "50")).isZero();
        assertThat(out.toString()).contains("XP +10 (today 200, capped)");

        assertThat(run("progress", "-u", "u1", "show")).isZero();
        assertThat(out.toString()).contains("XP total=200 today=200 day=2026-03-01");
    }

    @Test
    void statusPrintsStoreMetricsAsJson() {
        assertThat(run("status", "--json")).isZero();

        assertThat(out.toString()).contains("\"store\": \"game-state\"").contains("\"healthy\": true");
    }

    @Test
    void payloadNumbersAreParsed() {
        Map<String, Object> payload = SessionCommand.toPayload(Map.of("principal", "300", "businessName", "Acme 2"));

        assertThat(payload).containsEntry("principal", 300L).containsEntry("businessName", "Acme 2");
    }

    private String startSession() {
        assertThat(run("--at", "2026-03-01T10:00:00Z", "session", "-u", "u1", "start")).isZero();
        Matcher matcher = SESSION_ID.matcher(out.toString());
        assertThat(matcher.find()).isTrue();
        return matcher.group(1);
    }

    private int run(String... args) {
        return cmd.execute(args);
    }
}
