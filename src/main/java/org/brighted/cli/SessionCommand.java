package org.brighted.cli;

import org.brighted.practicals.DecisionOutcome;
import org.brighted.practicals.FinishResult;
import org.brighted.practicals.PracticalSessionService;
import org.brighted.practicals.SessionView;
import org.brighted.practicals.TickResult;
import org.brighted.runtime.decisions.BusinessChoiceRules;
import org.brighted.runtime.model.BusinessSimState;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.PracticalSession;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.SessionState;
import org.brighted.store.api.DecisionLogEntry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;

@Command(name = "session", description = "Start, play and finish practical sessions.")
public class SessionCommand {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-u", "--user"}, required = true,
            description = "Acting user id")
    private String userId;

    @Command(name = "start", description = "Start a new session.")
    int start(@Option(names = "--story", defaultValue = BusinessChoiceRules.STORY_SLUG,
                      description = "Story slug (default: ${DEFAULT-VALUE})") String story) {
        SessionView view = sessions().startSession(userId, story, parent.now());
        print(view);
        return 0;
    }

    @Command(name = "decide", description = "Submit a decision.")
    int decide(@Parameters(index = "0", description = "Session id") String sessionId,
               @Parameters(index = "1", description = "Choice id, e.g. business_register") String choiceId,
               @Option(names = {"-p", "--payload"}, description = "Payload field key=value") Map<String, String> payload) {
        DecisionOutcome outcome = sessions().submitDecision(userId, sessionId, choiceId, toPayload(payload), parent.now());
        PrintWriter out = out();
        out.printf("Decision %s: %d immediate effect(s), %d scheduled consequence(s)%n",
                outcome.decisionId(), outcome.immediateEffects().size(), outcome.scheduled().size());
        print(outcome.view());
        return 0;
    }

    @Command(name = "view", description = "Tick a session and show it.")
    int view(@Parameters(index = "0", description = "Session id") String sessionId) {
        TickResult result = sessions().tick(userId, sessionId, parent.now());
        for (Consequence c : result.applied()) {
            out().printf("Applied %s (%s): %s%n", c.ruleId(), c.id(), c.effects());
        }
        print(result.view());
        return 0;
    }

    @Command(name = "finish", description = "Finish a session as COMPLETED or FAILED.")
    int finish(@Parameters(index = "0", description = "Session id") String sessionId,
               @Option(names = "--outcome", defaultValue = "COMPLETED",
                       description = "COMPLETED or FAILED (default: ${DEFAULT-VALUE})") SessionState outcome) {
        FinishResult result = sessions().finishSession(userId, sessionId, outcome, parent.now());
        result.xp().ifPresent(xp -> out().printf("XP +%d (today %d%s)%n",
                xp.xpGain(), xp.xpToday(), xp.isCapped() ? ", capped" : ""));
        print(result.view());
        return 0;
    }

    @Command(name = "history", description = "List the decisions of a session.")
    int history(@Parameters(index = "0", description = "Session id") String sessionId) {
        for (DecisionLogEntry entry : sessions().decisionHistory(userId, sessionId)) {
            out().printf("%s %s %s payload=%s delayed=%s%n", entry.decidedAt(), entry.id(), entry.choiceId(),
                    entry.payload(), entry.delayedRuleIds());
        }
        return 0;
    }

    private PracticalSessionService sessions() {
        return parent.getEngine().sessions();
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private void print(SessionView view) {
        PrintWriter out = out();
        PracticalSession s = view.session();
        ResourceBundle r = s.snapshot().resources();
        out.printf("Session %s [%s] story=%s%n", s.id(), s.state(), s.storySlug());
        out.printf("  resources: currency=%d timeUnits=%d energy=%d inventory=%s%n",
                r.currency(), r.timeUnits(), r.energy(), r.inventory());
        if (!s.snapshot().reputation().isEmpty()) {
            out.printf("  reputation: %s%n", s.snapshot().reputation());
        }
        BusinessSimState b = s.snapshot().business();
        if (b != null) {
            out.printf("  business: %s status=%s cash=%d loans=%d%n",
                    b.businessName() == null ? "(unnamed)" : b.businessName(),
                    b.registrationStatus(), b.cashBalance(), b.loans().size());
        }
        view.registrationRemainingMinutes().ifPresent(m -> out.printf("  registration: %d minute(s) remaining%n", m));
        for (Consequence c : view.pendingConsequences()) {
            out.printf("  pending: %s at %s%n", c.ruleId(), c.scheduledAt());
        }
    }

    /**
     * Whole numbers are passed as numbers so rules can validate numeric fields.
     */
    static Map<String, Object> toPayload(Map<String, String> raw) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (raw == null) {
            return payload;
        }
        raw.forEach((key, value) -> {
            if (value.matches("-?\\d{1,18}")) {
                payload.put(key, Long.parseLong(value));
            } else {
                payload.put(key, value);
            }
        });
        return payload;
    }
}
