package org.brighted.cli;

import org.brighted.practicals.MissionCompletionResult;
import org.brighted.practicals.ProgressionService;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.progression.LabCompletionResult;
import org.brighted.runtime.progression.XpUpdateResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;

@Command(name = "progress", description = "Award experience, complete labs and missions.")
public class ProgressCommand {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-u", "--user"}, required = true,
            description = "Acting user id")
    private String userId;

    @Command(name = "xp", description = "Award raw experience through the daily cap.")
    int xp(@Parameters(index = "0", description = "Raw reward") int rawReward) {
        XpUpdateResult result = progression().awardXp(userId, rawReward, parent.now());
        printXp(result);
        return 0;
    }

    @Command(name = "lab", description = "Complete a lab.")
    int lab(@Parameters(index = "0", description = "Lab id") String labId,
            @Option(names = "--reward", defaultValue = "150", description = "Raw reward (default: ${DEFAULT-VALUE})")
            int rawReward) {
        LabCompletionResult result = progression().completeLab(userId, labId, rawReward, parent.now());
        if (result.alreadyCompleted()) {
            out().println("Lab " + labId + " already completed today");
        } else {
            printXp(result.xp());
            out().printf("Coins +%d%n", result.coins());
        }
        return 0;
    }

    @Command(name = "mission", description = "Complete a mission.")
    int mission(@Parameters(index = "0", description = "Mission id") String missionId,
                @Option(names = "--cooldown-minutes", description = "Fixed cooldown length if one opens")
                Integer cooldownMinutes) {
        MissionCompletionResult result = progression().completeMission(userId, missionId, parent.now(), cooldownMinutes);
        PrintWriter out = out();
        out.printf("Missions today: %d%s%n", result.dailyCount(), result.rewarded() ? "" : " (not rewarded)");
        result.xp().ifPresent(this::printXp);
        result.cooldown().ifPresent(c -> out.printf("%s Until %s%n", c.reason(), c.until()));
        return 0;
    }

    @Command(name = "show", description = "Show experience counters and mission cooldown.")
    int show() {
        ProgressionCounters counters = progression().getProgression(userId);
        PrintWriter out = out();
        out.printf("XP total=%d today=%d day=%s%n", counters.xpTotal(), counters.xpAwardedToday(),
                counters.dayKeyOfLastAward() == null ? "-" : counters.dayKeyOfLastAward());
        progression().getMissionCooldown(userId, parent.now())
                .ifPresent(c -> out.printf("%s Until %s%n", c.reason(), c.until()));
        return 0;
    }

    private ProgressionService progression() {
        return parent.getEngine().progression();
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private void printXp(XpUpdateResult xp) {
        out().printf("XP +%d (today %d%s)%n", xp.xpGain(), xp.xpToday(), xp.isCapped() ? ", capped" : "");
    }
}
