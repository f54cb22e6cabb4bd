package viewchange.vc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.function.IntConsumer;

public class ScenarioHooks implements ViewChangeListener {
    private static Logger logger = LogManager.getLogger(ScenarioHooks.class);

    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_CRASHED = 101;

    private final Scenario scenario;
    private final int selfId;
    private final PrintStream out;
    private final IntConsumer exit;

    public ScenarioHooks(Scenario scenario, int selfId, PrintStream out, IntConsumer exit) {
        this.scenario = scenario;
        this.selfId = selfId;
        this.out = out;
        this.exit = exit;
    }

    @Override
    public void onQuorumReached(int view, int leaderId) {
        if (leaderId == selfId && scenario.crashesOnQuorum(selfId)) {
            logger.warn(selfId + " crashing on quorum for view " + view + " in " + scenario);
            exit.accept(EXIT_CRASHED);
        }
    }

    @Override
    public void onViewInstalled(int view, int leaderId) {
        out.println(selfId + ": Server " + leaderId + " is the new leader of view " + view);
        out.flush();
        if (scenario.isComplete(view, leaderId)) {
            logger.info(selfId + " reached view " + view + ", " + scenario + " is complete");
            exit.accept(EXIT_COMPLETED);
        }
    }
}
