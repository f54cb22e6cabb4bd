package viewchange;

import com.google.common.util.concurrent.Uninterruptibles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import viewchange.common.Config;
import viewchange.common.ConfigurationException;
import viewchange.common.Roster;
import viewchange.common.RosterFileParser;
import viewchange.vc.Scenario;
import viewchange.vc.ScenarioHooks;
import viewchange.vc.ViewChangeReplica;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Starts one node of a view-change run and blocks until the selected test
 * case exits the process.
 */
public class ViewChangeMain {
    static final String LOG_DIR_PROPERTY = "viewchange.logDir";
    static final String NODE_NAME_PROPERTY = "viewchange.nodeName";
    static final int EXIT_CONFIGURATION_ERROR = 1;

    //no static logger: log4j reads the routing properties when the first logger is created.
    public static void main(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_CONFIGURATION_ERROR);
            return;
        }
        System.setProperty(NODE_NAME_PROPERTY, options.getName());
        options.getLogDirectory().ifPresent(dir -> System.setProperty(LOG_DIR_PROPERTY, dir.toAbsolutePath().toString()));

        Logger logger = LogManager.getLogger(ViewChangeMain.class);
        try {
            run(options, logger);
        } catch (ConfigurationException | IOException e) {
            logger.error("Unable to start " + options.getName() + ": " + e.getMessage(), e);
            LogManager.shutdown();
            System.exit(EXIT_CONFIGURATION_ERROR);
        }
    }

    private static void run(CommandLineOptions options, Logger logger) throws IOException {
        Roster roster = new RosterFileParser().parse(options.getHostsFile());
        Scenario scenario = options.getScenario();
        Config config = scenario.configure(new Config(options.getName(), roster)
                .withProgressTimeout(options.getProgressTimeout())
                .withProofInterval(options.getProofInterval()));

        logger.info(options.getName() + " is node " + config.getServerId() + " of " + roster
                + ", running " + scenario + ", progress timeout " + config.getProgressTimeout()
                + ", proof interval " + config.getProofInterval());

        ScenarioHooks hooks = new ScenarioHooks(scenario, config.getServerId(), System.out, ViewChangeMain::exit);
        ViewChangeReplica replica = new ViewChangeReplica(config, hooks);
        Runtime.getRuntime().addShutdownHook(new Thread(replica::shutdown, "shutdown-" + options.getName()));
        replica.start();

        Uninterruptibles.awaitUninterruptibly(new CountDownLatch(1));
    }

    private static void exit(int status) {
        LogManager.shutdown();
        System.exit(status);
    }
}
