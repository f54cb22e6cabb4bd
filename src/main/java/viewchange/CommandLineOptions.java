package viewchange;

import viewchange.common.ConfigurationException;
import viewchange.vc.Scenario;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

public class CommandLineOptions {
    private String name;
    private Path hostsFile = Paths.get("hosts");
    private Scenario scenario = Scenario.NORMAL_CASE;
    private Duration progressTimeout = Duration.ofSeconds(3);
    private Duration proofInterval = Duration.ofSeconds(1);
    private Path logDirectory;

    public static CommandLineOptions parse(String... args) {
        CommandLineOptions options = new CommandLineOptions();
        for (int i = 0; i < args.length; i++) {
            String option = args[i];
            switch (option) {
                case "-n":
                case "--name":
                    options.name = valueOf(args, ++i, option);
                    break;
                case "-h":
                case "--hosts":
                    options.hostsFile = Paths.get(valueOf(args, ++i, option));
                    break;
                case "-t":
                case "--test":
                    options.scenario = Scenario.fromNumber(intValueOf(args, ++i, option));
                    break;
                case "-p":
                case "--progress":
                    options.progressTimeout = secondsOf(args, ++i, option);
                    break;
                case "-v":
                case "--vcproof":
                    options.proofInterval = secondsOf(args, ++i, option);
                    break;
                case "-l":
                case "--log":
                    options.logDirectory = Paths.get(valueOf(args, ++i, option));
                    break;
                default:
                    throw new ConfigurationException("Unknown option " + option + "\n" + usage());
            }
        }
        if (options.name == null || options.name.isBlank()) {
            throw new ConfigurationException("Missing required option --name\n" + usage());
        }
        return options;
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ConfigurationException("Option " + option + " needs a value");
        }
        return args[index];
    }

    private static int intValueOf(String[] args, int index, String option) {
        String value = valueOf(args, index, option);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + option + " expects a number, got " + value, e);
        }
    }

    private static Duration secondsOf(String[] args, int index, String option) {
        int seconds = intValueOf(args, index, option);
        if (seconds <= 0) {
            throw new ConfigurationException("Option " + option + " must be a positive number of seconds, got " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    public static String usage() {
        return "Usage: viewchange -n NAME [-h HOSTS_FILE] [-t TEST_CASE] [-p PROGRESS_SECONDS] [-v VCPROOF_SECONDS] [-l LOG_DIR]\n" +
                "  -n, --name     name of this node in the hosts file\n" +
                "  -h, --hosts    hosts file, one node per line (default: hosts)\n" +
                "  -t, --test     test case 1-5 (default: 1)\n" +
                "  -p, --progress progress timeout in seconds (default: 3)\n" +
                "  -v, --vcproof  proof interval in seconds (default: 1)\n" +
                "  -l, --log      directory for log files (default: stderr)";
    }

    public String getName() {
        return name;
    }

    public Path getHostsFile() {
        return hostsFile;
    }

    public Scenario getScenario() {
        return scenario;
    }

    public Duration getProgressTimeout() {
        return progressTimeout;
    }

    public Duration getProofInterval() {
        return proofInterval;
    }

    public Optional<Path> getLogDirectory() {
        return Optional.ofNullable(logDirectory);
    }
}
