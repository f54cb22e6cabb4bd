package viewchange.common;

import com.google.common.util.concurrent.Uninterruptibles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import viewchange.net.InetAddressAndPort;

import java.io.IOException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the host list. One node per line, in roster order:
 * <pre>
 *   name                 host is the name itself, default port
 *   name:port            host is the name itself
 *   name host
 *   name host:port
 * </pre>
 * Blank lines and lines starting with # are skipped.
 *
 * Host names are resolved while parsing. Containers of a run come up at
 * different times, so resolution is retried a few times before giving up.
 */
public class RosterFileParser {
    private static final Logger logger = LogManager.getLogger(RosterFileParser.class);

    public static final int DEFAULT_PORT = 42069;

    private final int resolveAttempts;
    private final Duration retryDelay;

    public RosterFileParser() {
        this(20, Duration.ofMillis(500));
    }

    public RosterFileParser(int resolveAttempts, Duration retryDelay) {
        this.resolveAttempts = resolveAttempts;
        this.retryDelay = retryDelay;
    }

    public Roster parse(Path hostFile) {
        try {
            return parse(Files.readAllLines(hostFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read host file " + hostFile, e);
        }
    }

    public Roster parse(List<String> lines) {
        List<RosterEntry> entries = new ArrayList<>();
        int lineNumber = 0;
        for (String rawLine : lines) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            entries.add(parseEntry(line, lineNumber));
        }
        return new Roster(entries);
    }

    private RosterEntry parseEntry(String line, int lineNumber) {
        String[] tokens = line.split("\\s+");
        if (tokens.length > 2) {
            throw new ConfigurationException("Line " + lineNumber + ": expected 'name [host[:port]]' but was '" + line + "'");
        }
        String hostAndPort = tokens.length == 2 ? tokens[1] : tokens[0];
        String name = tokens.length == 2 ? tokens[0] : hostOf(tokens[0]);
        String host = hostOf(hostAndPort);
        int port = portOf(hostAndPort, lineNumber);
        if (name.isEmpty() || host.isEmpty()) {
            throw new ConfigurationException("Line " + lineNumber + ": missing name or host in '" + line + "'");
        }
        return new RosterEntry(name, resolve(host, port));
    }

    private static String hostOf(String hostAndPort) {
        int separator = hostAndPort.lastIndexOf(':');
        return separator < 0 ? hostAndPort : hostAndPort.substring(0, separator);
    }

    private static int portOf(String hostAndPort, int lineNumber) {
        int separator = hostAndPort.lastIndexOf(':');
        if (separator < 0) {
            return DEFAULT_PORT;
        }
        String port = hostAndPort.substring(separator + 1);
        try {
            int value = Integer.parseInt(port);
            if (value < 1 || value > 65535) {
                throw new ConfigurationException("Line " + lineNumber + ": port out of range " + port);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Line " + lineNumber + ": invalid port '" + port + "'", e);
        }
    }

    private InetAddressAndPort resolve(String host, int port) {
        for (int attempt = 1; ; attempt++) {
            try {
                return InetAddressAndPort.create(host, port);
            } catch (UnknownHostException e) {
                if (attempt >= resolveAttempts) {
                    throw new ConfigurationException("Unable to resolve host " + host, e);
                }
                logger.warn("Unable to resolve " + host + " (attempt " + attempt + "), retrying in " + retryDelay.toMillis() + "ms");
                Uninterruptibles.sleepUninterruptibly(retryDelay);
            }
        }
    }
}
