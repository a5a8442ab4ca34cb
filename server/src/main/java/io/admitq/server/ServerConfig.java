// file: server/src/main/java/io/admitq/server/ServerConfig.java
package io.admitq.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:             HTTP API port
 *  - dataDir:              root for WAL segments (dataDir/wal) and snapshots (dataDir/snap)
 *  - snapshotEvery:        write a snapshot after this many mutations
 *  - reapIntervalSeconds:  how often the reaper sweeps expired entries
 *  - pollIntervalSeconds:  how often queued orgs are re-checked for admission
 *  - ceilingsPath:         optional JSON file with org/agent concurrency limits;
 *                          runtime changes are written back to it
 *  - removeOnCancel:       delete canceled entries immediately instead of on the next sweep
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        int snapshotEvery,
        long reapIntervalSeconds,
        long pollIntervalSeconds,
        String ceilingsPath,
        boolean removeOnCancel
) {

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (reapIntervalSeconds <= 0) throw new IllegalArgumentException("reap-interval-seconds must be > 0");
        if (pollIntervalSeconds <= 0) throw new IllegalArgumentException("poll-interval-seconds must be > 0");
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --snapshot-every  <ops>
     *   --reap-interval-seconds <seconds>
     *   --poll-interval-seconds <seconds>
     *   --ceilings,  -c   <path>
     *   --remove-on-cancel
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        int snapshotEvery = 10_000;
        long reapIntervalSeconds = 3600;
        long pollIntervalSeconds = 30;
        String ceilingsPath = null;
        boolean removeOnCancel = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseNumber("http-port", args[++i]).intValue();
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseNumber("snapshot-every", args[++i]).intValue();
                }

                case "--reap-interval-seconds" -> {
                    ensureValue(args, i);
                    reapIntervalSeconds = parseNumber("reap-interval-seconds", args[++i]);
                }

                case "--poll-interval-seconds" -> {
                    ensureValue(args, i);
                    pollIntervalSeconds = parseNumber("poll-interval-seconds", args[++i]);
                }

                case "--ceilings", "-c" -> {
                    ensureValue(args, i);
                    ceilingsPath = args[++i];
                }

                case "--remove-on-cancel" -> removeOnCancel = true;

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                httpPort,
                dataDir,
                snapshotEvery,
                reapIntervalSeconds,
                pollIntervalSeconds,
                ceilingsPath,
                removeOnCancel
        );
    }

    private static Long parseNumber(String option, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + raw);
            System.exit(1);
            return null; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: admitq-server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --data-dir,       -d   Data directory for WAL and snapshots (default: ./data)
              --snapshot-every       Mutations between snapshots (default: 10000)
              --reap-interval-seconds  Reaper sweep interval (default: 3600)
              --poll-interval-seconds  Admission safety poll interval (default: 30)
              --ceilings,       -c   Path to JSON concurrency ceilings (optional).
                                     Limits changed over HTTP are saved back to this file;
                                     without it they last until restart.
              --remove-on-cancel     Delete canceled entries immediately
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
