package org.lite.telemetry.service;

/**
 * Natural-language commands understood by the coordinator's database troubleshooting agent.
 */
public final class OracleCommands {

    private OracleCommands() {
    }

    public static String checkBlocking(String database) {
        return "check blocking sessions on " + database;
    }

    public static String runningSql(String database) {
        return "show running SQL on " + database;
    }

    public static String checkParallelism(String database) {
        return "check parallelism for " + database;
    }
}
