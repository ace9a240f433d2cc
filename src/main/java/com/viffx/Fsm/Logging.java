package com.viffx.Fsm;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

public class Logging {
    private static final String LOGGER_NAME = "com.viffx.Fsm";

    private Logging() {}

    public static Logger getLogger() {
        return Logger.getLogger(LOGGER_NAME);
    }

    /**
     * Raises or lowers the level of every logger below {@code com.viffx.Fsm}.
     *
     * @param verbose {@code true} for DEBUG, {@code false} for the level configured in log4j.properties
     * @return the root logger of the front end
     */
    public static Logger setupLogging(boolean verbose) {
        Logger logger = getLogger();
        // a null level inherits the configured one
        logger.setLevel(verbose ? Level.DEBUG : null);
        return logger;
    }
}
