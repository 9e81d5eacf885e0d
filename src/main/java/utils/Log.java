package utils;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import init.Config;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class Log {

    // one logger per calling class, resolved from the stack
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    public static void info(String message) {
        getLogger().info(message);
    }

    public static void debug(String message) {
        getLogger().debug(message);
    }

    public static boolean isDebugEnabled() {
        return getLogger().isDebugEnabled();
    }

    public static void error(String message) {
        StackTraceElement caller = new Throwable().getStackTrace()[1];
        String callingClassName = caller.getClassName();
        String callingMethodName = caller.getMethodName();
        int callingLineNumber = caller.getLineNumber();
        String callingFileName = caller.getFileName();

        getLogger().error(callingClassName + "." + callingMethodName + "(" + callingFileName + ":" + callingLineNumber + ")" + " " + message);
    }

    public static void errorStack(String message, Throwable e) {
        getLogger().error(message, e);
    }

    public static void warn(String message) {
        getLogger().warn(message);
    }

    private static Logger getLogger() {
        String callingClassName = new Throwable().getStackTrace()[2].getClassName();
        return loggers.computeIfAbsent(callingClassName, LogManager::getLogger);
    }

    public static void printTime(String message, long startTime) {
        long endTime = System.currentTimeMillis();
        info(message + "  " + (endTime - startTime) + "ms");
    }

    public static void setLogLevel(String level) {
        Configurator.setRootLevel(Level.toLevel(level));
    }

    public static void initLogLevel() {
        setLogLevel(Config.logLevel);
    }
}
