package io.github.panghy.pdbbridge.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers shared by the bridge. Every message goes through JUL with the
 * class and method of the real caller attached, so log lines point at the bridge
 * component rather than at this class.
 */
public final class LoggingUtil {

  private LoggingUtil() {
  }

  /**
   * Finds the first stack frame outside of this class.
   */
  private static StackTraceElement findCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    String self = LoggingUtil.class.getName();
    for (int i = 1; i < stack.length; i++) {
      String className = stack[i].getClassName();
      if (!className.equals(self) && !className.equals(Thread.class.getName())) {
        return stack[i];
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = findCaller();
    if (throwable == null) {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    } else {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
    }
  }

  /**
   * Logs at {@link Level#FINE}. Used for per-call tracing.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs at {@link Level#INFO}. Used for lifecycle events.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }

  /**
   * Logs at {@link Level#WARNING}.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, message, null);
  }

  /**
   * Logs at {@link Level#WARNING} with the stack trace of {@code throwable}.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, message, throwable);
  }

  /**
   * Logs at {@link Level#SEVERE}.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void error(Logger logger, String message) {
    log(logger, Level.SEVERE, message, null);
  }

  /**
   * Logs at {@link Level#SEVERE} with the stack trace of {@code throwable}.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, message, throwable);
  }
}
