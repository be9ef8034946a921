package fhdl.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Channel for advisory warnings. Every warning is logged; callers that want to inspect warnings programmatically
 * open a collector for the duration of a construction step with {@link #collect(Runnable)}.
 */
public final class HdlWarnings {
  protected static final Logger logger = LogManager.getLogger();

  private static final ThreadLocal<Deque<List<HdlWarning>>> collectors = ThreadLocal.withInitial(ArrayDeque::new);

  private HdlWarnings() {}

  /**
   * Reports a warning to the log and to all collectors open on the current thread.
   * @param kind the warning kind
   * @param message the message
   */
  public static void warn(HdlWarning.Kind kind, String message) {
    HdlWarning warning = new HdlWarning(kind, message);
    logger.warn(message);
    for (List<HdlWarning> collector : collectors.get())
      collector.add(warning);
  }

  /**
   * Runs body and returns the warnings it raised. Collectors nest; an outer collector also sees the warnings of inner ones.
   * @param body the construction step
   * @return the warnings in the order they were raised
   */
  public static List<HdlWarning> collect(Runnable body) {
    List<HdlWarning> collected = new ArrayList<>();
    Deque<List<HdlWarning>> stack = collectors.get();
    stack.push(collected);
    try {
      body.run();
    } finally {
      stack.pop();
      if (stack.isEmpty())
        collectors.remove();
    }
    return collected;
  }
}
