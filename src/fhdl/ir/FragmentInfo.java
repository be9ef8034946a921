package fhdl.ir;

import fhdl.ast.Signal;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Human-readable summary of a fragment for logs.
 */
public final class FragmentInfo {
  private FragmentInfo() {}

  /**
   * Lists inputs, outputs, inouts and the other signals of fragment as {@code name(nbits[, signed])}, followed by its
   * domains, instances and the summaries of its children, indented.
   */
  public static String format(Fragment fragment) {
    StringBuilder builder = new StringBuilder();
    format(fragment, "", builder);
    return builder.toString();
  }

  private static void format(Fragment fragment, String indent, StringBuilder builder) {
    builder.append(indent).append("inputs: ").append(describe(fragment.ports(PortDirection.INPUT).keySet())).append('\n');
    builder.append(indent).append("outputs: ").append(describe(fragment.ports(PortDirection.OUTPUT).keySet())).append('\n');
    builder.append(indent).append("inouts: ").append(describe(fragment.ports(PortDirection.INOUT).keySet())).append('\n');
    builder.append(indent).append("signals: ").append(describe(fragment.signals())).append('\n');
    if (!fragment.domains().isEmpty())
      builder.append(indent).append("domains: ").append(String.join(", ", fragment.domains().keySet())).append('\n');
    for (Fragment.NamedInstance named : fragment.instances())
      builder.append(indent).append("instance ").append(named.name()).append(": ").append(named.instance().getType()).append('\n');
    for (Fragment.Subfragment sub : fragment.subfragments()) {
      builder.append(indent).append("subfragment ").append(sub.name() == null ? "<unnamed>" : sub.name()).append(":\n");
      format(sub.fragment(), indent + "  ", builder);
    }
  }

  /** @return the signals as a comma separated list */
  public static String describe(Collection<Signal> signals) {
    return signals.stream().map(FragmentInfo::describe).collect(Collectors.joining(", "));
  }

  public static String describe(Signal signal) {
    return String.format("%s(%d%s)", signal.getName(), signal.width(), signal.shape().isSigned() ? ", signed" : "");
  }
}
