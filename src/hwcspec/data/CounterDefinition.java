package hwcspec.data;

import hwcspec.equation.ParsedEquation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How a counter obtains its value: read from a hardware slot, or computed from an equation.
 */
public sealed interface CounterDefinition permits CounterDefinition.Hardware, CounterDefinition.Equation {

  /**
   * Native counter read from the hardware.
   * @param sourceName primary hardware name
   * @param aliases other hardware names the counter is known as on some products, sorted
   */
  record Hardware(String sourceName, List<String> aliases) implements CounterDefinition {
    public Hardware {
      Objects.requireNonNull(sourceName);
      aliases = aliases.stream().filter(alias -> !alias.equals(sourceName)).sorted().distinct().toList();
    }

    /** @return the source name followed by the aliases, in search order */
    public List<String> sourceNames() {
      List<String> ret = new ArrayList<>(aliases.size() + 1);
      ret.add(sourceName);
      ret.addAll(aliases);
      return ret;
    }
  }

  /** Derived counter. */
  record Equation(ParsedEquation equation) implements CounterDefinition {
    public Equation {
      Objects.requireNonNull(equation);
    }
  }
}
