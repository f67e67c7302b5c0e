package hwcspec.data;

import hwcspec.equation.EquationPrinter;
import hwcspec.equation.ParsedEquation;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Writes the counter database back to its YAML files in normalized form.
 * Field order is fixed, equations are pretty-printed, and assigned stable IDs are persisted.
 */
public class SpecWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Yaml yaml;

  public SpecWriter() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setWidth(120);
    this.yaml = new Yaml(options);
  }

  /**
   * Converts a counter entry into its serial form.
   * @param counter the counter entry
   * @return ordered field map
   */
  public static Map<String, Object> toSerial(CounterInfo counter) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("machine_name", counter.getMachineName());
    counter.getStableId().ifPresent(id -> ret.put("stable_id", id));
    ret.put("human_name", counter.getHumanName());
    ret.put("group_name", counter.getGroupName());
    ret.put("group_human_name", counter.getGroupHumanName());
    ret.put("short_description", counter.getShortDescription());
    ret.put("long_description", counter.getLongDescription());
    ret.put("units", counter.getUnits());
    ret.put("trend", counter.getTrend().serialName);
    ret.put("visibility", counter.getVisibility().serialName);
    if (counter.getDefinition() instanceof CounterDefinition.Hardware hardware) {
      ret.put("source", hardware.sourceName());
      if (!hardware.aliases().isEmpty())
        ret.put("aliases", new ArrayList<>(hardware.aliases()));
    } else if (counter.getDefinition() instanceof CounterDefinition.Equation equation) {
      ParsedEquation parsed = equation.equation();
      ret.put("equation", parsed.ast().map(EquationPrinter::print).orElse(parsed.text()));
    }
    ret.put("gpu_support", new ArrayList<>(counter.getGpuSupport()));
    return ret;
  }

  /**
   * Serializes the entries of one counter file.
   * @param counters the entries, in file order
   * @return the YAML text
   */
  public String toYaml(List<CounterInfo> counters) {
    return yaml.dump(counters.stream().map(SpecWriter::toSerial).toList());
  }

  /**
   * Rewrites every counter file below the database directory.
   * @param counters the counter database
   * @param counterDir the directory holding the counter files
   * @throws IOException if a file cannot be written
   */
  public void writeCounters(CounterInfos counters, File counterDir) throws IOException {
    for (var fileEntries : counters.bySourceFile().entrySet()) {
      File file = new File(counterDir, fileEntries.getKey());
      try (Writer out = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
        out.write(toYaml(fileEntries.getValue()));
      }
      logger.info("Wrote {} counters to {}", fileEntries.getValue().size(), file);
    }
  }
}
