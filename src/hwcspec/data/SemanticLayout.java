package hwcspec.data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Recommended presentation order of all counters: sections, then groups, then counters.
 * <p>
 * Section and group names are meant to be globally unique, counter names unique within their group.
 * The layout keeps duplicates in load order so that validation can report them.
 * Groups are named by counter group name, counters by counter group human name.
 */
public class SemanticLayout {

  public record Counter(String name) {}

  public record Group(String name, List<Counter> counters) {
    public Group {
      counters = List.copyOf(counters);
    }
  }

  public record Section(String name, List<Group> groups) {
    public Section {
      groups = List.copyOf(groups);
    }
  }

  private final List<Section> sections = new ArrayList<>();

  public void append(Section section) { sections.add(section); }

  public List<Section> sections() { return sections; }

  public Stream<Group> groups() { return sections.stream().flatMap(section -> section.groups().stream()); }
}
