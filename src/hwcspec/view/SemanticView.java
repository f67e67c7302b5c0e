package hwcspec.view;

import hwcspec.data.CounterVisibility;
import hwcspec.data.MissingDocumentationException;
import hwcspec.data.SemanticInfos;
import hwcspec.data.SemanticLayout;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counters of one product in presentation order: sections, groups, counters.
 * Sections and groups without counters for the product are left out.
 */
public class SemanticView {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public record GroupView(String name, String longDescription, List<CounterView> counters) {
    public GroupView {
      counters = List.copyOf(counters);
    }

    public String getAnchor() { return "g_" + anchorName(name); }
  }

  public record SectionView(String name, String longDescription, List<GroupView> groups) {
    public SectionView {
      groups = List.copyOf(groups);
    }

    public String getAnchor() { return "s_" + anchorName(name); }
  }

  private final List<SectionView> sections;

  private SemanticView(List<SectionView> sections) { this.sections = List.copyOf(sections); }

  static String anchorName(String name) {
    StringBuilder ret = new StringBuilder();
    for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
      if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9'))
        ret.append(c);
    }
    return ret.toString();
  }

  /**
   * Projects an indexed view onto the presentation layout.
   * A section or group without a documentation entry for the product does not apply to it and is skipped.
   * @param databaseKey the product database key, used to select documentation
   * @param layout the presentation layout
   * @param sectionInfos section documentation
   * @param groupInfos group documentation
   * @param view the product view
   * @return the semantic view
   */
  public static SemanticView build(String databaseKey, SemanticLayout layout, SemanticInfos sectionInfos, SemanticInfos groupInfos,
                                   IndexedView view) {
    List<SectionView> sections = new ArrayList<>();
    for (SemanticLayout.Section section : layout.sections()) {
      String sectionDoc;
      try {
        sectionDoc = sectionInfos.getInfoFor(databaseKey, section.name()).longDescription();
      } catch (MissingDocumentationException e) {
        logger.debug("Section {} skipped for {}: {}", section.name(), databaseKey, e.getMessage());
        continue;
      }
      List<GroupView> groups = new ArrayList<>();
      for (SemanticLayout.Group group : section.groups())
        buildGroup(databaseKey, group, groupInfos, view).ifPresent(groups::add);
      if (!groups.isEmpty())
        sections.add(new SectionView(section.name(), sectionDoc, groups));
    }
    return new SemanticView(sections);
  }

  private static Optional<GroupView> buildGroup(String databaseKey, SemanticLayout.Group group, SemanticInfos groupInfos, IndexedView view) {
    String groupDoc;
    try {
      groupDoc = groupInfos.getInfoFor(databaseKey, group.name()).longDescription();
    } catch (MissingDocumentationException e) {
      logger.debug("Group {} skipped for {}: {}", group.name(), databaseKey, e.getMessage());
      return Optional.empty();
    }
    // Products need not implement every counter of a group
    List<CounterView> counters = group.counters()
                                     .stream()
                                     .map(counter -> view.getByGroupNames(group.name(), counter.name()))
                                     .flatMap(Optional::stream)
                                     .toList();
    if (counters.isEmpty())
      return Optional.empty();
    return Optional.of(new GroupView(group.name(), groupDoc, counters));
  }

  public List<SectionView> sections() { return sections; }

  public Stream<GroupView> groups() { return sections.stream().flatMap(section -> section.groups().stream()); }

  public Stream<CounterView> counters() { return groups().flatMap(group -> group.counters().stream()); }

  /**
   * Creates a filtered copy, dropping groups and sections left empty.
   * @param maxVisibility the highest visibility level kept
   * @param allowDerived whether derived counters are kept
   * @return the filtered view
   */
  public SemanticView filter(CounterVisibility maxVisibility, boolean allowDerived) {
    List<SectionView> filteredSections = new ArrayList<>();
    for (SectionView section : sections) {
      List<GroupView> filteredGroups = new ArrayList<>();
      for (GroupView group : section.groups()) {
        var counters = group.counters().stream().filter(counter -> IndexedView.isShown(counter, maxVisibility, allowDerived)).toList();
        if (!counters.isEmpty())
          filteredGroups.add(new GroupView(group.name(), group.longDescription(), counters));
      }
      if (!filteredGroups.isEmpty())
        filteredSections.add(new SectionView(section.name(), section.longDescription(), filteredGroups));
    }
    return new SemanticView(filteredSections);
  }
}
