package hwcspec.ui;

import hwcspec.data.CounterVisibility;

/**
 * Data-Class to hold tool options.
 */
public class HWCSpecConfig {

  public String database_dir = "";
  public boolean overwrite = false;

  /** Product to list counter expressions for; empty to list nothing. */
  public String product = "";
  public CounterVisibility max_visibility = CounterVisibility.INTERNAL;
  public boolean allow_derived = true;
}
