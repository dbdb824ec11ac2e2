package com.contextsmith.daac;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import com.contextsmith.daac.utils.FileUtil;

/**
 * Construction limits. Defaults are read from {@value #CONFIG_PROP_FILE} on
 * the class path; system properties with the same keys take precedence.
 */
public final class AutomatonConfig {
  public static final String CONFIG_PROP_FILE = "daac.properties";

  public static final String MAX_PATTERN_LENGTH_KEY = "daac.max.pattern.length";
  public static final String MAX_ARRAY_SIZE_KEY = "daac.max.array.size";
  public static final String MAX_SLOT_TRIALS_KEY = "daac.max.slot.trials";

  public static final int DEFAULT_MAX_PATTERN_LENGTH = 1 << 20;
  // The largest array size most JVMs will allocate.
  public static final int DEFAULT_MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;
  public static final int DEFAULT_MAX_SLOT_TRIALS = 16;

  private static AutomatonConfig defaults = null;

  public static synchronized AutomatonConfig getDefaults() {
    if (defaults == null) {
      defaults = fromProperties(FileUtil.loadProperties(CONFIG_PROP_FILE));
    }
    return defaults;
  }

  public static AutomatonConfig fromProperties(Properties props) {
    return new AutomatonConfig(
        readInt(props, MAX_PATTERN_LENGTH_KEY, DEFAULT_MAX_PATTERN_LENGTH),
        readInt(props, MAX_ARRAY_SIZE_KEY, DEFAULT_MAX_ARRAY_SIZE),
        readInt(props, MAX_SLOT_TRIALS_KEY, DEFAULT_MAX_SLOT_TRIALS));
  }

  private static int readInt(Properties props, String key, int defaultValue) {
    String value = System.getProperty(key);
    if (StringUtils.isBlank(value)) value = props.getProperty(key);
    if (StringUtils.isBlank(value)) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Property '%s' is not an integer: %s", key, value), e);
    }
  }

  private final int maxPatternLength;
  private final int maxArraySize;
  private final int maxSlotTrials;

  public AutomatonConfig(int maxPatternLength, int maxArraySize,
                         int maxSlotTrials) {
    checkArgument(maxPatternLength > 0, "Max pattern length must be positive");
    checkArgument(maxArraySize > 0, "Max array size must be positive");
    checkArgument(maxSlotTrials > 0, "Max slot trials must be positive");
    this.maxPatternLength = maxPatternLength;
    this.maxArraySize = maxArraySize;
    this.maxSlotTrials = maxSlotTrials;
  }

  public int getMaxArraySize() {
    return this.maxArraySize;
  }

  public int getMaxPatternLength() {
    return this.maxPatternLength;
  }

  public int getMaxSlotTrials() {
    return this.maxSlotTrials;
  }

  public AutomatonConfig withMaxArraySize(int maxArraySize) {
    return new AutomatonConfig(this.maxPatternLength, maxArraySize,
                               this.maxSlotTrials);
  }

  public AutomatonConfig withMaxPatternLength(int maxPatternLength) {
    return new AutomatonConfig(maxPatternLength, this.maxArraySize,
                               this.maxSlotTrials);
  }

  public AutomatonConfig withMaxSlotTrials(int maxSlotTrials) {
    return new AutomatonConfig(this.maxPatternLength, this.maxArraySize,
                               maxSlotTrials);
  }

  @Override
  public String toString() {
    return String.format("maxPatternLength:%d maxArraySize:%d maxSlotTrials:%d",
                         this.maxPatternLength, this.maxArraySize,
                         this.maxSlotTrials);
  }
}
